package org.repogov.governance.hierarchy;

import org.repogov.vcsclient.model.VcsProject;

import java.util.Objects;

/**
 * A read-mostly project snapshot together with the group that owns it.
 * Changes are made through the remote client and are not written back here.
 *
 * @param project full project resource as fetched from the remote service
 * @param group owning group
 */
public record ProjectNode(VcsProject project, GroupNode group) implements NamespaceNode {

    public ProjectNode {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(group, "group");
    }

    @Override
    public long id() {
        return project.id();
    }

    @Override
    public String fullPath() {
        return project.pathWithNamespace();
    }

    public String name() {
        return project.name();
    }

    public String path() {
        return project.path();
    }

    public String sshUrl() {
        return project.sshUrlToRepo();
    }

    public String webUrl() {
        return project.webUrl();
    }
}
