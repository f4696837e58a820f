package org.repogov.governance.hierarchy;

import org.repogov.vcsclient.model.VcsGroup;
import org.repogov.vcsclient.model.VcsProject;

import java.util.List;
import java.util.Objects;

/**
 * A group resolved from the remote service during one walker session.
 * <p>
 * The remote snapshot never changes; only the child caches are filled in, once,
 * the first time the walker needs them. Identity is the remote group ID.
 */
public final class GroupNode implements NamespaceNode {

    private final VcsGroup group;
    private List<VcsGroup> subgroups;
    private List<VcsProject> projects;

    public GroupNode(VcsGroup group) {
        this.group = Objects.requireNonNull(group, "group");
    }

    @Override
    public long id() {
        return group.id();
    }

    public String name() {
        return group.name();
    }

    public String path() {
        return group.path();
    }

    @Override
    public String fullPath() {
        return group.fullPath();
    }

    /**
     * @return ID of the parent group, or null for a top-level group
     */
    public Long parentId() {
        return group.parentId();
    }

    public VcsGroup group() {
        return group;
    }

    boolean hasCachedSubgroups() {
        return subgroups != null;
    }

    List<VcsGroup> cachedSubgroups() {
        return subgroups;
    }

    void cacheSubgroups(List<VcsGroup> subgroups) {
        this.subgroups = List.copyOf(subgroups);
    }

    boolean hasCachedProjects() {
        return projects != null;
    }

    List<VcsProject> cachedProjects() {
        return projects;
    }

    void cacheProjects(List<VcsProject> projects) {
        this.projects = List.copyOf(projects);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupNode other)) return false;
        return group.id() == other.group.id();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(group.id());
    }

    @Override
    public String toString() {
        return "GroupNode{" + fullPath() + "}";
    }
}
