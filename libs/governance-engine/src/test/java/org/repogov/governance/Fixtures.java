package org.repogov.governance;

import org.repogov.governance.hierarchy.GroupNode;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.model.VcsGroup;
import org.repogov.vcsclient.model.VcsProject;

import java.util.Map;

/**
 * Remote resources shaped like GitLab responses, for tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static VcsGroup group(long id, String fullPath, Long parentId) {
        String path = fullPath.substring(fullPath.lastIndexOf('/') + 1);
        return new VcsGroup(id, path, path, fullPath, parentId);
    }

    public static VcsProject project(long id, String pathWithNamespace) {
        return project(id, pathWithNamespace, Map.of());
    }

    public static VcsProject project(long id, String pathWithNamespace, Map<String, Object> attributes) {
        String path = pathWithNamespace.substring(pathWithNamespace.lastIndexOf('/') + 1);
        return new VcsProject(id, path, path, pathWithNamespace, null, 4L, "2023-04-05T10:15:30.000Z",
                "git@gitlab.example.com:" + pathWithNamespace + ".git",
                "https://gitlab.example.com/" + pathWithNamespace,
                attributes);
    }

    public static ProjectNode projectNode(long id, String pathWithNamespace) {
        return projectNode(project(id, pathWithNamespace));
    }

    public static ProjectNode projectNode(VcsProject project) {
        String pathWithNamespace = project.pathWithNamespace();
        String groupPath = pathWithNamespace.substring(0, pathWithNamespace.lastIndexOf('/'));
        return new ProjectNode(project, new GroupNode(group(1000 + project.id(), groupPath, null)));
    }
}
