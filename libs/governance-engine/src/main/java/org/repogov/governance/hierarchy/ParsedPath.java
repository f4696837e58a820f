package org.repogov.governance.hierarchy;

/**
 * Result of interpreting a namespace string: the group it names, and the project
 * when the last segment turned out to be a project rather than a group.
 */
public record ParsedPath(GroupNode group, ProjectNode project) {

    public boolean isProject() {
        return project != null;
    }
}
