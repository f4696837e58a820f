package org.repogov.governance.hierarchy;

/**
 * A node produced by a namespace walk: either a group or a project.
 */
public sealed interface NamespaceNode permits GroupNode, ProjectNode {

    long id();

    String fullPath();
}
