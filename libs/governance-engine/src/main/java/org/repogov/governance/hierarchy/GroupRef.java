package org.repogov.governance.hierarchy;

import java.util.Objects;

/**
 * The ways a caller can identify a group: by remote ID, by namespace path,
 * or by a node it already holds. {@link HierarchyWalker#resolveGroup(GroupRef)}
 * turns any of them into a {@link GroupNode}.
 */
public sealed interface GroupRef {

    record ById(long id) implements GroupRef {
    }

    record ByPath(String path) implements GroupRef {
    }

    record Resolved(GroupNode node) implements GroupRef {
        public Resolved {
            Objects.requireNonNull(node, "node");
        }
    }

    static GroupRef of(long id) {
        return new ById(id);
    }

    /**
     * @param path namespace path, rooted automatically; null or blank means the root group
     */
    static GroupRef of(String path) {
        return new ByPath(path);
    }

    static GroupRef of(GroupNode node) {
        return new Resolved(node);
    }
}
