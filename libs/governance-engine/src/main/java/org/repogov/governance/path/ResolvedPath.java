package org.repogov.governance.path;

import java.util.Optional;

/**
 * A raw {@code group/subgroup/project} string split into its group part and leaf name.
 *
 * @param groupPath group part, or null when the input had no separator
 * @param projectName leaf segment with any {@code .git} suffix removed
 */
public record ResolvedPath(String groupPath, String projectName) {

    public Optional<String> group() {
        return Optional.ofNullable(groupPath);
    }
}
