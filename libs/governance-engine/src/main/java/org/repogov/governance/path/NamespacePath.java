package org.repogov.governance.path;

import java.util.Arrays;
import java.util.List;

/**
 * An immutable, slash-separated namespace path such as {@code Framestore/team-a/widget}.
 *
 * @param segments path segments from the top-level namespace down
 */
public record NamespacePath(List<String> segments) {

    public static final String SEPARATOR = "/";

    public NamespacePath {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Namespace path needs at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public static NamespacePath of(String... segments) {
        return new NamespacePath(Arrays.asList(segments));
    }

    public String root() {
        return segments.get(0);
    }

    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size();
    }

    /**
     * @return the path without its last segment, or null for a single-segment path
     */
    public NamespacePath parent() {
        if (segments.size() == 1) {
            return null;
        }
        return new NamespacePath(segments.subList(0, segments.size() - 1));
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, segments);
    }
}
