package org.repogov.governance.path;

import org.repogov.governance.exception.InvalidPathException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and roots human-supplied namespace paths. Pure: never talks to the remote service.
 */
public class PathResolver {

    private static final Pattern PROJECT_PATH = Pattern.compile("^(?:([\\w/-]+)/)?([\\w-]+)(?:\\.git)?$");
    private static final Pattern PROJECT_NAME = Pattern.compile("^[a-z-]+$");

    private final String rootName;

    public PathResolver(String rootName) {
        if (rootName == null || rootName.isBlank() || rootName.contains(NamespacePath.SEPARATOR)) {
            throw new IllegalArgumentException("Root namespace must be a single non-blank segment: " + rootName);
        }
        this.rootName = rootName;
    }

    public String getRootName() {
        return rootName;
    }

    /**
     * Split a {@code group/subgroup/project[.git]} string into group and project parts.
     *
     * @throws InvalidPathException if the string is not a valid project path
     */
    public ResolvedPath resolvePath(String raw) {
        if (raw == null) {
            throw new InvalidPathException("Project path must not be empty");
        }
        Matcher matcher = PROJECT_PATH.matcher(raw);
        if (!matcher.matches()) {
            throw new InvalidPathException("Invalid project path '" + raw + "'");
        }
        return new ResolvedPath(matcher.group(1), matcher.group(2));
    }

    /**
     * Anchor a group path under the root namespace, prepending the root when the first
     * segment is not already the root (case-insensitive). A null or blank path is the root itself.
     */
    public NamespacePath rootedPath(String groupPath) {
        List<String> segments = new ArrayList<>();
        if (groupPath != null && !groupPath.isBlank()) {
            for (String segment : groupPath.split(NamespacePath.SEPARATOR, -1)) {
                if (segment.isBlank()) {
                    throw new InvalidPathException("Empty segment in namespace path '" + groupPath + "'");
                }
                segments.add(segment);
            }
        }
        if (segments.isEmpty() || !segments.get(0).equalsIgnoreCase(rootName)) {
            segments.add(0, rootName);
        }
        return new NamespacePath(segments);
    }

    /**
     * Project names must be lowercase letters and dashes only.
     *
     * @throws InvalidPathException otherwise
     */
    public static void validateProjectName(String name) {
        if (!isValidProjectName(name)) {
            throw new InvalidPathException("'" + name + "' needs to be lowercase and dashes only");
        }
    }

    public static boolean isValidProjectName(String name) {
        return name != null && PROJECT_NAME.matcher(name).matches();
    }
}
