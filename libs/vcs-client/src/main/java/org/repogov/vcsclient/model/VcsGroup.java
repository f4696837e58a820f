package org.repogov.vcsclient.model;

/**
 * Represents a GitLab group (namespace).
 *
 * @param id numeric group ID
 * @param name display name
 * @param path last path segment
 * @param fullPath full namespace path, e.g. {@code Framestore/team-a}
 * @param parentId ID of the parent group, or null for a top-level group
 */
public record VcsGroup(
    long id,
    String name,
    String path,
    String fullPath,
    Long parentId
) {
}
