package org.repogov.vcsclient.model;

import java.util.Map;

/**
 * Represents a GitLab project as returned by the projects API.
 * <p>
 * {@code attributes} keeps the full attribute map of the response so that
 * policy checks can compare any project setting by its API name.
 */
public record VcsProject(
    /**
     * Numeric project ID.
     */
    long id,

    /**
     * Project name.
     */
    String name,

    /**
     * Project path (slug) within its namespace.
     */
    String path,

    /**
     * Full path including namespace, e.g. {@code Framestore/team-a/widget}.
     */
    String pathWithNamespace,

    /**
     * Project description, may be null.
     */
    String description,

    /**
     * ID of the user who created the project.
     */
    Long creatorId,

    /**
     * ISO-8601 timestamp of the last activity.
     */
    String lastActivityAt,

    /**
     * SSH clone/push URL.
     */
    String sshUrlToRepo,

    /**
     * Web URL.
     */
    String webUrl,

    /**
     * Raw attribute map of the API response.
     */
    Map<String, Object> attributes
) {
    /**
     * Check whether the remote resource exposes an attribute (even with a null value).
     */
    public boolean hasAttribute(String name) {
        return attributes != null && attributes.containsKey(name);
    }

    public Object attribute(String name) {
        return attributes != null ? attributes.get(name) : null;
    }
}
