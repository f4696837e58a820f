package org.repogov.vcsclient.model;

/**
 * Represents a direct member of a group with their raw access level.
 *
 * @param userId user ID
 * @param username the user's login
 * @param accessLevel raw GitLab access level, see {@link AccessLevel}
 */
public record VcsMember(
    long userId,
    String username,
    int accessLevel
) {
}
