package org.repogov.vcsclient.model;

/**
 * One entry of a protected branch's push or merge access list.
 *
 * @param accessLevel raw GitLab access level
 * @param description human readable description, e.g. "Developers + Maintainers"
 */
public record VcsAccessGrant(
    int accessLevel,
    String description
) {
}
