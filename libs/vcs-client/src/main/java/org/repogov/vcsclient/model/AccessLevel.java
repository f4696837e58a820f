package org.repogov.vcsclient.model;

/**
 * GitLab access levels, as returned in member listings and branch protection rules.
 */
public enum AccessLevel {
    NO_ACCESS(0, "none"),
    MINIMAL(5, "minimal"),
    GUEST(10, "guest"),
    REPORTER(20, "reporter"),
    DEVELOPER(30, "developer"),
    MAINTAINER(40, "maintainer"),
    OWNER(50, "owner");

    private final int value;
    private final String label;

    AccessLevel(int value, String label) {
        this.value = value;
        this.label = label;
    }

    public int getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Map a raw GitLab access level to its tier.
     *
     * @throws IllegalArgumentException if GitLab reports a level this table does not know
     */
    public static AccessLevel fromValue(int value) {
        for (AccessLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown GitLab access level: " + value);
    }
}
