package org.repogov.governance.exception;

/**
 * The remote service has no group at the requested path.
 * Callers may recover by reading the last path segment as a project instead.
 */
public class GroupNotFoundException extends GovernanceException {

    private final String groupPath;

    public GroupNotFoundException(String groupPath, Throwable cause) {
        super("Cannot find group '" + groupPath + "'", cause);
        this.groupPath = groupPath;
    }

    public String getGroupPath() {
        return groupPath;
    }
}
