package org.repogov.governance.exception;

public class ProjectNotFoundException extends GovernanceException {

    private final String projectName;

    public ProjectNotFoundException(String projectName, String groupPath) {
        super("Cannot find project '" + projectName + "' in group '" + groupPath + "'");
        this.projectName = projectName;
    }

    public String getProjectName() {
        return projectName;
    }
}
