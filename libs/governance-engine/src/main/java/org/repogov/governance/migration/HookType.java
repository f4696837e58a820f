package org.repogov.governance.migration;

/**
 * Git hooks written into legacy repositories. Each template has a single {@code %s}
 * placeholder for the push URL of the new project.
 */
public enum HookType {

    /**
     * Forwards every update to the new project.
     */
    POST_UPDATE("post-update", """
            #!/bin/sh

            echo "Pushing to Gitlab mirror"

            git push -f --mirror %s

            """),

    /**
     * Rejects every push and tells the user where the project went.
     */
    PRE_RECEIVE("pre-receive", """
            #!/bin/sh

            cat<< EOM
            *************************************************************************
            *
            *  This project has moved to Gitlab
            *
            *  Please update your project URL using:
            *  git remote set-url origin %s
            *
            *************************************************************************
            EOM

            exit 1
            """);

    private final String fileName;
    private final String template;

    HookType(String fileName, String template) {
        this.fileName = fileName;
        this.template = template;
    }

    public String getFileName() {
        return fileName;
    }

    public String render(String pushUrl) {
        return String.format(template, pushUrl);
    }
}
