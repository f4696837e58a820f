package org.repogov.cli.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.repogov.vcsclient.gitlab.GitLabConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code repogov.*}. The command to run and its arguments are bound
 * the same way, e.g. {@code --repogov.command=check --repogov.target=team-a}.
 */
@Validated
@ConfigurationProperties(prefix = "repogov")
public class RepogovProperties {

    @Valid
    private Gitlab gitlab = new Gitlab();

    private Slack slack = new Slack();

    @NotBlank
    private String rootGroup = "Framestore";

    @NotBlank
    private String usersGroup = "Framestore/users";

    @NotBlank
    private String primaryBranch = "master";

    private boolean dryRun = false;

    /**
     * Usernames or emails of the approvers put on a newly created approval rule.
     */
    private List<String> approvers = new ArrayList<>();

    private String command;
    private String target;
    private String username;
    private String legacyPath;

    public Gitlab getGitlab() {
        return gitlab;
    }

    public void setGitlab(Gitlab gitlab) {
        this.gitlab = gitlab;
    }

    public Slack getSlack() {
        return slack;
    }

    public void setSlack(Slack slack) {
        this.slack = slack;
    }

    public String getRootGroup() {
        return rootGroup;
    }

    public void setRootGroup(String rootGroup) {
        this.rootGroup = rootGroup;
    }

    public String getUsersGroup() {
        return usersGroup;
    }

    public void setUsersGroup(String usersGroup) {
        this.usersGroup = usersGroup;
    }

    public String getPrimaryBranch() {
        return primaryBranch;
    }

    public void setPrimaryBranch(String primaryBranch) {
        this.primaryBranch = primaryBranch;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public List<String> getApprovers() {
        return approvers;
    }

    public void setApprovers(List<String> approvers) {
        this.approvers = approvers;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getLegacyPath() {
        return legacyPath;
    }

    public void setLegacyPath(String legacyPath) {
        this.legacyPath = legacyPath;
    }

    public static class Gitlab {

        @NotBlank
        private String baseUrl = GitLabConfig.API_BASE;

        @NotBlank
        private String token;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }

    public static class Slack {

        /**
         * Incoming webhook URL; leave empty to skip notification checks.
         */
        private String webhook;

        public String getWebhook() {
            return webhook;
        }

        public void setWebhook(String webhook) {
            this.webhook = webhook;
        }
    }
}
