package org.repogov.governance.policy;

import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.gitlab.GitLabException;
import org.repogov.vcsclient.model.VcsIntegration;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Slack notifications for merge request and job events, posted to the configured webhook.
 * Without a configured webhook the policy has nothing to enforce.
 */
public class SlackNotificationPolicy extends AbstractProjectPolicy {

    static final String SLUG = "slack";
    static final String WEBHOOK_PROPERTY = "webhook";

    private final String webhook;

    public SlackNotificationPolicy(VcsClient client, boolean dryRun, String webhook) {
        super(client, dryRun);
        this.webhook = webhook == null || webhook.isBlank() ? null : webhook;
    }

    @Override
    public String name() {
        return "slack-notifications";
    }

    @Override
    public List<CheckResult> check(ProjectNode project) throws IOException {
        if (webhook == null) {
            return List.of(CheckResult.ok(project.fullPath(), "no Slack webhook configured"));
        }

        Optional<VcsIntegration> integration = findIntegration(project);
        if (integration.isEmpty() || !integration.get().active()) {
            return List.of(CheckResult.error(project.fullPath(), "Slack integration not found"));
        }

        String configured = integration.get().property(WEBHOOK_PROPERTY);
        if (webhook.equals(configured)) {
            return List.of(CheckResult.ok(project.fullPath(), "Slack notification matches config"));
        }
        return List.of(CheckResult.warning(project.fullPath(), String.format(
                "Slack notification mismatch. Expected '%s', got '%s'", webhook, configured)));
    }

    @Override
    public List<CheckResult> converge(ProjectNode project) throws IOException {
        if (webhook == null) {
            return List.of();
        }

        Optional<VcsIntegration> integration = findIntegration(project);
        if (integration.isPresent() && integration.get().active()
                && webhook.equals(integration.get().property(WEBHOOK_PROPERTY))) {
            return List.of(CheckResult.ok(project.fullPath(), "Slack notification matches config"));
        }

        CheckResult result = action(project, "creating slack integration for merge requests");
        if (!dryRun) {
            client.updateIntegration(project.id(), SLUG, eventProfile(webhook));
        }
        return List.of(result);
    }

    /**
     * A missing integration is a normal negative answer; any other remote error propagates.
     */
    private Optional<VcsIntegration> findIntegration(ProjectNode project) throws IOException {
        try {
            return Optional.of(client.getIntegration(project.id(), SLUG));
        } catch (GitLabException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Only merge request and job events are enabled.
     */
    static Map<String, Object> eventProfile(String webhook) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("webhook", webhook);
        data.put("branches_to_be_notified", "all");
        data.put("notify_only_broken_pipelines", false);
        data.put("push_events", false);
        data.put("issues_events", false);
        data.put("confidential_issues_events", false);
        data.put("merge_requests_events", true);
        data.put("note_events", false);
        data.put("confidential_note_events", false);
        data.put("tag_push_events", false);
        data.put("pipeline_events", false);
        data.put("wiki_page_events", false);
        data.put("deployment_events", false);
        data.put("job_events", true);
        data.put("commit_events", false);
        return data;
    }
}
