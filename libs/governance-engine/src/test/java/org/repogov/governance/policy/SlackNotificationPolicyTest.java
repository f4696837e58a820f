package org.repogov.governance.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.gitlab.GitLabException;
import org.repogov.vcsclient.model.VcsIntegration;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.repogov.governance.Fixtures.projectNode;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackNotificationPolicy")
class SlackNotificationPolicyTest {

    private static final String WEBHOOK = "https://hooks.slack.com/services/T000/B000/XXXX";

    @Mock
    private VcsClient client;

    private final ProjectNode project = projectNode(10, "Framestore/team-a/widget");

    private SlackNotificationPolicy policy(String webhook, boolean dryRun) {
        return new SlackNotificationPolicy(client, dryRun, webhook);
    }

    private static VcsIntegration slack(boolean active, String webhook) {
        return new VcsIntegration("slack", active, Map.of("webhook", webhook));
    }

    @Test
    @DisplayName("should pass trivially and do nothing without a configured webhook")
    void shouldSkipWithoutWebhook() throws Exception {
        SlackNotificationPolicy policy = policy("", false);

        assertThat(policy.check(project)).singleElement()
                .extracting(CheckResult::severity).isEqualTo(Severity.OK);
        assertThat(policy.converge(project)).isEmpty();
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("should report a missing integration as an error")
    void shouldReportMissingIntegration() throws Exception {
        when(client.getIntegration(10, "slack")).thenThrow(new GitLabException("get integration", 404, "Not Found"));

        List<CheckResult> results = policy(WEBHOOK, false).check(project);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.isError()).isTrue();
            assertThat(result.message()).isEqualTo("Slack integration not found");
        });
    }

    @Test
    @DisplayName("should report an inactive integration as an error")
    void shouldReportInactiveIntegration() throws Exception {
        when(client.getIntegration(10, "slack")).thenReturn(slack(false, WEBHOOK));

        assertThat(policy(WEBHOOK, false).check(project)).singleElement()
                .extracting(CheckResult::isError).isEqualTo(true);
    }

    @Test
    @DisplayName("should pass a matching webhook")
    void shouldPassMatchingWebhook() throws Exception {
        when(client.getIntegration(10, "slack")).thenReturn(slack(true, WEBHOOK));

        assertThat(policy(WEBHOOK, false).check(project)).singleElement().satisfies(result -> {
            assertThat(result.severity()).isEqualTo(Severity.OK);
            assertThat(result.message()).isEqualTo("Slack notification matches config");
        });
    }

    @Test
    @DisplayName("should warn with both values on a different webhook")
    void shouldWarnOnMismatch() throws Exception {
        when(client.getIntegration(10, "slack")).thenReturn(slack(true, "https://hooks.slack.com/old"));

        assertThat(policy(WEBHOOK, false).check(project)).singleElement().satisfies(result -> {
            assertThat(result.severity()).isEqualTo(Severity.WARNING);
            assertThat(result.message()).isEqualTo(
                    "Slack notification mismatch. Expected '" + WEBHOOK + "', got 'https://hooks.slack.com/old'");
        });
    }

    @Test
    @DisplayName("should propagate remote errors other than not-found")
    void shouldPropagateOtherErrors() throws Exception {
        GitLabException serverError = new GitLabException("get integration", 500, "boom");
        when(client.getIntegration(10, "slack")).thenThrow(serverError);

        assertThatThrownBy(() -> policy(WEBHOOK, false).check(project)).isSameAs(serverError);
    }

    @Test
    @DisplayName("should create the integration with merge request and job events only")
    @SuppressWarnings("unchecked")
    void shouldCreateIntegration() throws Exception {
        when(client.getIntegration(10, "slack")).thenThrow(new GitLabException("get integration", 404, "Not Found"));

        List<CheckResult> results = policy(WEBHOOK, false).converge(project);

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(client).updateIntegration(eq(10L), eq("slack"), captor.capture());
        Map<String, Object> data = captor.getValue();
        assertThat(data).containsEntry("webhook", WEBHOOK)
                .containsEntry("branches_to_be_notified", "all")
                .containsEntry("notify_only_broken_pipelines", false)
                .containsEntry("merge_requests_events", true)
                .containsEntry("job_events", true);
        assertThat(data.entrySet().stream()
                .filter(entry -> entry.getKey().endsWith("_events") && Boolean.TRUE.equals(entry.getValue()))
                .map(Map.Entry::getKey))
                .containsExactlyInAnyOrder("merge_requests_events", "job_events");
        assertThat(results).singleElement().satisfies(result -> assertThat(result.message())
                .isEqualTo("creating slack integration for merge requests"));
    }

    @Test
    @DisplayName("should not touch the integration in a dry run")
    void shouldNotMutateInDryRun() throws Exception {
        when(client.getIntegration(10, "slack")).thenReturn(slack(true, "https://hooks.slack.com/old"));

        List<CheckResult> results = policy(WEBHOOK, true).converge(project);

        verify(client, never()).updateIntegration(anyLong(), anyString(), anyMap());
        assertThat(results).singleElement().satisfies(result -> assertThat(result.message()).endsWith(" - DRY RUN"));
    }
}
