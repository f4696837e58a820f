package org.repogov.governance.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.repogov.governance.exception.PolicyConfigurationException;
import org.repogov.governance.exception.UserNotFoundException;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.model.VcsApprovalRule;
import org.repogov.vcsclient.model.VcsApprovalSettings;
import org.repogov.vcsclient.model.VcsUser;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.repogov.governance.Fixtures.project;
import static org.repogov.governance.Fixtures.projectNode;

@ExtendWith(MockitoExtension.class)
@DisplayName("MergeRequestPolicy")
class MergeRequestPolicyTest {

    private static final VcsApprovalRule DEFAULT_RULE = new VcsApprovalRule(7, "Default", 1, "regular");

    @Mock
    private VcsClient client;

    private final PolicyExpectation expectation = PolicyExpectation.defaults();

    private MergeRequestPolicy policy(boolean dryRun) {
        return new MergeRequestPolicy(client, dryRun, expectation, List.of("jdoe"));
    }

    private static ProjectNode projectWith(Map<String, Object> mergeSettings) {
        Map<String, Object> attributes = new LinkedHashMap<>(mergeSettings);
        attributes.put("id", 10);
        return projectNode(project(10, "Framestore/team-a/widget", attributes));
    }

    private ProjectNode compliantProject() {
        return projectWith(expectation.getMergeSettings());
    }

    private void givenApprovalSettings(Map<String, Object> settings) throws Exception {
        when(client.getApprovalSettings(10)).thenReturn(new VcsApprovalSettings(settings));
    }

    @Nested
    @DisplayName("merge setting comparison")
    class MergeSettingComparison {

        @Test
        @DisplayName("should find no mismatch when every attribute matches")
        void shouldMatchExactly() {
            assertThat(policy(false).mergeSettingMismatches(compliantProject())).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "merge_method",
                "only_allow_merge_if_all_discussions_are_resolved",
                "only_allow_merge_if_pipeline_succeeds",
                "remove_source_branch_after_merge"})
        @DisplayName("should report exactly the flipped attribute")
        void shouldReportSingleFlip(String attribute) {
            Map<String, Object> settings = new HashMap<>(expectation.getMergeSettings());
            Object expected = settings.get(attribute);
            settings.put(attribute, expected instanceof Boolean flag ? !flag : "ff");

            List<AttributeMismatch> mismatches = policy(false).mergeSettingMismatches(projectWith(settings));

            assertThat(mismatches).singleElement().satisfies(mismatch -> {
                assertThat(mismatch.attribute()).isEqualTo(attribute);
                assertThat(mismatch.expected()).isEqualTo(expected);
            });
        }

        @Test
        @DisplayName("should describe a mismatch with expected and actual values")
        void shouldDescribeMismatch() {
            Map<String, Object> settings = new HashMap<>(expectation.getMergeSettings());
            settings.put("merge_method", "ff");

            AttributeMismatch mismatch = policy(false).mergeSettingMismatches(projectWith(settings)).get(0);

            assertThat(mismatch.describe()).isEqualTo("expecting 'merge_method' as 'merge', got 'ff'");
        }

        @Test
        @DisplayName("should treat an attribute missing remotely as a configuration error")
        void shouldRejectUnknownAttribute() {
            Map<String, Object> settings = new HashMap<>(expectation.getMergeSettings());
            settings.remove("remove_source_branch_after_merge");

            assertThatThrownBy(() -> policy(false).mergeSettingMismatches(projectWith(settings)))
                    .isInstanceOf(PolicyConfigurationException.class)
                    .hasMessageContaining("remove_source_branch_after_merge");
        }
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("should report approval setting mismatches and a healthy rule")
        void shouldReportApprovalSettings() throws Exception {
            Map<String, Object> settings = new HashMap<>(expectation.getApprovalSettings());
            settings.put("reset_approvals_on_push", false);
            givenApprovalSettings(settings);
            when(client.listApprovalRules(10)).thenReturn(List.of(DEFAULT_RULE));

            List<CheckResult> results = policy(false).check(compliantProject());

            assertThat(results).extracting(CheckResult::message).containsExactly(
                    "expecting 'reset_approvals_on_push' as true, got false",
                    "approval rule 'Default' ok");
        }

        @Test
        @DisplayName("should report a project without approval rules")
        void shouldReportMissingRules() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of());

            List<CheckResult> results = policy(false).check(compliantProject());

            assertThat(results).singleElement().satisfies(result -> {
                assertThat(result.isError()).isTrue();
                assertThat(result.message()).isEqualTo("no approval rules");
            });
        }

        @Test
        @DisplayName("should report rules that require no approvals")
        void shouldReportZeroApprovals() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of(new VcsApprovalRule(7, "Default", 0, "regular")));

            List<CheckResult> results = policy(false).check(compliantProject());

            assertThat(results).singleElement().extracting(CheckResult::isError).isEqualTo(true);
        }
    }

    @Nested
    @DisplayName("converge")
    class Converge {

        @Test
        @DisplayName("should send a minimal patch of differing attributes only")
        void shouldSendMinimalPatch() throws Exception {
            Map<String, Object> settings = new HashMap<>(expectation.getMergeSettings());
            settings.put("merge_method", "rebase_merge");
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of(DEFAULT_RULE));

            policy(false).converge(projectWith(settings));

            verify(client).updateProject(10, Map.of("merge_method", "merge"));
            verify(client, never()).updateApprovalSettings(anyLong(), anyMap());
        }

        @Test
        @DisplayName("should make no update call when nothing differs")
        void shouldSkipEmptyPatch() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of(DEFAULT_RULE));

            List<CheckResult> results = policy(false).converge(compliantProject());

            verify(client, never()).updateProject(anyLong(), anyMap());
            verify(client, never()).updateApprovalSettings(anyLong(), anyMap());
            verify(client, never()).createApprovalRule(anyLong(), anyString(), anyInt(), anyList());
            verify(client, never()).updateApprovalRule(anyLong(), anyLong(), anyInt());
            assertThat(results).allMatch(result -> result.severity() == Severity.OK);
        }

        @Test
        @DisplayName("should converge approval settings")
        void shouldConvergeApprovalSettings() throws Exception {
            Map<String, Object> settings = new HashMap<>(expectation.getApprovalSettings());
            settings.put("merge_requests_author_approval", true);
            givenApprovalSettings(settings);
            when(client.listApprovalRules(10)).thenReturn(List.of(DEFAULT_RULE));

            policy(false).converge(compliantProject());

            verify(client).updateApprovalSettings(10, Map.of("merge_requests_author_approval", false));
        }

        @Test
        @DisplayName("should raise a Default rule that requires no approvals")
        void shouldRaiseZeroRule() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of(new VcsApprovalRule(7, "Default", 0, "regular")));

            policy(false).converge(compliantProject());

            verify(client).updateApprovalRule(10, 7, 1);
        }

        @Test
        @DisplayName("should leave a Default rule with approvals untouched")
        void shouldLeaveExistingRule() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of(new VcsApprovalRule(7, "Default", 2, "regular")));

            policy(false).converge(compliantProject());

            verify(client, never()).updateApprovalRule(anyLong(), anyLong(), anyInt());
            verify(client, never()).searchUsers(anyString());
        }

        @Test
        @DisplayName("should create the Default rule with resolved approvers")
        void shouldCreateDefaultRule() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of(new VcsApprovalRule(3, "Security", 1, "regular")));
            when(client.searchUsers("jdoe")).thenReturn(List.of(
                    new VcsUser(4, "jdoe2", "J Doe", null, null, null),
                    new VcsUser(5, "jdoe", "Jane Doe", null, null, null)));

            policy(false).converge(compliantProject());

            verify(client).createApprovalRule(10, "Default", 1, List.of(5L));
        }

        @Test
        @DisplayName("should resolve approvers but not create the rule in a dry run")
        void shouldResolveButNotCreateInDryRun() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of());
            when(client.searchUsers("jdoe")).thenReturn(List.of(new VcsUser(5, "jdoe", "Jane Doe", null, null, null)));

            List<CheckResult> results = policy(true).converge(compliantProject());

            verify(client, never()).createApprovalRule(anyLong(), anyString(), anyInt(), anyList());
            assertThat(results).last().satisfies(result -> {
                assertThat(result.severity()).isEqualTo(Severity.INFO);
                assertThat(result.message()).endsWith(" - DRY RUN");
            });
        }

        @Test
        @DisplayName("should fail loudly when an approver has no exact match")
        void shouldFailOnUnknownApprover() throws Exception {
            givenApprovalSettings(expectation.getApprovalSettings());
            when(client.listApprovalRules(10)).thenReturn(List.of());
            when(client.searchUsers("jdoe")).thenReturn(List.of(new VcsUser(6, "JDoe", "Jane Doe", null, null, null)));

            assertThatThrownBy(() -> policy(false).converge(compliantProject()))
                    .isInstanceOf(UserNotFoundException.class)
                    .hasMessageContaining("jdoe");
            verify(client, never()).createApprovalRule(anyLong(), anyString(), anyInt(), any());
        }
    }
}
