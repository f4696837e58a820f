package org.repogov.governance.policy;

import org.repogov.governance.exception.UserNotFoundException;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.model.VcsApprovalRule;
import org.repogov.vcsclient.model.VcsApprovalSettings;
import org.repogov.vcsclient.model.VcsProject;
import org.repogov.vcsclient.model.VcsUser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merge settings, approval settings and the default approval rule of a project.
 */
public class MergeRequestPolicy extends AbstractProjectPolicy {

    private final PolicyExpectation expectation;
    private final List<String> approvers;

    /**
     * @param approvers users named on a newly created approval rule, matched exactly
     *                  against username or email
     */
    public MergeRequestPolicy(VcsClient client, boolean dryRun, PolicyExpectation expectation, List<String> approvers) {
        super(client, dryRun);
        this.expectation = expectation;
        this.approvers = approvers != null ? List.copyOf(approvers) : List.of();
    }

    @Override
    public String name() {
        return "merge-requests";
    }

    public List<AttributeMismatch> mergeSettingMismatches(ProjectNode project) {
        VcsProject resource = project.project();
        return compare("project " + project.fullPath(), expectation.getMergeSettings(),
                resource::hasAttribute, resource::attribute);
    }

    public List<AttributeMismatch> approvalSettingMismatches(ProjectNode project) throws IOException {
        VcsApprovalSettings settings = client.getApprovalSettings(project.id());
        return compare("approval settings of " + project.fullPath(), expectation.getApprovalSettings(),
                settings::hasAttribute, settings::attribute);
    }

    @Override
    public List<CheckResult> check(ProjectNode project) throws IOException {
        List<CheckResult> results = new ArrayList<>();
        for (AttributeMismatch mismatch : mergeSettingMismatches(project)) {
            results.add(CheckResult.error(project.fullPath(), mismatch.describe()));
        }
        for (AttributeMismatch mismatch : approvalSettingMismatches(project)) {
            results.add(CheckResult.error(project.fullPath(), mismatch.describe()));
        }

        List<VcsApprovalRule> rules = client.listApprovalRules(project.id());
        if (rules.isEmpty()) {
            results.add(CheckResult.error(project.fullPath(), "no approval rules"));
        }
        for (VcsApprovalRule rule : rules) {
            if (rule.approvalsRequired() == 0) {
                results.add(CheckResult.error(project.fullPath(),
                        "required approvals is zero for rule '" + rule.name() + "'"));
            } else {
                results.add(CheckResult.ok(project.fullPath(), "approval rule '" + rule.name() + "' ok"));
            }
        }
        return results;
    }

    @Override
    public List<CheckResult> converge(ProjectNode project) throws IOException {
        List<CheckResult> results = new ArrayList<>();

        Map<String, Object> mergePatch = patchOf(mergeSettingMismatches(project));
        if (mergePatch.isEmpty()) {
            results.add(CheckResult.ok(project.fullPath(), "merge settings ok"));
        } else {
            results.add(action(project, "updating merge attributes " + mergePatch));
            if (!dryRun) {
                client.updateProject(project.id(), mergePatch);
            }
        }

        Map<String, Object> approvalPatch = patchOf(approvalSettingMismatches(project));
        if (approvalPatch.isEmpty()) {
            results.add(CheckResult.ok(project.fullPath(), "approval settings ok"));
        } else {
            results.add(action(project, "updating approval settings " + approvalPatch));
            if (!dryRun) {
                client.updateApprovalSettings(project.id(), approvalPatch);
            }
        }

        results.add(convergeApprovalRule(project));
        return results;
    }

    /**
     * A rule with the expected name that already requires approvals is left as is,
     * even if its approvers differ from configuration.
     */
    private CheckResult convergeApprovalRule(ProjectNode project) throws IOException {
        String ruleName = expectation.getApprovalRuleName();
        int required = expectation.getRequiredApprovals();

        Optional<VcsApprovalRule> existing = client.listApprovalRules(project.id()).stream()
                .filter(rule -> ruleName.equals(rule.name()))
                .findFirst();

        if (existing.isPresent()) {
            VcsApprovalRule rule = existing.get();
            if (rule.approvalsRequired() > 0) {
                return CheckResult.ok(project.fullPath(), "approval rule '" + ruleName + "' ok");
            }
            CheckResult result = action(project,
                    "raising required approvals of '" + ruleName + "' rule to " + required);
            if (!dryRun) {
                client.updateApprovalRule(project.id(), rule.id(), required);
            }
            return result;
        }

        List<Long> userIds = resolveUserIds(approvers);
        CheckResult result = action(project, "adding '" + ruleName + "' approval rule for " + approvers);
        if (!dryRun) {
            client.createApprovalRule(project.id(), ruleName, required, userIds);
        }
        return result;
    }

    /**
     * Translate configured users into remote user IDs.
     *
     * @throws UserNotFoundException if a search returns no exact match
     */
    public List<Long> resolveUserIds(List<String> users) throws IOException {
        List<Long> ids = new ArrayList<>();
        for (String user : users) {
            VcsUser match = client.searchUsers(user).stream()
                    .filter(candidate -> candidate.matchesExactly(user))
                    .findFirst()
                    .orElseThrow(() -> new UserNotFoundException(user));
            ids.add(match.id());
        }
        return ids;
    }

    private static Map<String, Object> patchOf(List<AttributeMismatch> mismatches) {
        Map<String, Object> patch = new LinkedHashMap<>();
        for (AttributeMismatch mismatch : mismatches) {
            patch.put(mismatch.attribute(), mismatch.expected());
        }
        return patch;
    }
}
