package org.repogov.governance.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The declared state projects are reconciled towards.
 * <p>
 * Attribute names are GitLab API names. Every name must exist on the remote resource;
 * a missing one is a configuration error rather than drift.
 */
public final class PolicyExpectation {

    public static final String DEFAULT_RULE_NAME = "Default";

    private final Map<String, Object> mergeSettings;
    private final Map<String, Object> approvalSettings;
    private final String approvalRuleName;
    private final int requiredApprovals;

    public PolicyExpectation(Map<String, Object> mergeSettings,
                             Map<String, Object> approvalSettings,
                             String approvalRuleName,
                             int requiredApprovals) {
        if (requiredApprovals < 1) {
            throw new IllegalArgumentException("requiredApprovals must be at least 1");
        }
        this.mergeSettings = Collections.unmodifiableMap(new LinkedHashMap<>(mergeSettings));
        this.approvalSettings = Collections.unmodifiableMap(new LinkedHashMap<>(approvalSettings));
        this.approvalRuleName = approvalRuleName;
        this.requiredApprovals = requiredApprovals;
    }

    public static PolicyExpectation defaults() {
        Map<String, Object> merge = new LinkedHashMap<>();
        merge.put("merge_method", "merge");
        merge.put("only_allow_merge_if_all_discussions_are_resolved", true);
        merge.put("only_allow_merge_if_pipeline_succeeds", true);
        merge.put("remove_source_branch_after_merge", true);

        Map<String, Object> approvals = new LinkedHashMap<>();
        approvals.put("merge_requests_author_approval", false);
        approvals.put("merge_requests_disable_committers_approval", true);
        approvals.put("require_password_to_approve", false);
        approvals.put("reset_approvals_on_push", true);

        return new PolicyExpectation(merge, approvals, DEFAULT_RULE_NAME, 1);
    }

    public Map<String, Object> getMergeSettings() {
        return mergeSettings;
    }

    public Map<String, Object> getApprovalSettings() {
        return approvalSettings;
    }

    public String getApprovalRuleName() {
        return approvalRuleName;
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }
}
