package org.repogov.vcsclient.model;

/**
 * Represents a project merge request approval rule.
 *
 * @param id rule ID
 * @param name rule name
 * @param approvalsRequired number of approvals required by the rule
 * @param ruleType GitLab rule type, e.g. "regular" or "any_approver"
 */
public record VcsApprovalRule(
    long id,
    String name,
    int approvalsRequired,
    String ruleType
) {
}
