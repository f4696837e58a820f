package org.repogov.governance.policy;

import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.model.AccessLevel;
import org.repogov.vcsclient.model.VcsAccessGrant;
import org.repogov.vcsclient.model.VcsProtectedBranch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The primary branch must only change through merge requests: developers may merge,
 * nobody may push directly.
 */
public class BranchProtectionPolicy extends AbstractProjectPolicy {

    static final AccessLevel EXPECTED_MERGE_ACCESS = AccessLevel.DEVELOPER;
    static final AccessLevel EXPECTED_PUSH_ACCESS = AccessLevel.NO_ACCESS;

    private final String primaryBranch;

    public BranchProtectionPolicy(VcsClient client, boolean dryRun, String primaryBranch) {
        super(client, dryRun);
        this.primaryBranch = primaryBranch;
    }

    @Override
    public String name() {
        return "branch-protection";
    }

    public String getPrimaryBranch() {
        return primaryBranch;
    }

    /**
     * Evaluate the protection rule of the primary branch, if there is one.
     * A project without any rule for the branch passes.
     */
    @Override
    public List<CheckResult> check(ProjectNode project) throws IOException {
        Optional<VcsProtectedBranch> rule = findRule(project);
        if (rule.isEmpty()) {
            return List.of(CheckResult.ok(project.fullPath(),
                    "no protection rule for '" + primaryBranch + "'"));
        }
        List<CheckResult> violations = violations(project, rule.get());
        if (violations.isEmpty()) {
            return List.of(CheckResult.ok(project.fullPath(), primaryBranch + " branch protected"));
        }
        return violations;
    }

    /**
     * Create the rule when it is missing, replace it when it is not compliant,
     * leave it alone otherwise.
     */
    @Override
    public List<CheckResult> converge(ProjectNode project) throws IOException {
        Optional<VcsProtectedBranch> rule = findRule(project);
        List<CheckResult> results = new ArrayList<>();

        if (rule.isPresent()) {
            List<CheckResult> violations = violations(project, rule.get());
            if (violations.isEmpty()) {
                results.add(CheckResult.ok(project.fullPath(), primaryBranch + " branch protected"));
                return results;
            }
            results.addAll(violations);
            results.add(action(project, "replacing " + primaryBranch + " branch protection with push: "
                    + "'No one', merge: 'Developers + Maintainers'"));
            if (!dryRun) {
                client.unprotectBranch(project.id(), primaryBranch);
                client.protectBranch(project.id(), primaryBranch, EXPECTED_PUSH_ACCESS, EXPECTED_MERGE_ACCESS);
            }
            return results;
        }

        results.add(action(project, "creating " + primaryBranch + " branch protection to push: "
                + "'No one', merge: 'Developers + Maintainers'"));
        if (!dryRun) {
            client.protectBranch(project.id(), primaryBranch, EXPECTED_PUSH_ACCESS, EXPECTED_MERGE_ACCESS);
        }
        return results;
    }

    private Optional<VcsProtectedBranch> findRule(ProjectNode project) throws IOException {
        return client.listProtectedBranches(project.id()).stream()
                .filter(branch -> primaryBranch.equals(branch.name()))
                .findFirst();
    }

    private List<CheckResult> violations(ProjectNode project, VcsProtectedBranch rule) {
        List<CheckResult> violations = new ArrayList<>();
        for (VcsAccessGrant grant : rule.mergeAccessLevels()) {
            if (grant.accessLevel() != EXPECTED_MERGE_ACCESS.getValue()) {
                violations.add(CheckResult.error(project.fullPath(), String.format(
                        "%s merge access set to '%s', expecting 'Developers + Maintainers'",
                        primaryBranch, grant.description())));
            }
        }
        for (VcsAccessGrant grant : rule.pushAccessLevels()) {
            if (grant.accessLevel() != EXPECTED_PUSH_ACCESS.getValue()) {
                violations.add(CheckResult.error(project.fullPath(), String.format(
                        "%s push access set to '%s', expecting 'No one'",
                        primaryBranch, grant.description())));
            }
        }
        return violations;
    }
}
