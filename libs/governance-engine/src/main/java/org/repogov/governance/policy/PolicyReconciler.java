package org.repogov.governance.policy;

import org.repogov.governance.hierarchy.ProjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the policy families against a project, either report-only or converging.
 * <p>
 * Remote errors are not caught here; callers running a bulk pass decide whether one
 * failing project aborts the rest.
 */
public class PolicyReconciler {

    private static final Logger log = LoggerFactory.getLogger(PolicyReconciler.class);

    private final BranchProtectionPolicy branchProtection;
    private final MergeRequestPolicy mergeRequests;
    private final SlackNotificationPolicy slackNotifications;

    public PolicyReconciler(BranchProtectionPolicy branchProtection,
                            MergeRequestPolicy mergeRequests,
                            SlackNotificationPolicy slackNotifications) {
        this.branchProtection = branchProtection;
        this.mergeRequests = mergeRequests;
        this.slackNotifications = slackNotifications;
    }

    public List<CheckResult> checkMasterProtected(ProjectNode project) throws IOException {
        return branchProtection.check(project);
    }

    public List<CheckResult> setMasterProtected(ProjectNode project) throws IOException {
        return branchProtection.converge(project);
    }

    public List<CheckResult> checkMergeRequestApprovals(ProjectNode project) throws IOException {
        return mergeRequests.check(project);
    }

    public List<CheckResult> setMergeRequestApprovals(ProjectNode project) throws IOException {
        return mergeRequests.converge(project);
    }

    public List<CheckResult> checkSlackNotifications(ProjectNode project) throws IOException {
        return slackNotifications.check(project);
    }

    public List<CheckResult> setSlackNotifications(ProjectNode project) throws IOException {
        return slackNotifications.converge(project);
    }

    public ReconciliationReport check(ProjectNode project) throws IOException {
        log.debug("Checking {}", project.fullPath());
        List<CheckResult> results = new ArrayList<>();
        results.addAll(checkMasterProtected(project));
        results.addAll(checkMergeRequestApprovals(project));
        results.addAll(checkSlackNotifications(project));
        return new ReconciliationReport(project.fullPath(), results);
    }

    public ReconciliationReport converge(ProjectNode project) throws IOException {
        log.debug("Converging {}", project.fullPath());
        List<CheckResult> results = new ArrayList<>();
        results.addAll(setMasterProtected(project));
        results.addAll(setMergeRequestApprovals(project));
        results.addAll(setSlackNotifications(project));
        return new ReconciliationReport(project.fullPath(), results);
    }
}
