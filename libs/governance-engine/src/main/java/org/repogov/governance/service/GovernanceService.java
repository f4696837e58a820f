package org.repogov.governance.service;

import org.repogov.governance.exception.InvalidPathException;
import org.repogov.governance.hierarchy.HierarchyWalker;
import org.repogov.governance.hierarchy.NamespaceNode;
import org.repogov.governance.hierarchy.ParsedPath;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.governance.membership.MembershipIndexer;
import org.repogov.governance.migration.LegacyMirrorMigrator;
import org.repogov.governance.policy.CheckResult;
import org.repogov.governance.policy.PolicyReconciler;
import org.repogov.governance.policy.ReconciliationReport;
import org.repogov.governance.project.ProjectDetails;
import org.repogov.governance.project.ProjectInspector;
import org.repogov.governance.project.ProjectProvisioner;
import org.repogov.vcsclient.gitlab.GitLabException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for the operator commands. Bulk passes keep going when a single project fails
 * remotely; the failure becomes an error line in that project's report.
 */
public class GovernanceService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceService.class);

    private final HierarchyWalker walker;
    private final PolicyReconciler reconciler;
    private final ProjectInspector inspector;
    private final ProjectProvisioner provisioner;
    private final MembershipIndexer membershipIndexer;
    private final LegacyMirrorMigrator migrator;

    public GovernanceService(HierarchyWalker walker,
                             PolicyReconciler reconciler,
                             ProjectInspector inspector,
                             ProjectProvisioner provisioner,
                             MembershipIndexer membershipIndexer,
                             LegacyMirrorMigrator migrator) {
        this.walker = walker;
        this.reconciler = reconciler;
        this.inspector = inspector;
        this.provisioner = provisioner;
        this.membershipIndexer = membershipIndexer;
        this.migrator = migrator;
    }

    public List<ReconciliationReport> check(String target) {
        return reconcileAll(target, false);
    }

    public List<ReconciliationReport> converge(String target) {
        return reconcileAll(target, true);
    }

    public List<ProjectDetails> details(String target) throws IOException {
        List<ProjectDetails> details = new ArrayList<>();
        for (NamespaceNode node : walker.walkProjects(target)) {
            if (node instanceof ProjectNode project) {
                details.add(inspector.describe(project));
            }
        }
        return details;
    }

    public List<String> membership(String username) throws IOException {
        return membershipIndexer.membershipOf(username).collect(Collectors.toList());
    }

    public Optional<ProjectNode> createProject(String path) throws IOException {
        return provisioner.createProject(path);
    }

    public List<CheckResult> mirror(String target, String legacyPath) throws IOException {
        return migrator.mirror(requireProject(target), legacyPath);
    }

    public List<CheckResult> rejectPushes(String target, String legacyPath) throws IOException {
        return migrator.rejectPushes(requireProject(target), legacyPath);
    }

    private List<ReconciliationReport> reconcileAll(String target, boolean apply) {
        List<ReconciliationReport> reports = new ArrayList<>();
        for (NamespaceNode node : walker.walkProjects(target)) {
            if (!(node instanceof ProjectNode project)) {
                continue;
            }
            try {
                reports.add(apply ? reconciler.converge(project) : reconciler.check(project));
            } catch (GitLabException e) {
                log.error("Reconciling {} failed: {}", project.fullPath(), e.getMessage());
                reports.add(new ReconciliationReport(project.fullPath(),
                        List.of(CheckResult.error(project.fullPath(), e.getMessage()))));
            } catch (IOException e) {
                log.error("Reconciling {} failed", project.fullPath(), e);
                reports.add(new ReconciliationReport(project.fullPath(),
                        List.of(CheckResult.error(project.fullPath(), "I/O error: " + e.getMessage()))));
            }
        }
        return reports;
    }

    private ProjectNode requireProject(String target) throws IOException {
        ParsedPath parsed = walker.parsePath(target);
        if (!parsed.isProject()) {
            throw new InvalidPathException("'" + target + "' is a group, expecting a project path");
        }
        return parsed.project();
    }
}
