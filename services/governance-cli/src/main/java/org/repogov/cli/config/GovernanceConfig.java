package org.repogov.cli.config;

import okhttp3.OkHttpClient;
import org.repogov.governance.hierarchy.HierarchyWalker;
import org.repogov.governance.membership.MembershipCache;
import org.repogov.governance.membership.MembershipIndexer;
import org.repogov.governance.migration.CommandRunner;
import org.repogov.governance.migration.HookInstaller;
import org.repogov.governance.migration.LegacyMirrorMigrator;
import org.repogov.governance.migration.ProcessCommandRunner;
import org.repogov.governance.path.PathResolver;
import org.repogov.governance.policy.BranchProtectionPolicy;
import org.repogov.governance.policy.MergeRequestPolicy;
import org.repogov.governance.policy.PolicyExpectation;
import org.repogov.governance.policy.PolicyReconciler;
import org.repogov.governance.policy.SlackNotificationPolicy;
import org.repogov.governance.project.ProjectInspector;
import org.repogov.governance.project.ProjectProvisioner;
import org.repogov.governance.service.GovernanceService;
import org.repogov.vcsclient.HttpAuthorizedClientFactory;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.gitlab.GitLabClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine for one run. Every bean is a singleton, so the walker and membership
 * caches live exactly as long as the run.
 */
@Configuration
@EnableConfigurationProperties(RepogovProperties.class)
public class GovernanceConfig {

    @Bean
    public OkHttpClient gitLabHttpClient(RepogovProperties properties) {
        return new HttpAuthorizedClientFactory().createGitLabClient(properties.getGitlab().getToken());
    }

    @Bean
    public VcsClient vcsClient(OkHttpClient gitLabHttpClient, RepogovProperties properties) {
        return new GitLabClient(gitLabHttpClient, properties.getGitlab().getBaseUrl());
    }

    @Bean
    public PathResolver pathResolver(RepogovProperties properties) {
        return new PathResolver(properties.getRootGroup());
    }

    @Bean
    public HierarchyWalker hierarchyWalker(VcsClient vcsClient, PathResolver pathResolver) {
        return new HierarchyWalker(vcsClient, pathResolver);
    }

    @Bean
    public PolicyReconciler policyReconciler(VcsClient vcsClient, RepogovProperties properties) {
        boolean dryRun = properties.isDryRun();
        return new PolicyReconciler(
                new BranchProtectionPolicy(vcsClient, dryRun, properties.getPrimaryBranch()),
                new MergeRequestPolicy(vcsClient, dryRun, PolicyExpectation.defaults(), properties.getApprovers()),
                new SlackNotificationPolicy(vcsClient, dryRun, properties.getSlack().getWebhook()));
    }

    @Bean
    public MembershipIndexer membershipIndexer(HierarchyWalker hierarchyWalker, VcsClient vcsClient,
                                               RepogovProperties properties) {
        return new MembershipIndexer(hierarchyWalker, vcsClient, properties.getUsersGroup(), new MembershipCache());
    }

    @Bean
    public CommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    public LegacyMirrorMigrator legacyMirrorMigrator(CommandRunner commandRunner, RepogovProperties properties) {
        boolean dryRun = properties.isDryRun();
        return new LegacyMirrorMigrator(commandRunner, new HookInstaller(dryRun), dryRun);
    }

    @Bean
    public GovernanceService governanceService(HierarchyWalker hierarchyWalker,
                                               PolicyReconciler policyReconciler,
                                               VcsClient vcsClient,
                                               MembershipIndexer membershipIndexer,
                                               LegacyMirrorMigrator legacyMirrorMigrator,
                                               RepogovProperties properties) {
        return new GovernanceService(
                hierarchyWalker,
                policyReconciler,
                new ProjectInspector(vcsClient),
                new ProjectProvisioner(vcsClient, hierarchyWalker, properties.isDryRun()),
                membershipIndexer,
                legacyMirrorMigrator);
    }
}
