package org.repogov.governance.migration;

import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.governance.policy.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves a legacy filesystem repository over to its hosted project, either by mirroring
 * it or by blocking further pushes to it.
 * <p>
 * A remote legacy path is mounted for the duration of the call and always released.
 * A failing command aborts the migration; hooks written before the failure stay in place.
 */
public class LegacyMirrorMigrator {

    private static final Logger log = LoggerFactory.getLogger(LegacyMirrorMigrator.class);

    private final CommandRunner runner;
    private final HookInstaller hookInstaller;
    private final boolean dryRun;

    public LegacyMirrorMigrator(CommandRunner runner, HookInstaller hookInstaller, boolean dryRun) {
        this.runner = runner;
        this.hookInstaller = hookInstaller;
        this.dryRun = dryRun;
    }

    /**
     * Install the {@code post-update} mirror hook, then push the whole legacy repository
     * to the project right away.
     */
    public List<CheckResult> mirror(ProjectNode project, String legacyPath) throws IOException {
        List<CheckResult> results = new ArrayList<>();
        try (RemoteMount mount = RemoteMount.acquire(legacyPath, runner)) {
            results.add(hookInstaller.install(mount.path(), HookType.POST_UPDATE, project));

            String message = String.format("Mirroring '%s' '%s' to Gitlab%s",
                    legacyPath, project.webUrl(), dryRun ? " - DRY RUN" : "");
            log.info(message);
            results.add(CheckResult.info(project.fullPath(), message));
            if (!dryRun) {
                runner.run(List.of("git", "push", "-f", "--mirror", project.sshUrl()), mount.path());
            }
        }
        return results;
    }

    /**
     * Install the {@code pre-receive} hook that rejects every future push.
     */
    public List<CheckResult> rejectPushes(ProjectNode project, String legacyPath) throws IOException {
        try (RemoteMount mount = RemoteMount.acquire(legacyPath, runner)) {
            return List.of(hookInstaller.install(mount.path(), HookType.PRE_RECEIVE, project));
        }
    }
}
