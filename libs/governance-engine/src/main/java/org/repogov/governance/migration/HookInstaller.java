package org.repogov.governance.migration;

import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.governance.policy.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Writes hook scripts into the {@code hooks} directory of a bare git repository.
 * An existing hook of the same name is never touched.
 */
public class HookInstaller {

    static final Set<PosixFilePermission> EXECUTABLE = PosixFilePermissions.fromString("rwxr-xr-x");

    private static final Logger log = LoggerFactory.getLogger(HookInstaller.class);

    private final boolean dryRun;

    public HookInstaller(boolean dryRun) {
        this.dryRun = dryRun;
    }

    /**
     * Install a hook pointing at the push URL of {@code project}.
     *
     * @param repository root of the legacy git repository
     * @return {@code INFO} when the hook was (or would be) written, {@code WARNING} when a hook
     *         of that name already exists
     * @throws NoSuchFileException if the repository has no {@code hooks} directory, in dry runs too
     */
    public CheckResult install(Path repository, HookType type, ProjectNode project) throws IOException {
        Path hooks = repository.resolve("hooks");
        if (!Files.isDirectory(hooks)) {
            throw new NoSuchFileException(hooks.toString(), null, "no hooks directory in legacy repository");
        }
        Path hook = hooks.resolve(type.getFileName());
        String url = project.sshUrl();

        if (Files.exists(hook, LinkOption.NOFOLLOW_LINKS)) {
            return conflict(type, project, url);
        }

        String message = "Adding " + type.getFileName() + " hook for '" + url + "'" + (dryRun ? " - DRY RUN" : "");
        log.info(message);
        if (dryRun) {
            return CheckResult.info(project.fullPath(), message);
        }

        try {
            Files.writeString(hook, type.render(url), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            return conflict(type, project, url);
        }
        Files.setPosixFilePermissions(hook, EXECUTABLE);
        return CheckResult.info(project.fullPath(), message);
    }

    private static CheckResult conflict(HookType type, ProjectNode project, String url) {
        String message = type.getFileName() + " hook already exists for " + url + ". Will not overwrite";
        log.warn(message);
        return CheckResult.warning(project.fullPath(), message);
    }
}
