package org.repogov.governance.migration;

import org.repogov.governance.exception.CommandFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * A legacy repository made available on the local filesystem for the duration of a
 * try-with-resources block.
 * <p>
 * Paths of the form {@code host:/path} are mounted with sshfs into a fresh temporary
 * directory, which is unmounted and removed on close. Local paths are used as they are.
 */
public final class RemoteMount implements AutoCloseable {

    static final String HOST_SEPARATOR = ":";

    private static final Logger log = LoggerFactory.getLogger(RemoteMount.class);

    private final CommandRunner runner;
    private final Path mountPoint;
    private final boolean mounted;
    private boolean closed;

    private RemoteMount(CommandRunner runner, Path mountPoint, boolean mounted) {
        this.runner = runner;
        this.mountPoint = mountPoint;
        this.mounted = mounted;
    }

    public static boolean isRemote(String legacyPath) {
        return legacyPath.contains(HOST_SEPARATOR);
    }

    /**
     * Make {@code legacyPath} available locally.
     *
     * @throws CommandFailedException if sshfs fails; the temporary directory is removed first
     */
    public static RemoteMount acquire(String legacyPath, CommandRunner runner) throws IOException {
        if (!isRemote(legacyPath)) {
            return new RemoteMount(runner, Path.of(legacyPath), false);
        }

        Path tempDir = Files.createTempDirectory("repogov-mount-");
        try {
            runner.run(List.of("sshfs", legacyPath, tempDir.toString()), null);
        } catch (RuntimeException e) {
            Files.deleteIfExists(tempDir);
            throw e;
        }
        log.debug("Mounted {} at {}", legacyPath, tempDir);
        return new RemoteMount(runner, tempDir, true);
    }

    /**
     * Local directory holding the repository.
     */
    public Path path() {
        return mountPoint;
    }

    public boolean isMounted() {
        return mounted;
    }

    /**
     * Unmount and remove the temporary directory. Does nothing for a local path or when
     * already closed.
     *
     * @throws CommandFailedException if the unmount fails; the directory is then left in place
     */
    @Override
    public void close() {
        if (!mounted || closed) {
            return;
        }
        closed = true;
        runner.run(List.of("fusermount", "-u", mountPoint.toString()), null);
        try {
            Files.deleteIfExists(mountPoint);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove mount point " + mountPoint, e);
        }
        log.debug("Unmounted {}", mountPoint);
    }
}
