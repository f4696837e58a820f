package org.repogov.governance.migration;

import org.repogov.governance.exception.CommandFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Standard error is captured and
 * carried by the exception when the program fails.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public String run(List<String> command, Path workDir) {
        log.debug("Running: {}", String.join(" ", command));
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new CommandFailedException(command, e);
        }

        try {
            // drain stderr concurrently so a chatty program cannot block on a full pipe
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
            String stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            String errorOutput = stderr.get().trim();

            if (exitCode != 0) {
                log.warn("Command exited with code {}: {}", exitCode, String.join(" ", command));
                throw new CommandFailedException(command, exitCode, errorOutput);
            }
            return stdout.trim();
        } catch (UncheckedIOException | ExecutionException e) {
            throw new CommandFailedException(command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandFailedException(command, e);
        } finally {
            if (process.isAlive()) {
                log.warn("Stopping abandoned command: {}", String.join(" ", command));
                process.destroy();
            }
        }
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
