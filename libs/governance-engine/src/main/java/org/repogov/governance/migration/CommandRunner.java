package org.repogov.governance.migration;

import org.repogov.governance.exception.CommandFailedException;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs external programs synchronously.
 */
public interface CommandRunner {

    /**
     * @param workDir working directory, or null for the current one
     * @return trimmed standard output
     * @throws CommandFailedException if the program cannot be started or exits non-zero
     */
    String run(List<String> command, Path workDir);
}
