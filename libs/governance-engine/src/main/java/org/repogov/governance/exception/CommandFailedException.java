package org.repogov.governance.exception;

import java.util.List;

/**
 * An external command (sshfs, fusermount, git) exited with a non-zero status.
 */
public class CommandFailedException extends GovernanceException {

    private final List<String> command;
    private final int exitCode;
    private final String errorOutput;

    public CommandFailedException(List<String> command, int exitCode, String errorOutput) {
        super(String.format("Command '%s' failed with exit code %d: %s",
                String.join(" ", command), exitCode, errorOutput));
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
        this.errorOutput = errorOutput;
    }

    public CommandFailedException(List<String> command, Throwable cause) {
        super("Command '" + String.join(" ", command) + "' could not be run", cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
        this.errorOutput = null;
    }

    public List<String> getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getErrorOutput() {
        return errorOutput;
    }
}
