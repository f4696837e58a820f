package org.repogov.cli;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operator commands, selected with {@code repogov.command}.
 */
public enum GovernanceCommand {
    CHECK("check"),
    APPLY("apply"),
    DETAILS("details"),
    MEMBERSHIP("membership"),
    CREATE("create"),
    MIRROR("mirror"),
    BLOCK("block");

    private final String commandName;

    GovernanceCommand(String commandName) {
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    public static Optional<GovernanceCommand> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(command -> command.commandName.equals(normalized))
                .findFirst();
    }
}
