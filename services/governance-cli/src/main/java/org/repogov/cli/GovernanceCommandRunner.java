package org.repogov.cli;

import org.repogov.cli.config.RepogovProperties;
import org.repogov.governance.exception.GovernanceException;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.governance.policy.CheckResult;
import org.repogov.governance.policy.ReconciliationReport;
import org.repogov.governance.service.GovernanceService;
import org.repogov.vcsclient.VcsClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Runs the command named by {@code repogov.command} once and records the process exit code:
 * 0 when nothing failed, 1 when any result is an error or the command failed, 2 when the
 * invocation itself is invalid.
 */
@Component
public class GovernanceCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(GovernanceCommandRunner.class);

    private final GovernanceService governanceService;
    private final RepogovProperties properties;
    private final ConsoleReportPrinter printer;
    private int exitCode = EXIT_OK;

    public GovernanceCommandRunner(GovernanceService governanceService, RepogovProperties properties) {
        this(governanceService, properties, new ConsoleReportPrinter(System.out));
    }

    GovernanceCommandRunner(GovernanceService governanceService, RepogovProperties properties,
                            ConsoleReportPrinter printer) {
        this.governanceService = governanceService;
        this.properties = properties;
        this.printer = printer;
    }

    @Override
    public void run(String... args) {
        Optional<GovernanceCommand> command = GovernanceCommand.fromName(properties.getCommand());
        if (command.isEmpty()) {
            log.error("Unknown or missing command '{}'. Expected one of: check, apply, details, "
                    + "membership, create, mirror, block", properties.getCommand());
            exitCode = EXIT_USAGE;
            return;
        }
        if (properties.isDryRun()) {
            log.info("Dry run: no changes will be made");
        }

        try {
            exitCode = execute(command.get());
        } catch (GovernanceException | VcsClientException e) {
            log.error("{} failed: {}", command.get().getCommandName(), e.getMessage());
            exitCode = EXIT_ERRORS;
        } catch (IOException | UncheckedIOException e) {
            log.error("{} failed", command.get().getCommandName(), e);
            exitCode = EXIT_ERRORS;
        }
    }

    private int execute(GovernanceCommand command) throws IOException {
        switch (command) {
            case CHECK, APPLY -> {
                String target = properties.getTarget();
                List<ReconciliationReport> reports = command == GovernanceCommand.CHECK
                        ? governanceService.check(target)
                        : governanceService.converge(target);
                printer.printReports(reports);
                return reports.stream().anyMatch(ReconciliationReport::hasErrors) ? EXIT_ERRORS : EXIT_OK;
            }
            case DETAILS -> {
                printer.printDetails(governanceService.details(properties.getTarget()));
                return EXIT_OK;
            }
            case MEMBERSHIP -> {
                if (isBlank(properties.getUsername())) {
                    return usage("membership needs repogov.username");
                }
                printer.printLines(governanceService.membership(properties.getUsername()));
                return EXIT_OK;
            }
            case CREATE -> {
                if (isBlank(properties.getTarget())) {
                    return usage("create needs repogov.target");
                }
                Optional<ProjectNode> created = governanceService.createProject(properties.getTarget());
                created.ifPresent(project -> printer.printLines(List.of(project.webUrl())));
                return EXIT_OK;
            }
            case MIRROR, BLOCK -> {
                if (isBlank(properties.getTarget()) || isBlank(properties.getLegacyPath())) {
                    return usage(command.getCommandName() + " needs repogov.target and repogov.legacy-path");
                }
                List<CheckResult> results = command == GovernanceCommand.MIRROR
                        ? governanceService.mirror(properties.getTarget(), properties.getLegacyPath())
                        : governanceService.rejectPushes(properties.getTarget(), properties.getLegacyPath());
                printer.printResults(results);
                return results.stream().anyMatch(CheckResult::isError) ? EXIT_ERRORS : EXIT_OK;
            }
            default -> throw new IllegalStateException("Unhandled command " + command);
        }
    }

    private static int usage(String message) {
        log.error(message);
        return EXIT_USAGE;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
