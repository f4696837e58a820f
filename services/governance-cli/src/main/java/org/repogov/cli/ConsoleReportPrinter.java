package org.repogov.cli;

import org.repogov.governance.policy.CheckResult;
import org.repogov.governance.policy.ReconciliationReport;
import org.repogov.governance.project.ProjectDetails;

import java.io.PrintStream;
import java.util.List;

/**
 * Plain-text rendering of command results for the terminal.
 */
public class ConsoleReportPrinter {

    private final PrintStream out;

    public ConsoleReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void printReports(List<ReconciliationReport> reports) {
        for (ReconciliationReport report : reports) {
            out.println(report.subject());
            printResults(report.results());
        }
    }

    public void printResults(List<CheckResult> results) {
        for (CheckResult result : results) {
            out.printf("  [%-7s] %s%n", result.severity(), result.message());
        }
    }

    public void printDetails(List<ProjectDetails> details) {
        for (ProjectDetails project : details) {
            out.println(project.path());
            out.printf("  %-13s %s%n", "Description", project.description());
            out.printf("  %-13s %s%n", "Created By", project.createdBy());
            out.printf("  %-13s %s%n", "Last Activity", project.lastActivity());
            out.printf("  %-13s %d%n", "Branches", project.branches());
            out.printf("  %-13s %d%n", "Commits", project.commits());
            out.printf("  %-13s %d%n", "Open MRs", project.openMergeRequests());
        }
    }

    public void printLines(List<String> lines) {
        lines.forEach(out::println);
    }
}
