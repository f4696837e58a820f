package org.repogov.governance.policy;

import java.util.Comparator;
import java.util.List;

/**
 * Results of reconciling one project against every policy family.
 *
 * @param subject path of the project
 * @param results result lines, in policy order
 */
public record ReconciliationReport(String subject, List<CheckResult> results) {

    public ReconciliationReport {
        results = List.copyOf(results);
    }

    public boolean hasErrors() {
        return results.stream().anyMatch(CheckResult::isError);
    }

    public Severity worstSeverity() {
        return results.stream()
                .map(CheckResult::severity)
                .max(Comparator.naturalOrder())
                .orElse(Severity.OK);
    }
}
