package org.repogov.governance.policy;

import java.util.Objects;

/**
 * One line of a governance report.
 *
 * @param severity how the reporting layer should treat the line
 * @param subject path of the project or group the line is about
 * @param message human readable description
 */
public record CheckResult(Severity severity, String subject, String message) {

    public CheckResult {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static CheckResult ok(String subject, String message) {
        return new CheckResult(Severity.OK, subject, message);
    }

    public static CheckResult info(String subject, String message) {
        return new CheckResult(Severity.INFO, subject, message);
    }

    public static CheckResult warning(String subject, String message) {
        return new CheckResult(Severity.WARNING, subject, message);
    }

    public static CheckResult error(String subject, String message) {
        return new CheckResult(Severity.ERROR, subject, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
