package org.repogov.governance.policy;

/**
 * Severity of a check result, from least to most severe.
 * {@code INFO} marks a change that was applied, or would be applied in a dry run.
 */
public enum Severity {
    OK,
    INFO,
    WARNING,
    ERROR;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
