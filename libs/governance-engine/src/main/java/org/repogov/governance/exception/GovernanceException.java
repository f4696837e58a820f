package org.repogov.governance.exception;

/**
 * Base class of every failure raised by the governance engine itself.
 * Remote API failures are not wrapped: they surface as {@code GitLabException}.
 */
public class GovernanceException extends RuntimeException {

    public GovernanceException(String message) {
        super(message);
    }

    public GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
