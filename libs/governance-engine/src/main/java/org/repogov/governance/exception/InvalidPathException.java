package org.repogov.governance.exception;

/**
 * A namespace path or project name failed local validation. Raised before any remote call.
 */
public class InvalidPathException extends GovernanceException {

    public InvalidPathException(String message) {
        super(message);
    }
}
