package org.repogov.governance.exception;

/**
 * A policy expectation names an attribute the remote resource does not expose.
 * This is a configuration error, never reported as drift.
 */
public class PolicyConfigurationException extends GovernanceException {

    public PolicyConfigurationException(String message) {
        super(message);
    }
}
