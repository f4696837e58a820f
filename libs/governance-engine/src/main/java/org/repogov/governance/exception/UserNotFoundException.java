package org.repogov.governance.exception;

public class UserNotFoundException extends GovernanceException {

    public UserNotFoundException(String user) {
        super("No user matches '" + user + "' exactly");
    }
}
