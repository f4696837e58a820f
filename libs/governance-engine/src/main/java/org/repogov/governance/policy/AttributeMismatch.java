package org.repogov.governance.policy;

/**
 * A remote attribute whose live value differs from the expected one.
 */
public record AttributeMismatch(String attribute, Object expected, Object actual) {

    public String describe() {
        return String.format("expecting '%s' as %s, got %s", attribute, repr(expected), repr(actual));
    }

    static String repr(Object value) {
        if (value instanceof String text) {
            return "'" + text + "'";
        }
        return String.valueOf(value);
    }
}
