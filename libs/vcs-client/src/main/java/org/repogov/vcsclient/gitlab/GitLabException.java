package org.repogov.vcsclient.gitlab;

import org.repogov.vcsclient.VcsClientException;

/**
 * Exception for GitLab API errors.
 * <p>
 * Carries the HTTP status so callers can tell a missing resource (404)
 * apart from every other remote failure.
 */
public class GitLabException extends VcsClientException {
    
    private static final int NOT_FOUND = 404;

    private final int statusCode;
    private final String responseBody;
    
    public GitLabException(String operation, int statusCode, String responseBody) {
        super(String.format("GitLab %s failed: %d - %s", operation, statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
    
    public GitLabException(String message) {
        super(message);
        this.statusCode = -1;
        this.responseBody = null;
    }
    
    public GitLabException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public String getResponseBody() {
        return responseBody;
    }

    public boolean isNotFound() {
        return statusCode == NOT_FOUND;
    }
}
