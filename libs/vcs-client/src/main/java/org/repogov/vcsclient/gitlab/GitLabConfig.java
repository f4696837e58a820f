package org.repogov.vcsclient.gitlab;

/**
 * Configuration constants for GitLab API access.
 */
public final class GitLabConfig {
    
    public static final String API_BASE = "https://gitlab.com/api/v4";
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final String PRIVATE_TOKEN_HEADER = "PRIVATE-TOKEN";
    
    private GitLabConfig() {
        // Utility class
    }
}
