package org.repogov.vcsclient.model;

/**
 * Represents a GitLab user.
 */
public record VcsUser(
    /**
     * Unique identifier.
     */
    long id,
    
    /**
     * Username/login.
     */
    String username,
    
    /**
     * Display name.
     */
    String displayName,
    
    /**
     * Email address. Only visible to administrators.
     */
    String email,

    /**
     * Public email address, if the user published one.
     */
    String publicEmail,
    
    /**
     * Profile URL.
     */
    String webUrl
) {
    /**
     * Exact, case-sensitive match of a search term against the identifying fields.
     */
    public boolean matchesExactly(String term) {
        if (term == null) return false;
        return term.equals(username) || term.equals(email) || term.equals(publicEmail);
    }
}
