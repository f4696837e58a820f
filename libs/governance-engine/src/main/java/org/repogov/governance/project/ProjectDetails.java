package org.repogov.governance.project;

/**
 * Condensed summary of a project for listings.
 *
 * @param path path with namespace
 * @param description project description, empty when unset
 * @param createdBy display name of the creator
 * @param lastActivity date of the last activity, {@code yyyy-MM-dd}, empty when unknown
 * @param branches number of branches
 * @param commits number of commits on the default branch
 * @param openMergeRequests number of open merge requests
 */
public record ProjectDetails(
    String path,
    String description,
    String createdBy,
    String lastActivity,
    int branches,
    int commits,
    int openMergeRequests
) {
}
