package org.repogov.vcsclient.model;

import java.util.List;

/**
 * Represents a branch protection rule.
 */
public record VcsProtectedBranch(
    String name,
    List<VcsAccessGrant> pushAccessLevels,
    List<VcsAccessGrant> mergeAccessLevels
) {
}
