package org.repogov.governance.policy;

import org.repogov.governance.hierarchy.ProjectNode;

import java.io.IOException;
import java.util.List;

/**
 * A policy family that can be checked against a project and converged onto it.
 */
public interface ProjectPolicy {

    /**
     * Short name used in logs, e.g. "branch-protection".
     */
    String name();

    /**
     * Report-only comparison of the live project against the expectation.
     */
    List<CheckResult> check(ProjectNode project) throws IOException;

    /**
     * Apply the changes needed to make the project match the expectation.
     * In a dry run every read still happens and the same lines are reported;
     * only the mutating calls are skipped.
     */
    List<CheckResult> converge(ProjectNode project) throws IOException;
}
