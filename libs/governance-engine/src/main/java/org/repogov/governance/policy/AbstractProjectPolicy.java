package org.repogov.governance.policy;

import org.repogov.governance.exception.PolicyConfigurationException;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.VcsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Shared plumbing for policies: the remote client, the dry-run switch and
 * attribute table comparison.
 */
public abstract class AbstractProjectPolicy implements ProjectPolicy {

    protected static final String DRY_RUN_SUFFIX = " - DRY RUN";

    private static final Logger log = LoggerFactory.getLogger(AbstractProjectPolicy.class);

    protected final VcsClient client;
    protected final boolean dryRun;

    protected AbstractProjectPolicy(VcsClient client, boolean dryRun) {
        this.client = client;
        this.dryRun = dryRun;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /**
     * Record a change about to be made. Logged and reported the same way with or without dry run.
     */
    protected CheckResult action(ProjectNode project, String message) {
        String text = message + (dryRun ? DRY_RUN_SUFFIX : "");
        log.info("{}: {}", project.fullPath(), text);
        return CheckResult.info(project.fullPath(), text);
    }

    /**
     * Compare an expected attribute table against a remote resource.
     *
     * @param resource name of the remote resource, for error messages
     * @param hasAttribute whether the resource exposes an attribute
     * @param valueOf live value of an attribute
     * @throws PolicyConfigurationException if an expected attribute does not exist remotely
     */
    protected static List<AttributeMismatch> compare(String resource,
                                                     Map<String, Object> expected,
                                                     Predicate<String> hasAttribute,
                                                     Function<String, Object> valueOf) {
        List<AttributeMismatch> mismatches = new ArrayList<>();
        for (Map.Entry<String, Object> entry : expected.entrySet()) {
            String attribute = entry.getKey();
            if (!hasAttribute.test(attribute)) {
                throw new PolicyConfigurationException(
                        "Expected attribute '" + attribute + "' does not exist on " + resource);
            }
            Object actual = valueOf.apply(attribute);
            if (!Objects.equals(entry.getValue(), actual)) {
                mismatches.add(new AttributeMismatch(attribute, entry.getValue(), actual));
            }
        }
        return mismatches;
    }
}
