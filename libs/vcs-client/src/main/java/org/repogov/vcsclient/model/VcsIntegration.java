package org.repogov.vcsclient.model;

import java.util.Map;

/**
 * Represents a project integration (formerly "service"), e.g. Slack notifications.
 */
public record VcsIntegration(
    /**
     * Integration slug, e.g. "slack".
     */
    String slug,

    /**
     * Whether the integration is enabled.
     */
    boolean active,

    /**
     * Integration specific properties (webhook URL, channel, ...).
     */
    Map<String, Object> properties
) {
    public String property(String name) {
        if (properties == null) return null;
        Object value = properties.get(name);
        return value != null ? value.toString() : null;
    }
}
