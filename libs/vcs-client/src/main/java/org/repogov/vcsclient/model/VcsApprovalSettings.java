package org.repogov.vcsclient.model;

import java.util.Map;

/**
 * Project-level merge request approval settings, kept as the raw attribute map.
 */
public record VcsApprovalSettings(Map<String, Object> attributes) {

    public boolean hasAttribute(String name) {
        return attributes != null && attributes.containsKey(name);
    }

    public Object attribute(String name) {
        return attributes != null ? attributes.get(name) : null;
    }
}
