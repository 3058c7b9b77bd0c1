package com.waypoint.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Approved technology registry: technology name to the one allowed version.
 */
public record ApprovedStack(Map<String, String> technologies) implements Serializable {

    public ApprovedStack {
        technologies = technologies == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(technologies));
    }

    public static ApprovedStack empty() {
        return new ApprovedStack(Map.of());
    }
}
