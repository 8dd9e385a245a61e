package com.ryuqq.bay.core.spi;

import java.util.Map;

/**
 * Instance as reported by {@link ComputeDriver#listInstances(Map)}.
 *
 * @param instanceRef instance reference
 * @param labels instance labels
 * @param running whether the instance is currently running
 * @author Bay Team
 * @since 1.0.0
 */
public record InstanceInfo(String instanceRef, Map<String, String> labels, boolean running) {

    public InstanceInfo {
        if (instanceRef == null || instanceRef.isBlank()) {
            throw new IllegalArgumentException("instanceRef cannot be null or blank");
        }
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public String label(String name) {
        return labels.get(name);
    }
}
