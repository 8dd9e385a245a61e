package com.ryuqq.bay.core.spi;

/**
 * Result of {@link ComputeDriver#start}.
 *
 * @param instanceRef driver-issued instance reference
 * @param endpoint runtime base URL reachable from the control plane
 * @author Bay Team
 * @since 1.0.0
 */
public record StartedInstance(String instanceRef, String endpoint) {

    public StartedInstance {
        if (instanceRef == null || instanceRef.isBlank()) {
            throw new IllegalArgumentException("instanceRef cannot be null or blank");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
    }
}
