package com.ryuqq.bay.core.spi;

import java.util.List;

/**
 * Client for the runtime running inside a compute instance.
 *
 * <p>Only capability presence and health are part of this contract; individual
 * capability calls are made by the API layer.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface RuntimeAdapter {

    /**
     * Probes the runtime's health endpoint.
     *
     * @return true if the runtime answers and reports itself healthy
     */
    boolean isHealthy();

    /**
     * Capabilities the runtime declares (e.g. filesystem, shell, python).
     *
     * @return capability names
     */
    List<String> capabilities();
}
