package com.ryuqq.bay.core.spi;

import com.ryuqq.bay.core.config.ProfileConfig;
import com.ryuqq.bay.core.model.Workspace;

import java.util.List;
import java.util.Map;

/**
 * Compute Driver SPI (container engine abstraction).
 *
 * <p>The driver is treated as an unreliable external dependency: any call may fail
 * or hang. Callers bound every call with a timeout and never assume the driver's
 * internal concurrency model.</p>
 *
 * <p><strong>Idempotency Requirements:</strong></p>
 * <ul>
 *   <li>{@link #destroy(String)} and {@link #deleteVolume(String)} must treat
 *       "not found" as success, so a cleanup interrupted by a crash can be retried</li>
 *   <li>{@link #start(ProfileConfig, Workspace, Map)} is not idempotent and is never
 *       retried automatically</li>
 * </ul>
 *
 * <p>Every instance started by the control plane carries the labels listed in
 * {@link InstanceLabels}; {@link #listInstances(Map)} filters on them.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface ComputeDriver {

    /**
     * Creates a storage volume.
     *
     * @param name volume name
     * @param labels volume labels
     * @return driver-issued volume reference
     */
    String createVolume(String name, Map<String, String> labels);

    /**
     * Deletes a storage volume. Missing volumes are treated as already deleted.
     *
     * @param volumeRef volume reference
     */
    void deleteVolume(String volumeRef);

    /**
     * Creates and starts a compute instance with the workspace volume mounted.
     *
     * @param profile profile to run
     * @param workspace workspace to mount
     * @param labels instance labels
     * @return instance reference and runtime endpoint
     */
    StartedInstance start(ProfileConfig profile, Workspace workspace, Map<String, String> labels);

    /**
     * Stops an instance without removing it.
     *
     * @param instanceRef instance reference
     */
    void stop(String instanceRef);

    /**
     * Stops and removes an instance. Missing instances are treated as already destroyed.
     *
     * @param instanceRef instance reference
     */
    void destroy(String instanceRef);

    /**
     * Lists instances whose labels contain every entry of the filter.
     *
     * @param labelFilter required labels
     * @return matching instances
     */
    List<InstanceInfo> listInstances(Map<String, String> labelFilter);
}
