package com.ryuqq.bay.testkit.contract;

import com.ryuqq.bay.core.config.ProfileConfig;
import com.ryuqq.bay.core.error.DriverException;
import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.InstanceInfo;
import com.ryuqq.bay.core.spi.StartedInstance;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory compute driver for contract tests.
 *
 * <p>Keeps instances and volumes in maps and counts every call. Failures and slow
 * starts can be injected to exercise the error paths:</p>
 * <ul>
 *   <li>{@link #failNextStarts(int, RuntimeException)}: the next N starts throw</li>
 *   <li>{@link #setStartDelayMs(long)}: every start blocks for the given time</li>
 *   <li>{@link #failVolumeDeletes(boolean)}: volume deletion throws until switched off</li>
 * </ul>
 *
 * <p>Endpoints are {@code http://fake-N:8123}, one per started instance.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class FakeComputeDriver implements ComputeDriver {

    private final Map<String, InstanceInfo> instances = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> volumes = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<RuntimeException> startFailures = new ConcurrentLinkedQueue<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger startCount = new AtomicInteger();
    private final AtomicInteger destroyCount = new AtomicInteger();
    private final AtomicLong startDelayMs = new AtomicLong();
    private volatile boolean failVolumeDeletes;

    @Override
    public String createVolume(String name, Map<String, String> labels) {
        String volumeRef = "vol-" + name;
        volumes.put(volumeRef, labels == null ? Map.of() : Map.copyOf(labels));
        return volumeRef;
    }

    @Override
    public void deleteVolume(String volumeRef) {
        if (failVolumeDeletes) {
            throw new DriverException("deleteVolume", "volume " + volumeRef + " is busy", null);
        }
        volumes.remove(volumeRef);
    }

    @Override
    public StartedInstance start(ProfileConfig profile, Workspace workspace, Map<String, String> labels) {
        startCount.incrementAndGet();
        long delay = startDelayMs.get();
        if (delay > 0) {
            sleep(delay);
        }
        RuntimeException failure = startFailures.poll();
        if (failure != null) {
            throw failure;
        }
        int n = sequence.incrementAndGet();
        String instanceRef = "inst-" + n;
        instances.put(instanceRef, new InstanceInfo(instanceRef, labels, true));
        return new StartedInstance(instanceRef, "http://fake-" + n + ":" + profile.runtimePort());
    }

    @Override
    public void stop(String instanceRef) {
        InstanceInfo instance = instances.get(instanceRef);
        if (instance != null) {
            instances.put(instanceRef, new InstanceInfo(instanceRef, instance.labels(), false));
        }
    }

    @Override
    public void destroy(String instanceRef) {
        destroyCount.incrementAndGet();
        instances.remove(instanceRef);
    }

    @Override
    public List<InstanceInfo> listInstances(Map<String, String> labelFilter) {
        List<InstanceInfo> matched = new ArrayList<>();
        for (InstanceInfo instance : instances.values()) {
            if (matches(instance.labels(), labelFilter)) {
                matched.add(instance);
            }
        }
        return matched;
    }

    /**
     * Registers an instance the control plane has no record of (e.g. left by a crash).
     *
     * @param instanceRef the instance reference
     * @param labels the instance labels
     */
    public void addStrayInstance(String instanceRef, Map<String, String> labels) {
        instances.put(instanceRef, new InstanceInfo(instanceRef, new LinkedHashMap<>(labels), true));
    }

    public void failNextStarts(int count, RuntimeException failure) {
        for (int i = 0; i < count; i++) {
            startFailures.add(failure);
        }
    }

    public void setStartDelayMs(long delayMs) {
        startDelayMs.set(delayMs);
    }

    public void failVolumeDeletes(boolean fail) {
        this.failVolumeDeletes = fail;
    }

    public int startCount() {
        return startCount.get();
    }

    public int destroyCount() {
        return destroyCount.get();
    }

    public boolean hasInstance(String instanceRef) {
        return instances.containsKey(instanceRef);
    }

    public int instanceCount() {
        return instances.size();
    }

    public boolean hasVolume(String volumeRef) {
        return volumes.containsKey(volumeRef);
    }

    public int volumeCount() {
        return volumes.size();
    }

    public void clear() {
        instances.clear();
        volumes.clear();
        startFailures.clear();
        startDelayMs.set(0);
        failVolumeDeletes = false;
    }

    private static boolean matches(Map<String, String> labels, Map<String, String> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!entry.getValue().equals(labels.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during simulated start", e);
        }
    }
}
