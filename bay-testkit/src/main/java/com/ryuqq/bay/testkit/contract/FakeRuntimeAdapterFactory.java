package com.ryuqq.bay.testkit.contract;

import com.ryuqq.bay.core.model.RuntimeType;
import com.ryuqq.bay.core.spi.RuntimeAdapter;
import com.ryuqq.bay.core.spi.RuntimeAdapterFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime adapter factory whose adapters report a switchable health state.
 *
 * <p>All adapters share the factory's health flag and capability list, so a test can
 * make every runtime unreachable with one call.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class FakeRuntimeAdapterFactory implements RuntimeAdapterFactory {

    private final AtomicInteger created = new AtomicInteger();
    private volatile boolean healthy = true;
    private volatile List<String> capabilities = List.of("filesystem", "shell", "python");

    @Override
    public RuntimeAdapter create(RuntimeType runtimeType, String endpoint) {
        created.incrementAndGet();
        return new FakeRuntimeAdapter(endpoint);
    }

    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public void setCapabilities(List<String> capabilities) {
        this.capabilities = List.copyOf(capabilities);
    }

    public int createdCount() {
        return created.get();
    }

    public void clear() {
        healthy = true;
        capabilities = List.of("filesystem", "shell", "python");
    }

    /**
     * Adapter bound to one endpoint.
     */
    public final class FakeRuntimeAdapter implements RuntimeAdapter {

        private final String endpoint;

        private FakeRuntimeAdapter(String endpoint) {
            this.endpoint = endpoint;
        }

        public String endpoint() {
            return endpoint;
        }

        @Override
        public boolean isHealthy() {
            return healthy;
        }

        @Override
        public List<String> capabilities() {
            return capabilities;
        }
    }
}
