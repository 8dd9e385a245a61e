package com.ryuqq.bay.core.spi;

import com.ryuqq.bay.core.model.RuntimeType;

/**
 * Creates {@link RuntimeAdapter}s for a runtime family and endpoint.
 *
 * <p>The runtime type is chosen once when the session is created and stored on the
 * session; callers use it here instead of re-dispatching on strings.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RuntimeAdapterFactory {

    /**
     * @param runtimeType runtime family
     * @param endpoint runtime base URL
     * @return adapter bound to the endpoint
     * @throws IllegalArgumentException if the runtime type is not supported
     */
    RuntimeAdapter create(RuntimeType runtimeType, String endpoint);
}
