/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces infrastructure adapters implement to
 * provide storage, compute and runtime access to the control plane.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bay.core.spi.SandboxStore}, {@link com.ryuqq.bay.core.spi.SessionStore},
 *       {@link com.ryuqq.bay.core.spi.WorkspaceStore}, {@link com.ryuqq.bay.core.spi.IdempotencyStore}
 *       - Record Store</li>
 *   <li>{@link com.ryuqq.bay.core.spi.ComputeDriver} - container engine</li>
 *   <li>{@link com.ryuqq.bay.core.spi.RuntimeAdapterFactory} - in-sandbox runtime clients</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g. bay-adapter-inmemory) provide concrete implementations.
 * A store implementation must offer at least read-committed isolation plus the atomic
 * unique-insert primitives named on {@code SessionStore} and {@code IdempotencyStore}.</p>
 *
 * @since 1.0.0
 * @author Bay Team
 */
package com.ryuqq.bay.core.spi;
