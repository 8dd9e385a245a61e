/**
 * In-memory Record Store implementations.
 *
 * <p>Reference implementations of every store SPI in {@code com.ryuqq.bay.core.spi},
 * used by the testkit and by single-process deployments that do not need durability.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bay.adapter.inmemory.store.InMemorySandboxStore}</li>
 *   <li>{@link com.ryuqq.bay.adapter.inmemory.store.InMemorySessionStore} - atomic at-most-one live session</li>
 *   <li>{@link com.ryuqq.bay.adapter.inmemory.store.InMemoryWorkspaceStore}</li>
 *   <li>{@link com.ryuqq.bay.adapter.inmemory.store.InMemoryIdempotencyStore} - atomic unique insert</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
package com.ryuqq.bay.adapter.inmemory.store;
