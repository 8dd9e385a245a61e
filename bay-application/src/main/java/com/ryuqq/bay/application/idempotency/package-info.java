/**
 * Request idempotency ledger API.
 *
 * <p>Idempotency is opt-in: requests without an Idempotency-Key always execute.
 * Records are scoped by {@code (owner, key)} and expire after the configured TTL.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
package com.ryuqq.bay.application.idempotency;
