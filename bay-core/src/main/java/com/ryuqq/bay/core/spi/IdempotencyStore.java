package com.ryuqq.bay.core.spi;

import com.ryuqq.bay.core.model.IdempotencyRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * Record Store SPI for the idempotency ledger.
 *
 * <p>Records are unique per {@code (owner, key)}. {@link #insertIfAbsent(IdempotencyRecord)}
 * is the atomic unique-insert primitive the ledger relies on when two retries of
 * the same request race to save their outcome.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface IdempotencyStore {

    Optional<IdempotencyRecord> find(String owner, String key);

    /**
     * Atomically inserts the record unless one exists for the same {@code (owner, key)}.
     *
     * @param record the record to insert
     * @return empty if inserted, otherwise the existing (winning) record
     */
    Optional<IdempotencyRecord> insertIfAbsent(IdempotencyRecord record);

    /**
     * Deletes the record for {@code (owner, key)}. Deleting a missing record is a no-op.
     */
    void delete(String owner, String key);

    /**
     * Bulk-deletes records with {@code expiresAt <= now}.
     *
     * @param now reference time
     * @param limit maximum number of records to delete
     * @return number of deleted records
     */
    int deleteExpired(Instant now, int limit);
}
