package com.ryuqq.bay.adapter.inmemory.store;

import com.ryuqq.bay.core.model.IdempotencyRecord;
import com.ryuqq.bay.core.spi.IdempotencyStore;

import java.time.Instant;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link IdempotencyStore} for testing and reference purposes.
 *
 * <p>{@link ConcurrentHashMap#putIfAbsent} provides the atomic unique insert on
 * {@code (owner, key)}: of two concurrent inserts exactly one wins and the loser
 * receives the winner's record.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ConcurrentHashMap<RecordKey, IdempotencyRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<IdempotencyRecord> find(String owner, String key) {
        return Optional.ofNullable(records.get(new RecordKey(owner, key)));
    }

    @Override
    public Optional<IdempotencyRecord> insertIfAbsent(IdempotencyRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return Optional.ofNullable(records.putIfAbsent(new RecordKey(record.owner(), record.key()), record));
    }

    @Override
    public void delete(String owner, String key) {
        records.remove(new RecordKey(owner, key));
    }

    @Override
    public int deleteExpired(Instant now, int limit) {
        int deleted = 0;
        Iterator<IdempotencyRecord> iterator = records.values().iterator();
        while (iterator.hasNext() && deleted < limit) {
            if (iterator.next().isExpiredAt(now)) {
                iterator.remove();
                deleted++;
            }
        }
        return deleted;
    }

    public void clear() {
        records.clear();
    }

    public int size() {
        return records.size();
    }

    private record RecordKey(String owner, String key) {

        RecordKey {
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(key, "key");
        }
    }
}
