package com.ryuqq.bay.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.bay.application.idempotency.IdempotencyLedger;
import com.ryuqq.bay.application.idempotency.IdempotencyRequest;
import com.ryuqq.bay.application.idempotency.StoredResponse;
import com.ryuqq.bay.core.config.IdempotencyConfig;
import com.ryuqq.bay.core.error.ConflictException;
import com.ryuqq.bay.core.error.ValidationException;
import com.ryuqq.bay.core.model.IdempotencyRecord;
import com.ryuqq.bay.core.spi.IdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * {@link IdempotencyStore} 기반 멱등성 원장.
 *
 * <p><strong>Fingerprint:</strong> {@code method:path:body} 문자열의 SHA-256 hex.
 * body는 속성 이름 순으로 정렬된 JSON으로 직렬화되어, 같은 내용의 요청은 항상 같은 지문을 가집니다.</p>
 *
 * <p><strong>만료:</strong> 조회 시점에 만료된 기록은 삭제 후 "기록 없음"으로 취급하고,
 * 남은 기록은 {@link #purgeExpired(int)} (GC)가 일괄 정리합니다.</p>
 *
 * <p><strong>동시 save:</strong> 저장소의 원자적 {@code insertIfAbsent}로 승자를 정합니다.
 * 진 쪽은 승자의 기록을 반환합니다 (fingerprint가 다르면 충돌).</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class StoreBackedIdempotencyLedger implements IdempotencyLedger {

    private static final Logger log = LoggerFactory.getLogger(StoreBackedIdempotencyLedger.class);

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,128}$");

    private final IdempotencyStore store;
    private final IdempotencyConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 원장 저장소
     * @param config 원장 설정
     * @param objectMapper 응답 스냅샷 직렬화기 ({@link #defaultObjectMapper()} 권장)
     * @param clock 시각 공급원
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StoreBackedIdempotencyLedger(IdempotencyStore store, IdempotencyConfig config,
                                        ObjectMapper objectMapper, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * 원장용 ObjectMapper.
     *
     * <p>시각은 ISO-8601 문자열로, 속성과 Map 키는 이름 순으로 직렬화합니다.</p>
     *
     * @return ObjectMapper
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    }

    @Override
    public Optional<StoredResponse> check(IdempotencyRequest request) {
        if (!isTracked(request)) {
            return Optional.empty();
        }
        validateKey(request.key());

        Optional<IdempotencyRecord> found = findUnexpired(request.owner(), request.key());
        if (found.isEmpty()) {
            return Optional.empty();
        }

        IdempotencyRecord record = found.get();
        if (!record.fingerprint().equals(fingerprint(request))) {
            log.warn("Idempotency key reused with different request (owner: {}, key: {})",
                request.owner(), request.key());
            throw ConflictException.idempotencyKeyReused(request.key());
        }
        log.debug("Replaying recorded response (owner: {}, key: {})", request.owner(), request.key());
        return Optional.of(new StoredResponse(record.responseSnapshot(), record.statusCode()));
    }

    @Override
    public StoredResponse save(IdempotencyRequest request, Object response, int statusCode) {
        return saveSnapshot(request, toJson(response), statusCode);
    }

    @Override
    public <T> T execute(IdempotencyRequest request, Class<T> responseType, int statusCode, Supplier<T> operation) {
        if (responseType == null) {
            throw new IllegalArgumentException("responseType cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        Optional<StoredResponse> replay = check(request);
        if (replay.isPresent()) {
            return fromJson(replay.get().body(), responseType);
        }

        T result = operation.get();
        String snapshot = toJson(result);
        StoredResponse stored = saveSnapshot(request, snapshot, statusCode);
        if (stored.body().equals(snapshot)) {
            return result;
        }
        return fromJson(stored.body(), responseType);
    }

    @Override
    public int purgeExpired(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        return store.deleteExpired(clock.instant(), limit);
    }

    private StoredResponse saveSnapshot(IdempotencyRequest request, String snapshot, int statusCode) {
        if (!isTracked(request)) {
            return new StoredResponse(snapshot, statusCode);
        }
        validateKey(request.key());

        Instant now = clock.instant();
        String fingerprint = fingerprint(request);
        IdempotencyRecord record = new IdempotencyRecord(
            request.owner(), request.key(), fingerprint, snapshot, statusCode,
            now, now.plusMillis(config.ttlMs()));

        Optional<IdempotencyRecord> existing = store.insertIfAbsent(record);
        if (existing.isPresent() && existing.get().isExpiredAt(now)) {
            store.delete(request.owner(), request.key());
            existing = store.insertIfAbsent(record);
        }
        if (existing.isEmpty()) {
            return new StoredResponse(snapshot, statusCode);
        }

        IdempotencyRecord winner = existing.get();
        if (!winner.fingerprint().equals(fingerprint)) {
            throw ConflictException.idempotencyKeyReused(request.key());
        }
        log.info("Lost idempotency race, returning recorded response (owner: {}, key: {})",
            request.owner(), request.key());
        return new StoredResponse(winner.responseSnapshot(), winner.statusCode());
    }

    private Optional<IdempotencyRecord> findUnexpired(String owner, String key) {
        Optional<IdempotencyRecord> found = store.find(owner, key);
        if (found.isPresent() && found.get().isExpiredAt(clock.instant())) {
            store.delete(owner, key);
            return Optional.empty();
        }
        return found;
    }

    private boolean isTracked(IdempotencyRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return config.enabled() && request.hasKey();
    }

    private static void validateKey(String key) {
        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new ValidationException(
                "Idempotency-Key must be 1-128 characters of letters, digits, '_' or '-'",
                "idempotency_key", key);
        }
    }

    private String fingerprint(IdempotencyRequest request) {
        String body = request.body() == null ? "" : toJson(request.body());
        String material = request.method() + ":" + request.path() + ":" + body;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize idempotency payload", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize recorded response as " + type.getSimpleName(), e);
        }
    }
}
