package com.ryuqq.bay.core.model;

import java.time.Instant;

/**
 * 멱등성 원장 레코드.
 *
 * <p>(owner, key) 조합으로 식별되며, 수명 동안 정확히 하나의 fingerprint에 매핑됩니다.
 * 같은 키로 다른 fingerprint를 쓰려는 시도는 덮어쓰기가 아니라 충돌입니다.</p>
 *
 * @param owner 소유자 (키 네임스페이스)
 * @param key 클라이언트가 제공한 Idempotency-Key
 * @param fingerprint 요청 지문 (method + path + body 의 SHA-256 hex)
 * @param responseSnapshot 기록된 응답 본문 (JSON)
 * @param statusCode 기록된 상태 코드
 * @param createdAt 생성 시각
 * @param expiresAt 만료 시각
 *
 * @author Bay Team
 * @since 1.0.0
 */
public record IdempotencyRecord(
    String owner,
    String key,
    String fingerprint,
    String responseSnapshot,
    int statusCode,
    Instant createdAt,
    Instant expiresAt
) {

    public IdempotencyRecord {
        if (owner == null || key == null) {
            throw new IllegalArgumentException("owner and key are required for IdempotencyRecord");
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint cannot be null or blank");
        }
        if (responseSnapshot == null) {
            throw new IllegalArgumentException("responseSnapshot cannot be null");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("createdAt and expiresAt cannot be null");
        }
    }

    /**
     * 주어진 시각 기준 만료 여부.
     *
     * @param now 기준 시각
     * @return now &gt;= expiresAt 이면 true
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
