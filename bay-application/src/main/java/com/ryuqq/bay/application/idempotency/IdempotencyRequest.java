package com.ryuqq.bay.application.idempotency;

/**
 * 멱등성 검사 대상 요청.
 *
 * @param owner 소유자
 * @param key Idempotency-Key (null = 멱등성 미사용)
 * @param method HTTP 메서드
 * @param path 요청 경로
 * @param body 요청 본문 (직렬화되어 fingerprint에 포함, null 허용)
 * @author Bay Team
 * @since 1.0.0
 */
public record IdempotencyRequest(String owner, String key, String method, String path, Object body) {

    public IdempotencyRequest {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
    }

    public boolean hasKey() {
        return key != null;
    }
}
