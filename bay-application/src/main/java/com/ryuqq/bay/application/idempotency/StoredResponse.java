package com.ryuqq.bay.application.idempotency;

/**
 * 원장에 기록된 응답 (재생 시 그대로 반환).
 *
 * @param body 응답 본문 JSON
 * @param statusCode HTTP 상태 코드
 * @author Bay Team
 * @since 1.0.0
 */
public record StoredResponse(String body, int statusCode) {

    public StoredResponse {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
    }
}
