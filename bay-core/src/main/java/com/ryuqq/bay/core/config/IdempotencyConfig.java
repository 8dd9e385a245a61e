package com.ryuqq.bay.core.config;

/**
 * 멱등성 원장 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 원장 사용 여부 (기본 true, false면 키가 있어도 항상 실행)</li>
 *   <li>ttlMs: 기록 보존 기간 (기본 3600000ms = 1시간)</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 * @param enabled 원장 사용 여부
 * @param ttlMs 기록 보존 기간 (밀리초, 양수)
 */
public record IdempotencyConfig(
    boolean enabled,
    long ttlMs
) {

    /**
     * 기본 설정 생성자 (enabled=true, ttlMs=1시간).
     */
    public IdempotencyConfig() {
        this(true, 3_600_000L);
    }

    public IdempotencyConfig {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
    }

    public IdempotencyConfig withEnabled(boolean enabled) {
        return new IdempotencyConfig(enabled, ttlMs);
    }

    public IdempotencyConfig withTtlMs(long ttlMs) {
        return new IdempotencyConfig(enabled, ttlMs);
    }
}
