package com.ryuqq.bay.core.config;

/**
 * 유한 재시도 정책 (불변 record).
 *
 * <p>GC의 항목 단위 재시도에 사용됩니다. 무한 재시도는 허용하지 않으며,
 * 시도 횟수와 지수 백오프 범위가 항상 명시적으로 주어집니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>initialBackoffMs: 첫 재시도 전 대기 (기본 100ms)</li>
 *   <li>maxBackoffMs: 대기 상한 (기본 2000ms)</li>
 *   <li>multiplier: 지수 배수 (기본 2.0)</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param initialBackoffMs 첫 백오프 (밀리초, 0 이상)
 * @param maxBackoffMs 백오프 상한 (밀리초, initialBackoffMs 이상)
 * @param multiplier 지수 배수 (1.0 이상)
 */
public record RetryPolicy(
    int maxAttempts,
    long initialBackoffMs,
    long maxBackoffMs,
    double multiplier
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, initialBackoffMs=100, maxBackoffMs=2000, multiplier=2.0</p>
     */
    public RetryPolicy() {
        this(3, 100, 2000, 2.0);
    }

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(
                "maxAttempts must be at least 1 (current: " + maxAttempts + ")"
            );
        }
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException(
                "initialBackoffMs cannot be negative (current: " + initialBackoffMs + ")"
            );
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= initialBackoffMs (current: " + maxBackoffMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
    }

    /**
     * 재시도 없이 한 번만 시도하는 정책.
     *
     * @return maxAttempts=1 정책
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, 0, 1.0);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, multiplier);
    }

    public RetryPolicy withInitialBackoffMs(long initialBackoffMs) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, multiplier);
    }

    public RetryPolicy withMaxBackoffMs(long maxBackoffMs) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, multiplier);
    }
}
