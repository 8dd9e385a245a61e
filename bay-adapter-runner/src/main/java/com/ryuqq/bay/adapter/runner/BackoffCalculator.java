package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.core.config.ReadinessPolicy;
import com.ryuqq.bay.core.config.RetryPolicy;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>readiness 폴링 간격과 GC 항목 재시도 간격을 지수적으로 증가시키되,
 * 선택적으로 Jitter를 추가하여 여러 작업이 같은 순간에 몰리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * multiplier^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (readiness 기본값: baseDelay=500ms, multiplier=2.0, maxDelay=1000ms, jitter 없음):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 500ms</li>
 *   <li>attemptCount=2: 1000ms</li>
 *   <li>attemptCount=3 이상: 1000ms (maxDelay 제한)</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final double jitterFactor;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param multiplier 지수 배수 (1.0 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double multiplier, double jitterFactor) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
    }

    /**
     * readiness 폴링용 계산기 (jitter 없음).
     *
     * @param policy readiness 정책
     * @return BackoffCalculator
     */
    public static BackoffCalculator forReadiness(ReadinessPolicy policy) {
        return new BackoffCalculator(policy.initialIntervalMs(), policy.maxIntervalMs(), policy.multiplier(), 0.0);
    }

    /**
     * GC 항목 재시도용 계산기 (jitter 10%).
     *
     * @param policy 재시도 정책
     * @return BackoffCalculator
     */
    public static BackoffCalculator forRetry(RetryPolicy policy) {
        return new BackoffCalculator(policy.initialBackoffMs(), policy.maxBackoffMs(), policy.multiplier(), 0.1);
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 현재 재시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }

        // 1. 지수적 백오프 (overflow 방지를 위해 double로 계산 후 min 적용)
        double raw = baseDelayMs * Math.pow(multiplier, attemptCount - 1);
        long exponential = (long) Math.min(raw, maxDelayMs);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * jitterFactor * Math.random());

        // 3. 최대값 제한
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
