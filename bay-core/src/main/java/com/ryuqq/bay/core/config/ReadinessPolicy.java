package com.ryuqq.bay.core.config;

/**
 * 런타임 readiness 대기 정책 (불변 record).
 *
 * <p>인스턴스 시작 후 런타임 health가 확인될 때까지 지수 백오프로 폴링합니다.
 * 전체 대기는 {@code budgetMs}를 넘지 않으며, 넘으면 시작 시도는 포기되고
 * Session은 FAILED로 표시됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>budgetMs: 전체 대기 예산 (기본 120000ms = 2분)</li>
 *   <li>initialIntervalMs: 첫 폴링 간격 (기본 500ms)</li>
 *   <li>maxIntervalMs: 폴링 간격 상한 (기본 1000ms)</li>
 *   <li>multiplier: 간격 증가 배수 (기본 2.0)</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 * @param budgetMs 전체 대기 예산 (밀리초, 양수)
 * @param initialIntervalMs 첫 폴링 간격 (밀리초, 양수)
 * @param maxIntervalMs 폴링 간격 상한 (밀리초, initialIntervalMs 이상)
 * @param multiplier 간격 증가 배수 (1.0 이상)
 */
public record ReadinessPolicy(
    long budgetMs,
    long initialIntervalMs,
    long maxIntervalMs,
    double multiplier
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: budgetMs=120000, initialIntervalMs=500, maxIntervalMs=1000, multiplier=2.0</p>
     */
    public ReadinessPolicy() {
        this(120000, 500, 1000, 2.0);
    }

    public ReadinessPolicy {
        if (budgetMs <= 0) {
            throw new IllegalArgumentException(
                "budgetMs must be positive (current: " + budgetMs + ")"
            );
        }
        if (initialIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "initialIntervalMs must be positive (current: " + initialIntervalMs + ")"
            );
        }
        if (maxIntervalMs < initialIntervalMs) {
            throw new IllegalArgumentException(
                "maxIntervalMs must be >= initialIntervalMs (current: " + maxIntervalMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
    }

    public ReadinessPolicy withBudgetMs(long budgetMs) {
        return new ReadinessPolicy(budgetMs, initialIntervalMs, maxIntervalMs, multiplier);
    }

    public ReadinessPolicy withIntervals(long initialIntervalMs, long maxIntervalMs) {
        return new ReadinessPolicy(budgetMs, initialIntervalMs, maxIntervalMs, multiplier);
    }
}
