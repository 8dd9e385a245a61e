package com.ryuqq.bay.core.config;

/**
 * Orchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>readiness: 런타임 readiness 대기 정책</li>
 *   <li>lockWaitMs: Sandbox 단위 임계 구역 획득 대기 상한 (기본 130000ms)</li>
 *   <li>retryAfterMs: session_not_ready 응답의 권장 재시도 지연 (기본 1000ms)</li>
 *   <li>driverCallTimeoutMs: 드라이버 호출 1회의 상한 (기본 60000ms)</li>
 *   <li>maxExtendSeconds: extend_ttl 1회 연장 상한 (기본 86400초 = 1일)</li>
 *   <li>defaultListLimit / maxListLimit: 목록 페이지 크기 (기본 50 / 200)</li>
 *   <li>defaultWorkspaceSizeMb: managed Workspace 기본 크기 (기본 1024MB)</li>
 * </ul>
 *
 * <p>lockWaitMs는 readiness 예산보다 길어야 합니다. 그렇지 않으면 승자가 시작을
 * 끝내기 전에 대기자가 항상 포기하게 됩니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 * @param readiness readiness 대기 정책 (null 불가)
 * @param lockWaitMs 임계 구역 대기 상한 (밀리초, 양수)
 * @param retryAfterMs 권장 재시도 지연 (밀리초, 양수)
 * @param driverCallTimeoutMs 드라이버 호출 상한 (밀리초, 양수)
 * @param maxExtendSeconds 1회 연장 상한 (초, 양수)
 * @param defaultListLimit 기본 페이지 크기
 * @param maxListLimit 최대 페이지 크기
 * @param defaultWorkspaceSizeMb managed Workspace 기본 크기 (MB, 양수)
 */
public record OrchestratorConfig(
    ReadinessPolicy readiness,
    long lockWaitMs,
    long retryAfterMs,
    long driverCallTimeoutMs,
    long maxExtendSeconds,
    int defaultListLimit,
    int maxListLimit,
    int defaultWorkspaceSizeMb
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(new ReadinessPolicy(), 130_000, 1_000, 60_000, 86_400, 50, 200, 1024);
    }

    public OrchestratorConfig {
        if (readiness == null) {
            throw new IllegalArgumentException("readiness cannot be null");
        }
        if (lockWaitMs <= 0) {
            throw new IllegalArgumentException("lockWaitMs must be positive (current: " + lockWaitMs + ")");
        }
        if (retryAfterMs <= 0) {
            throw new IllegalArgumentException("retryAfterMs must be positive (current: " + retryAfterMs + ")");
        }
        if (driverCallTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "driverCallTimeoutMs must be positive (current: " + driverCallTimeoutMs + ")"
            );
        }
        if (maxExtendSeconds <= 0) {
            throw new IllegalArgumentException(
                "maxExtendSeconds must be positive (current: " + maxExtendSeconds + ")"
            );
        }
        if (defaultListLimit <= 0 || defaultListLimit > maxListLimit) {
            throw new IllegalArgumentException(
                "defaultListLimit must be in 1.." + maxListLimit + " (current: " + defaultListLimit + ")"
            );
        }
        if (defaultWorkspaceSizeMb <= 0) {
            throw new IllegalArgumentException(
                "defaultWorkspaceSizeMb must be positive (current: " + defaultWorkspaceSizeMb + ")"
            );
        }
    }

    public OrchestratorConfig withReadiness(ReadinessPolicy readiness) {
        return new OrchestratorConfig(readiness, lockWaitMs, retryAfterMs, driverCallTimeoutMs,
            maxExtendSeconds, defaultListLimit, maxListLimit, defaultWorkspaceSizeMb);
    }

    public OrchestratorConfig withLockWaitMs(long lockWaitMs) {
        return new OrchestratorConfig(readiness, lockWaitMs, retryAfterMs, driverCallTimeoutMs,
            maxExtendSeconds, defaultListLimit, maxListLimit, defaultWorkspaceSizeMb);
    }

    public OrchestratorConfig withDriverCallTimeoutMs(long driverCallTimeoutMs) {
        return new OrchestratorConfig(readiness, lockWaitMs, retryAfterMs, driverCallTimeoutMs,
            maxExtendSeconds, defaultListLimit, maxListLimit, defaultWorkspaceSizeMb);
    }

    public OrchestratorConfig withMaxExtendSeconds(long maxExtendSeconds) {
        return new OrchestratorConfig(readiness, lockWaitMs, retryAfterMs, driverCallTimeoutMs,
            maxExtendSeconds, defaultListLimit, maxListLimit, defaultWorkspaceSizeMb);
    }
}
