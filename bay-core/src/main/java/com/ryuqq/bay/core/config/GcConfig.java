package com.ryuqq.bay.core.config;

/**
 * Garbage Collector 설정 (불변 record).
 *
 * <p>각 GC 작업은 자신의 주기로 독립적으로 스케줄되며, 프로세스 시작 시
 * 한 번의 즉시 패스(이전 프로세스가 남긴 상태 정리)를 수행합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 스케줄러 사용 여부 (기본 true)</li>
 *   <li>runOnStartup: 시작 시 즉시 패스 여부 (기본 true)</li>
 *   <li>expiredSandboxIntervalMs: 만료 Sandbox 정리 주기 (기본 60000ms)</li>
 *   <li>idleSessionIntervalMs: idle Session 정리 주기 (기본 60000ms)</li>
 *   <li>orphanWorkspaceIntervalMs: 고아 Workspace 정리 주기 (기본 300000ms)</li>
 *   <li>orphanInstanceIntervalMs: 고아 인스턴스 정리 주기 (기본 300000ms)</li>
 *   <li>expiredIdempotencyIntervalMs: 만료 멱등성 기록 정리 주기 (기본 600000ms)</li>
 *   <li>batchSize: 작업당 한 번에 처리할 항목 수 (기본 100)</li>
 *   <li>itemRetry: 항목 단위 재시도 정책</li>
 *   <li>reclaimExternalWorkspaces: 참조 없는 external Workspace 회수 여부 (기본 false)</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 * @param enabled 스케줄러 사용 여부
 * @param runOnStartup 시작 시 즉시 패스 여부
 * @param expiredSandboxIntervalMs 만료 Sandbox 정리 주기 (밀리초, 양수)
 * @param idleSessionIntervalMs idle Session 정리 주기 (밀리초, 양수)
 * @param orphanWorkspaceIntervalMs 고아 Workspace 정리 주기 (밀리초, 양수)
 * @param orphanInstanceIntervalMs 고아 인스턴스 정리 주기 (밀리초, 양수)
 * @param expiredIdempotencyIntervalMs 만료 멱등성 기록 정리 주기 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param itemRetry 항목 단위 재시도 정책 (null 불가)
 * @param reclaimExternalWorkspaces external Workspace 회수 여부
 */
public record GcConfig(
    boolean enabled,
    boolean runOnStartup,
    long expiredSandboxIntervalMs,
    long idleSessionIntervalMs,
    long orphanWorkspaceIntervalMs,
    long orphanInstanceIntervalMs,
    long expiredIdempotencyIntervalMs,
    int batchSize,
    RetryPolicy itemRetry,
    boolean reclaimExternalWorkspaces
) {

    /**
     * 기본 설정 생성자.
     */
    public GcConfig() {
        this(true, true, 60_000, 60_000, 300_000, 300_000, 600_000, 100, new RetryPolicy(), false);
    }

    public GcConfig {
        requirePositive("expiredSandboxIntervalMs", expiredSandboxIntervalMs);
        requirePositive("idleSessionIntervalMs", idleSessionIntervalMs);
        requirePositive("orphanWorkspaceIntervalMs", orphanWorkspaceIntervalMs);
        requirePositive("orphanInstanceIntervalMs", orphanInstanceIntervalMs);
        requirePositive("expiredIdempotencyIntervalMs", expiredIdempotencyIntervalMs);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (itemRetry == null) {
            throw new IllegalArgumentException("itemRetry cannot be null");
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public GcConfig withEnabled(boolean enabled) {
        return new GcConfig(enabled, runOnStartup, expiredSandboxIntervalMs, idleSessionIntervalMs,
            orphanWorkspaceIntervalMs, orphanInstanceIntervalMs, expiredIdempotencyIntervalMs,
            batchSize, itemRetry, reclaimExternalWorkspaces);
    }

    public GcConfig withRunOnStartup(boolean runOnStartup) {
        return new GcConfig(enabled, runOnStartup, expiredSandboxIntervalMs, idleSessionIntervalMs,
            orphanWorkspaceIntervalMs, orphanInstanceIntervalMs, expiredIdempotencyIntervalMs,
            batchSize, itemRetry, reclaimExternalWorkspaces);
    }

    /**
     * 모든 작업 주기를 같은 값으로 변경한 새 인스턴스 생성.
     */
    public GcConfig withUniformIntervalMs(long intervalMs) {
        return new GcConfig(enabled, runOnStartup, intervalMs, intervalMs, intervalMs, intervalMs, intervalMs,
            batchSize, itemRetry, reclaimExternalWorkspaces);
    }

    public GcConfig withBatchSize(int batchSize) {
        return new GcConfig(enabled, runOnStartup, expiredSandboxIntervalMs, idleSessionIntervalMs,
            orphanWorkspaceIntervalMs, orphanInstanceIntervalMs, expiredIdempotencyIntervalMs,
            batchSize, itemRetry, reclaimExternalWorkspaces);
    }

    public GcConfig withItemRetry(RetryPolicy itemRetry) {
        return new GcConfig(enabled, runOnStartup, expiredSandboxIntervalMs, idleSessionIntervalMs,
            orphanWorkspaceIntervalMs, orphanInstanceIntervalMs, expiredIdempotencyIntervalMs,
            batchSize, itemRetry, reclaimExternalWorkspaces);
    }

    public GcConfig withReclaimExternalWorkspaces(boolean reclaimExternalWorkspaces) {
        return new GcConfig(enabled, runOnStartup, expiredSandboxIntervalMs, idleSessionIntervalMs,
            orphanWorkspaceIntervalMs, orphanInstanceIntervalMs, expiredIdempotencyIntervalMs,
            batchSize, itemRetry, reclaimExternalWorkspaces);
    }
}
