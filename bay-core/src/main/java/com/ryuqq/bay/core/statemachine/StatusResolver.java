package com.ryuqq.bay.core.statemachine;

import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.Session;

import java.time.Instant;

/**
 * Sandbox 합성 상태 계산기.
 *
 * <p>상태는 저장되지 않고 읽을 때마다 계산됩니다 (lazy expiry 검사 포함).</p>
 *
 * <p><strong>판정 순서:</strong></p>
 * <ol>
 *   <li>soft delete 표시 → DELETED</li>
 *   <li>hard TTL 경과 (expiresAt &lt; now) → EXPIRED</li>
 *   <li>Session 없음 → IDLE</li>
 *   <li>Session PENDING/STARTING → STARTING</li>
 *   <li>Session RUNNING → READY</li>
 *   <li>Session FAILED → FAILED</li>
 * </ol>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class StatusResolver {

    private StatusResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 합성 상태 계산.
     *
     * @param sandbox Sandbox 레코드
     * @param session 현재 Session (없으면 null)
     * @param now 기준 시각
     * @return 합성 상태
     * @throws IllegalArgumentException sandbox 또는 now가 null인 경우
     */
    public static SandboxStatus resolve(Sandbox sandbox, Session session, Instant now) {
        if (sandbox == null || now == null) {
            throw new IllegalArgumentException("sandbox and now cannot be null");
        }
        if (sandbox.isDeleted()) {
            return SandboxStatus.DELETED;
        }
        if (sandbox.isExpiredAt(now)) {
            return SandboxStatus.EXPIRED;
        }
        if (session == null) {
            return SandboxStatus.IDLE;
        }
        return switch (session.observedState()) {
            case PENDING, STARTING -> SandboxStatus.STARTING;
            case RUNNING -> SandboxStatus.READY;
            case FAILED -> SandboxStatus.FAILED;
        };
    }
}
