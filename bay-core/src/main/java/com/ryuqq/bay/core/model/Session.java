package com.ryuqq.bay.core.model;

import com.ryuqq.bay.core.statemachine.SessionState;

import java.time.Instant;

/**
 * Session 레코드 (Sandbox에 바인딩된 컴퓨트 인스턴스 1개).
 *
 * <p>Session은 외부에서 주소 지정되지 않으며 감사 요구사항이 없으므로,
 * stop/destroy 시 soft delete가 아닌 hard delete 됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Sandbox당 비종료(non-terminal) Session은 최대 1개</li>
 *   <li>{@code idleExpiresAt}은 RUNNING 상태에서만 의미가 있음</li>
 *   <li>observedState 전이는 {@link SessionState#canTransitionTo(SessionState)} 규칙을 따름</li>
 * </ul>
 *
 * @param id Session ID
 * @param sandboxId 소속 Sandbox ID
 * @param runtimeType 생성 시 선택된 런타임 계열
 * @param profileId Profile ID
 * @param desiredState 목표 상태
 * @param observedState 관측 상태
 * @param instanceRef 드라이버가 발급한 인스턴스 참조 (시작 전 null)
 * @param endpoint 런타임 엔드포인트 (시작 전 null)
 * @param idleExpiresAt idle 마감 시각 (RUNNING에서만 non-null)
 * @param createdAt 생성 시각
 * @param lastActiveAt 마지막 활동 시각
 *
 * @author Bay Team
 * @since 1.0.0
 */
public record Session(
    SessionId id,
    SandboxId sandboxId,
    RuntimeType runtimeType,
    String profileId,
    SessionState desiredState,
    SessionState observedState,
    String instanceRef,
    String endpoint,
    Instant idleExpiresAt,
    Instant createdAt,
    Instant lastActiveAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Session {
        if (id == null || sandboxId == null) {
            throw new IllegalArgumentException("id and sandboxId are required for Session");
        }
        if (runtimeType == null) {
            throw new IllegalArgumentException("runtimeType cannot be null");
        }
        if (desiredState == null || observedState == null) {
            throw new IllegalArgumentException("desiredState and observedState cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * PENDING 상태의 신규 Session 생성 (인스턴스 시작 전).
     *
     * @param sandboxId 소속 Sandbox ID
     * @param runtimeType 런타임 계열
     * @param profileId Profile ID
     * @param now 생성 시각
     * @return PENDING Session
     */
    public static Session pending(SandboxId sandboxId, RuntimeType runtimeType, String profileId, Instant now) {
        return new Session(SessionId.generate(), sandboxId, runtimeType, profileId,
            SessionState.RUNNING, SessionState.PENDING, null, null, null, now, now);
    }

    /**
     * 비종료(live) Session인지 확인.
     *
     * @return FAILED가 아니면 true
     */
    public boolean isLive() {
        return !observedState.isTerminal();
    }

    public boolean isReady() {
        return observedState == SessionState.RUNNING && endpoint != null;
    }

    /**
     * idle 마감 시각이 지났는지 확인.
     *
     * @param now 기준 시각
     * @return RUNNING이고 idleExpiresAt &lt; now 인 경우 true
     */
    public boolean isIdleExpiredAt(Instant now) {
        return observedState == SessionState.RUNNING && idleExpiresAt != null && idleExpiresAt.isBefore(now);
    }

    /**
     * STARTING 전이 (드라이버 start 호출 직전).
     */
    public Session markStarting() {
        return withObserved(SessionState.STARTING, instanceRef, endpoint, null);
    }

    /**
     * 드라이버가 발급한 인스턴스 정보 기록.
     *
     * @param newInstanceRef 인스턴스 참조
     * @param newEndpoint 런타임 엔드포인트
     * @return 변경된 Session
     */
    public Session withInstance(String newInstanceRef, String newEndpoint) {
        return new Session(id, sandboxId, runtimeType, profileId, desiredState, observedState,
            newInstanceRef, newEndpoint, idleExpiresAt, createdAt, lastActiveAt);
    }

    /**
     * RUNNING 전이 (런타임 health 확인 후).
     *
     * @param newIdleExpiresAt idle 마감 시각
     * @param now 관측 시각
     * @return RUNNING Session
     */
    public Session markRunning(Instant newIdleExpiresAt, Instant now) {
        return withObserved(SessionState.RUNNING, instanceRef, endpoint, newIdleExpiresAt).withLastActiveAt(now);
    }

    /**
     * FAILED 전이 (인스턴스 자원은 해제된 것으로 간주).
     *
     * @return FAILED Session
     */
    public Session markFailed() {
        return withObserved(SessionState.FAILED, null, null, null);
    }

    /**
     * idle 마감 시각 연장 (keepalive, 재사용).
     *
     * @param newIdleExpiresAt 새 idle 마감 시각
     * @param now 활동 시각
     * @return 변경된 Session
     */
    public Session touch(Instant newIdleExpiresAt, Instant now) {
        return new Session(id, sandboxId, runtimeType, profileId, desiredState, observedState,
            instanceRef, endpoint, newIdleExpiresAt, createdAt, now);
    }

    private Session withLastActiveAt(Instant now) {
        return new Session(id, sandboxId, runtimeType, profileId, desiredState, observedState,
            instanceRef, endpoint, idleExpiresAt, createdAt, now);
    }

    private Session withObserved(SessionState next, String newInstanceRef, String newEndpoint, Instant newIdleExpiresAt) {
        if (!observedState.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Invalid session transition: %s → %s (session: %s)", observedState, next, id)
            );
        }
        return new Session(id, sandboxId, runtimeType, profileId, desiredState, next,
            newInstanceRef, newEndpoint, newIdleExpiresAt, createdAt, lastActiveAt);
    }
}
