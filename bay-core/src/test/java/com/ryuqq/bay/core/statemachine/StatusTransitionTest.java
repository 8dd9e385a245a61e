package com.ryuqq.bay.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.bay.core.statemachine.SandboxStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusTransition 테스트.
 *
 * <ul>
 *   <li>idle → starting → ready → idle 정상 흐름</li>
 *   <li>failed → starting 재시도 (암묵적)</li>
 *   <li>expired / deleted 에서 live 상태로의 전이 불가 (부활 금지)</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
class StatusTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_IdleToReadyToIdle_Succeeds() {
        // Given
        SandboxStatus status = IDLE;

        // When
        status = StatusTransition.transition(status, STARTING);
        status = StatusTransition.transition(status, READY);
        status = StatusTransition.transition(status, IDLE);

        // Then
        assertEquals(IDLE, status);
    }

    @Test
    void validate_FailedToStarting_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StatusTransition.validate(FAILED, STARTING));
    }

    @Test
    void validate_StartingToFailed_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StatusTransition.validate(STARTING, FAILED));
    }

    @Test
    void validate_AnyLiveStateToDeleted_Succeeds() {
        for (SandboxStatus from : new SandboxStatus[]{IDLE, STARTING, READY, FAILED, EXPIRED}) {
            assertTrue(StatusTransition.isAllowed(from, DELETED), from + " → DELETED");
        }
    }

    @Test
    void validate_IdleAndReadyToExpired_Succeeds() {
        assertTrue(StatusTransition.isAllowed(IDLE, EXPIRED));
        assertTrue(StatusTransition.isAllowed(READY, EXPIRED));
    }

    // ========== 불법 전이 테스트: 부활 금지 ==========

    @Test
    void validate_ExpiredToLiveState_ThrowsException() {
        for (SandboxStatus to : new SandboxStatus[]{IDLE, STARTING, READY, FAILED}) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StatusTransition.validate(EXPIRED, to)
            );
            assertTrue(exception.getMessage().contains("EXPIRED"));
        }
    }

    @Test
    void validate_DeletedToAnyState_ThrowsException() {
        for (SandboxStatus to : SandboxStatus.values()) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StatusTransition.validate(DELETED, to)
            );
            assertTrue(exception.getMessage().contains("terminal"));
        }
    }

    @Test
    void validate_IdleToReady_ThrowsException() {
        // starting을 거치지 않는 전이는 불가
        assertThrows(IllegalStateException.class, () -> StatusTransition.validate(IDLE, READY));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(null, IDLE));
        assertThrows(IllegalArgumentException.class, () -> StatusTransition.validate(IDLE, null));
        assertFalse(StatusTransition.isAllowed(null, IDLE));
    }

    @Test
    void isTerminal_OnlyExpiredAndDeleted() {
        assertTrue(EXPIRED.isTerminal());
        assertTrue(DELETED.isTerminal());
        assertFalse(IDLE.isTerminal());
        assertFalse(STARTING.isTerminal());
        assertFalse(READY.isTerminal());
        assertFalse(FAILED.isTerminal());
    }
}
