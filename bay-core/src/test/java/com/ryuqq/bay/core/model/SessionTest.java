package com.ryuqq.bay.core.model;

import com.ryuqq.bay.core.statemachine.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Session 레코드 테스트.
 *
 * @author Bay Team
 * @since 1.0.0
 */
class SessionTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final SandboxId SANDBOX_ID = SandboxId.of("sandbox-000000000001");

    @Test
    void pending_DesiresRunning() {
        // When
        Session session = Session.pending(SANDBOX_ID, RuntimeType.SHIP, "python-default", NOW);

        // Then
        assertEquals(SessionState.RUNNING, session.desiredState());
        assertEquals(SessionState.PENDING, session.observedState());
        assertTrue(session.isLive());
        assertFalse(session.isReady());
        assertTrue(session.id().getValue().startsWith("sess-"));
    }

    @Test
    void markRunning_SetsIdleDeadlineAndReady() {
        // Given
        Session session = Session.pending(SANDBOX_ID, RuntimeType.SHIP, "python-default", NOW)
            .markStarting()
            .withInstance("inst-1", "http://10.0.0.1:8123");

        // When
        Session running = session.markRunning(NOW.plusSeconds(1800), NOW.plusSeconds(5));

        // Then
        assertTrue(running.isReady());
        assertEquals(NOW.plusSeconds(1800), running.idleExpiresAt());
        assertEquals(NOW.plusSeconds(5), running.lastActiveAt());
        assertFalse(running.isIdleExpiredAt(NOW.plusSeconds(1800)));
        assertTrue(running.isIdleExpiredAt(NOW.plusSeconds(1801)));
    }

    @Test
    void markFailed_ClearsInstance() {
        // Given
        Session starting = Session.pending(SANDBOX_ID, RuntimeType.SHIP, "python-default", NOW)
            .markStarting()
            .withInstance("inst-1", "http://10.0.0.1:8123");

        // When
        Session failed = starting.markFailed();

        // Then
        assertEquals(SessionState.FAILED, failed.observedState());
        assertNull(failed.instanceRef());
        assertNull(failed.endpoint());
        assertFalse(failed.isLive());
    }

    @Test
    void markRunning_FromPending_ThrowsException() {
        Session pending = Session.pending(SANDBOX_ID, RuntimeType.SHIP, "python-default", NOW);

        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> pending.markRunning(NOW, NOW)
        );
        assertTrue(exception.getMessage().contains("PENDING"));
    }

    @Test
    void isIdleExpiredAt_NotRunning_ReturnsFalse() {
        Session pending = Session.pending(SANDBOX_ID, RuntimeType.SHIP, "python-default", NOW);

        assertFalse(pending.isIdleExpiredAt(NOW.plusSeconds(999_999)));
    }
}
