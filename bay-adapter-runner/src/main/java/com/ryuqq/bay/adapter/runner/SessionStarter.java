package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.core.config.ProfileConfig;
import com.ryuqq.bay.core.error.SessionNotReadyException;
import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.InstanceLabels;
import com.ryuqq.bay.core.spi.SessionStore;
import com.ryuqq.bay.core.spi.StartedInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Session 시작 절차 (Sandbox 임계 구역 안에서만 호출).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. PENDING Session 원자적 insert (살아있는 Session이 있으면 거부)
 * 2. STARTING 전이 → driver.start(profile, workspace, labels)
 * 3. instanceRef / endpoint 기록
 * 4. readiness 대기 (유한 예산)
 * 5. 성공: RUNNING + idleExpiresAt = now + profile.idleTimeout
 *    실패: 인스턴스 destroy → FAILED → 예외 전파
 * </pre>
 *
 * <p>실패 후 destroy마저 실패한 인스턴스는 라벨로 식별되어 OrphanInstanceGc가 회수합니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class SessionStarter {

    private static final Logger log = LoggerFactory.getLogger(SessionStarter.class);

    private final SessionStore sessionStore;
    private final ComputeDriver driver;
    private final ReadinessWaiter readinessWaiter;
    private final Clock clock;

    public SessionStarter(SessionStore sessionStore, ComputeDriver driver, ReadinessWaiter readinessWaiter, Clock clock) {
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (readinessWaiter == null) {
            throw new IllegalArgumentException("readinessWaiter cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sessionStore = sessionStore;
        this.driver = driver;
        this.readinessWaiter = readinessWaiter;
        this.clock = clock;
    }

    /**
     * 새 Session 시작.
     *
     * @param sandbox 대상 Sandbox (살아있고 만료되지 않음)
     * @param profile Sandbox의 Profile
     * @param workspace 마운트할 Workspace
     * @return RUNNING Session
     * @throws SessionNotReadyException 다른 살아있는 Session이 이미 있는 경우
     * @throws com.ryuqq.bay.core.error.DriverException 드라이버 실패
     * @throws com.ryuqq.bay.core.error.OperationTimeoutException readiness 예산 초과
     */
    public Session start(Sandbox sandbox, ProfileConfig profile, Workspace workspace) {
        Session session = Session.pending(sandbox.id(), profile.runtimeType(), profile.id(), clock.instant());
        if (!sessionStore.insertIfNoLiveSession(session)) {
            throw new SessionNotReadyException(
                "Another session is already starting", sandbox.id().getValue(), 0);
        }

        session = session.markStarting();
        sessionStore.update(session);
        log.info("Starting session {} for {} (profile: {})", session.id(), sandbox.id(), profile.id());

        StartedInstance instance;
        try {
            instance = driver.start(profile, workspace, InstanceLabels.forSession(sandbox, session));
        } catch (RuntimeException e) {
            markFailed(session, null, e);
            throw e;
        }

        session = session.withInstance(instance.instanceRef(), instance.endpoint());
        sessionStore.update(session);

        try {
            readinessWaiter.await(session);
        } catch (RuntimeException e) {
            markFailed(session, instance.instanceRef(), e);
            throw e;
        }

        Instant now = clock.instant();
        session = session.markRunning(now.plusSeconds(profile.idleTimeoutSeconds()), now);
        sessionStore.update(session);
        log.info("Session {} running for {} at {}", session.id(), sandbox.id(), session.endpoint());
        return session;
    }

    private void markFailed(Session session, String instanceRef, RuntimeException cause) {
        log.warn("Session {} for {} failed to start: {}", session.id(), session.sandboxId(), cause.getMessage());
        if (instanceRef != null) {
            try {
                driver.destroy(instanceRef);
            } catch (RuntimeException destroyError) {
                cause.addSuppressed(destroyError);
                log.error("Failed to destroy instance {} of failed session {}, leaving it to orphan GC",
                    instanceRef, session.id(), destroyError);
            }
        }
        sessionStore.update(session.markFailed());
    }
}
