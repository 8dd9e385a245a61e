package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sandbox 단위 임계 구역 테이블.
 *
 * <p>Orchestrator 인스턴스가 소유하며(정적 상태 없음), 같은 Sandbox에 대한
 * Session 상태 전이를 전순서로 정렬합니다. 서로 다른 Sandbox 사이에는 순서 보장이 없습니다.</p>
 *
 * <p><strong>사용 방식 (scoped acquisition):</strong></p>
 * <pre>
 * Optional&lt;SandboxLocks.Guard&gt; acquired = locks.tryAcquire(sandboxId, waitMs);
 * if (acquired.isEmpty()) {
 *     // 대기 예산 초과
 * }
 * try (SandboxLocks.Guard guard = acquired.get()) {
 *     RuntimeException adopted = guard.adoptedFailure();
 *     if (adopted != null) {
 *         throw adopted;   // 도착 시점에 진행 중이던 시작이 실패함
 *     }
 *     ...
 * }   // 예외가 발생해도 항상 해제
 * </pre>
 *
 * <p><strong>결과 공유:</strong> 구역을 잡을 때마다 순번(ticket)이 발급됩니다. 시작 시도를 마친 보유자는
 * {@link Guard#recordStarted(Session)} 또는 {@link Guard#recordFailure(RuntimeException)}로 자신의
 * 순번과 함께 결과를 남기고, 해제할 때 해제 순번을 갱신합니다. 대기자는 도착 시점의 해제 순번과
 * 발급 순번 사이에 속한 결과, 즉 도착했을 때 아직 구역을 쥐고 있던 보유자의 결과만 받아들입니다.
 * 결과 기록과 해제 사이에 도착한 대기자도 같은 결과를 받습니다.</p>
 *
 * <p>단일 프로세스 전용입니다. 여러 Orchestrator 인스턴스로 확장하려면 분산 락이나
 * 원자적 조건부 DB 업데이트로 교체해야 합니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class SandboxLocks {

    private final ConcurrentHashMap<SandboxId, Section> sections = new ConcurrentHashMap<>();

    /**
     * 임계 구역 획득 시도 (유한 대기).
     *
     * @param sandboxId Sandbox ID
     * @param waitMs 최대 대기 시간 (밀리초, 0이면 대기 없음)
     * @return 획득한 Guard (대기 예산 초과 시 empty)
     * @throws IllegalStateException 대기 중 인터럽트된 경우 (인터럽트 플래그 복원)
     */
    public Optional<Guard> tryAcquire(SandboxId sandboxId, long waitMs) {
        if (sandboxId == null) {
            throw new IllegalArgumentException("sandboxId cannot be null");
        }
        Section section = sections.computeIfAbsent(sandboxId, id -> new Section());
        // 해제 순번을 먼저 읽어야 도착 시점의 보유자가 구간 안에 들어옴
        long releasedOnArrival = section.releasedTicket;
        long issuedOnArrival = section.issuedTicket;
        try {
            if (!section.lock.tryLock(waitMs, TimeUnit.MILLISECONDS)) {
                return Optional.empty();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for sandbox section: " + sandboxId, e);
        }
        long ticket = section.issuedTicket + 1;
        section.issuedTicket = ticket;
        return Optional.of(new Guard(section, ticket, releasedOnArrival, issuedOnArrival));
    }

    /**
     * Sandbox 삭제 후 테이블 항목 제거.
     *
     * <p>이미 항목을 잡고 대기 중인 호출자는 기존 구역을 계속 사용하며,
     * 구역 안에서 Sandbox가 삭제된 것을 확인하게 됩니다.</p>
     *
     * @param sandboxId Sandbox ID
     */
    public void forget(SandboxId sandboxId) {
        sections.remove(sandboxId);
    }

    int size() {
        return sections.size();
    }

    /**
     * 순번은 보유자만 갱신 (구역 안에서만 쓰기).
     */
    private static final class Section {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile long issuedTicket;
        private volatile long releasedTicket;
        private volatile StartOutcome lastOutcome;
    }

    private record StartOutcome(long ticket, Session started, RuntimeException failure) {
    }

    /**
     * 획득한 임계 구역 (try-with-resources로 해제).
     */
    public static final class Guard implements AutoCloseable {

        private final Section section;
        private final long ticket;
        private final long releasedOnArrival;
        private final long issuedOnArrival;
        private boolean released;

        private Guard(Section section, long ticket, long releasedOnArrival, long issuedOnArrival) {
            this.section = section;
            this.ticket = ticket;
            this.releasedOnArrival = releasedOnArrival;
            this.issuedOnArrival = issuedOnArrival;
        }

        /**
         * 도착했을 때 구역을 쥐고 있던 보유자가 남긴 시작 결과.
         */
        private StartOutcome outcomeWhileWaiting() {
            StartOutcome outcome = section.lastOutcome;
            if (outcome == null) {
                return null;
            }
            return outcome.ticket() > releasedOnArrival && outcome.ticket() <= issuedOnArrival ? outcome : null;
        }

        boolean startCompletedWhileWaiting() {
            return outcomeWhileWaiting() != null;
        }

        /**
         * 대기 중 끝난 시도가 실패였다면 그 예외.
         *
         * @return 승자의 실패 (성공했거나 대기 중 끝난 시도가 없으면 null)
         */
        RuntimeException adoptedFailure() {
            StartOutcome outcome = outcomeWhileWaiting();
            return outcome == null ? null : outcome.failure();
        }

        Session adoptedSession() {
            StartOutcome outcome = outcomeWhileWaiting();
            return outcome == null ? null : outcome.started();
        }

        void recordStarted(Session session) {
            section.lastOutcome = new StartOutcome(ticket, session, null);
        }

        void recordFailure(RuntimeException failure) {
            section.lastOutcome = new StartOutcome(ticket, null, failure);
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                section.releasedTicket = ticket;
                section.lock.unlock();
            }
        }
    }
}
