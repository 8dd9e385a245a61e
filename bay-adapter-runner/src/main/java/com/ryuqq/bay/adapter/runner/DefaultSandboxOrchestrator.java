package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.application.sandbox.CreateSandboxRequest;
import com.ryuqq.bay.application.sandbox.SandboxOrchestrator;
import com.ryuqq.bay.application.sandbox.SandboxPage;
import com.ryuqq.bay.application.sandbox.SandboxReclaimer;
import com.ryuqq.bay.application.sandbox.SandboxView;
import com.ryuqq.bay.core.config.OrchestratorConfig;
import com.ryuqq.bay.core.config.ProfileConfig;
import com.ryuqq.bay.core.config.ProfileRegistry;
import com.ryuqq.bay.core.error.NotFoundException;
import com.ryuqq.bay.core.error.OperationTimeoutException;
import com.ryuqq.bay.core.error.SandboxExpiredException;
import com.ryuqq.bay.core.error.SandboxTtlInfiniteException;
import com.ryuqq.bay.core.error.SessionNotReadyException;
import com.ryuqq.bay.core.error.ValidationException;
import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.model.WorkspaceId;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.InstanceLabels;
import com.ryuqq.bay.core.spi.SandboxStore;
import com.ryuqq.bay.core.spi.SessionStore;
import com.ryuqq.bay.core.spi.WorkspaceStore;
import com.ryuqq.bay.core.statemachine.SandboxStatus;
import com.ryuqq.bay.core.statemachine.StatusResolver;
import com.ryuqq.bay.core.statemachine.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SandboxOrchestrator} 기본 구현.
 *
 * <p>Sandbox 단위 임계 구역({@link SandboxLocks})으로 같은 Sandbox에 대한 상태 변경을
 * 직렬화합니다. ensureRunning, keepalive, stop, delete, extendTtl과 GC 회수 연산이 모두 같은
 * 구역을 사용하므로 Session 상태 전이는 Sandbox 안에서 전순서를 가집니다.</p>
 *
 * <p><strong>ensureRunning 처리 흐름:</strong></p>
 * <pre>
 * 1. Fast path: 준비된 Session이 있고 idle 만료 전이면 락 없이 반환
 * 2. 임계 구역 획득 (lockWaitMs 까지 대기)
 *    - 초과: 시작 중인 Session이 있으면 session_not_ready, 아니면 timeout
 * 3. 대기 중 다른 호출자가 시작을 끝냈고 실패였다면 같은 예외로 실패
 * 4. 이중 확인: 삭제 → not_found, 만료 → sandbox_expired, 준비됨 → 반환
 * 5. {@link StatusTransition}으로 전이 검증 후 SessionStarter로 시작
 *    (PENDING → STARTING → RUNNING / FAILED)
 * 6. 결과를 구역에 기록하고 해제 (예외 시에도 항상 해제)
 * </pre>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class DefaultSandboxOrchestrator implements SandboxOrchestrator, SandboxReclaimer {

    private static final Logger log = LoggerFactory.getLogger(DefaultSandboxOrchestrator.class);

    private final SandboxStore sandboxStore;
    private final SessionStore sessionStore;
    private final WorkspaceStore workspaceStore;
    private final ComputeDriver driver;
    private final SessionStarter sessionStarter;
    private final ProfileRegistry profiles;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final SandboxLocks locks = new SandboxLocks();

    /**
     * 생성자.
     *
     * @param sandboxStore Sandbox 저장소
     * @param sessionStore Session 저장소
     * @param workspaceStore Workspace 저장소
     * @param driver 컴퓨트 드라이버 (호출 타임아웃이 적용된 것)
     * @param sessionStarter Session 시작 절차
     * @param profiles Profile 카탈로그
     * @param config 설정
     * @param clock 시각 공급원
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultSandboxOrchestrator(SandboxStore sandboxStore, SessionStore sessionStore,
                                      WorkspaceStore workspaceStore, ComputeDriver driver,
                                      SessionStarter sessionStarter, ProfileRegistry profiles,
                                      OrchestratorConfig config, Clock clock) {
        if (sandboxStore == null) {
            throw new IllegalArgumentException("sandboxStore cannot be null");
        }
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        if (workspaceStore == null) {
            throw new IllegalArgumentException("workspaceStore cannot be null");
        }
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (sessionStarter == null) {
            throw new IllegalArgumentException("sessionStarter cannot be null");
        }
        if (profiles == null) {
            throw new IllegalArgumentException("profiles cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sandboxStore = sandboxStore;
        this.sessionStore = sessionStore;
        this.workspaceStore = workspaceStore;
        this.driver = driver;
        this.sessionStarter = sessionStarter;
        this.profiles = profiles;
        this.config = config;
        this.clock = clock;
    }

    // ===== 생성 / 조회 =====

    @Override
    public SandboxView create(String owner, CreateSandboxRequest request) {
        requireOwner(owner);
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.ttlSeconds() != null && request.ttlSeconds() < 0) {
            throw new ValidationException("ttl cannot be negative", "ttl", request.ttlSeconds());
        }
        ProfileConfig profile = profiles.require(request.profileId());

        Instant now = clock.instant();
        SandboxId sandboxId = SandboxId.generate();
        Workspace workspace = request.workspaceId() == null
            ? createManagedWorkspace(owner, sandboxId, now)
            : requireExternalWorkspace(owner, request.workspaceId());

        Instant expiresAt = request.hasInfiniteTtl() ? null : now.plusSeconds(request.ttlSeconds());
        Sandbox sandbox = Sandbox.create(sandboxId, owner, profile.id(), workspace.id(), expiresAt, now);
        sandboxStore.save(sandbox);

        log.info("Created sandbox {} (owner: {}, profile: {}, workspace: {}, expiresAt: {})",
            sandboxId, owner, profile.id(), workspace.id(), expiresAt);
        return toView(sandbox, null, now);
    }

    @Override
    public SandboxView get(String owner, SandboxId sandboxId) {
        Sandbox sandbox = requireOwned(owner, sandboxId);
        Session session = sessionStore.findBySandboxId(sandboxId).orElse(null);
        return toView(sandbox, session, clock.instant());
    }

    @Override
    public SandboxPage list(String owner, SandboxStatus status, String cursor, Integer limit) {
        requireOwner(owner);
        int pageSize = limit == null ? config.defaultListLimit() : limit;
        if (pageSize < 1 || pageSize > config.maxListLimit()) {
            throw new ValidationException(
                "limit must be between 1 and " + config.maxListLimit(), "limit", limit);
        }
        SandboxId after = parseCursor(cursor);

        List<Sandbox> fetched = sandboxStore.findLiveByOwner(owner, after, pageSize + 1);
        String nextCursor = null;
        if (fetched.size() > pageSize) {
            fetched = fetched.subList(0, pageSize);
            nextCursor = fetched.get(pageSize - 1).id().getValue();
        }

        Instant now = clock.instant();
        List<SandboxView> items = new ArrayList<>(fetched.size());
        for (Sandbox sandbox : fetched) {
            SandboxView view = toView(sandbox, sessionStore.findBySandboxId(sandbox.id()).orElse(null), now);
            if (status == null || view.status() == status) {
                items.add(view);
            }
        }
        return new SandboxPage(items, nextCursor);
    }

    // ===== ensureRunning =====

    @Override
    public Session ensureRunning(String owner, SandboxId sandboxId) {
        Sandbox sandbox = requireOwned(owner, sandboxId);
        requireNotExpired(sandbox, clock.instant());

        // 1. Fast path (락 없음)
        Optional<Session> current = sessionStore.findBySandboxId(sandboxId);
        if (current.isPresent() && current.get().isReady() && !current.get().isIdleExpiredAt(clock.instant())) {
            return current.get();
        }

        // 2. 임계 구역 획득
        Optional<SandboxLocks.Guard> acquired = locks.tryAcquire(sandboxId, config.lockWaitMs());
        if (acquired.isEmpty()) {
            throw sectionWaitExceeded(sandboxId);
        }

        try (SandboxLocks.Guard guard = acquired.get()) {
            // 3. 대기 중 승자가 실패했다면 같은 결과
            RuntimeException adopted = guard.adoptedFailure();
            if (adopted != null) {
                log.debug("Adopting failed start outcome for {}", sandboxId);
                throw adopted;
            }

            // 4. 이중 확인
            Instant now = clock.instant();
            sandbox = requireLive(sandboxId);
            requireNotExpired(sandbox, now);

            current = sessionStore.findBySandboxId(sandboxId);
            if (current.isPresent() && current.get().isReady()) {
                Session ready = current.get();
                if (ready.isIdleExpiredAt(now)) {
                    // 아직 GC가 회수하지 않은 Session은 재사용
                    ready = touchSession(ready, sandbox, now);
                }
                return ready;
            }
            SandboxStatus from = StatusResolver.resolve(sandbox, current.orElse(null), now);
            if (current.isPresent()) {
                from = discardStaleSession(current.get(), from);
            }

            // 5. 시작
            checkTransition(sandboxId, from, SandboxStatus.STARTING);
            ProfileConfig profile = profiles.require(sandbox.profileId());
            WorkspaceId workspaceId = sandbox.workspaceId();
            Workspace workspace = workspaceStore.findById(workspaceId)
                .orElseThrow(() -> new NotFoundException("workspace", workspaceId.getValue()));
            try {
                Session started = sessionStarter.start(sandbox, profile, workspace);
                workspaceStore.save(workspace.withLastAccessedAt(now));
                sandboxStore.save(sandbox.withLastActiveAt(now));
                guard.recordStarted(started);
                checkTransition(sandboxId, SandboxStatus.STARTING, SandboxStatus.READY);
                return started;
            } catch (RuntimeException e) {
                guard.recordFailure(e);
                checkTransition(sandboxId, SandboxStatus.STARTING, SandboxStatus.FAILED);
                throw e;
            }
        }
    }

    private RuntimeException sectionWaitExceeded(SandboxId sandboxId) {
        Optional<Session> inFlight = sessionStore.findBySandboxId(sandboxId);
        if (inFlight.isPresent() && inFlight.get().isLive() && !inFlight.get().isReady()) {
            return new SessionNotReadyException(
                "Sandbox compute is still starting", sandboxId.getValue(), config.retryAfterMs());
        }
        return new OperationTimeoutException(
            "Timed out waiting for sandbox " + sandboxId, sandboxId.getValue(), config.lockWaitMs());
    }

    /**
     * 구역 밖에서 남겨진 비정상 Session 정리 (이전 프로세스의 중단된 시작 또는 실패 기록).
     *
     * @return 정리 후 기준으로 삼을 상태 (중단된 시작은 FAILED)
     */
    private SandboxStatus discardStaleSession(Session stale, SandboxStatus observed) {
        SandboxStatus status = abandonIfStarting(stale.sandboxId(), observed);
        if (stale.isLive()) {
            log.warn("Discarding stale {} session {} for {}", stale.observedState(), stale.id(), stale.sandboxId());
        }
        destroySession(stale);
        return status;
    }

    /**
     * 구역 안에서 관측되는 STARTING은 끝나지 않은 이전 시작이므로 FAILED로 취급.
     */
    private SandboxStatus abandonIfStarting(SandboxId sandboxId, SandboxStatus observed) {
        if (observed != SandboxStatus.STARTING) {
            return observed;
        }
        checkTransition(sandboxId, SandboxStatus.STARTING, SandboxStatus.FAILED);
        return SandboxStatus.FAILED;
    }

    /**
     * 상태 전이 규칙 확인. 합성 상태가 바뀌지 않는 경우(예: 만료된 Sandbox의 컴퓨트 정리)는 전이가 아님.
     *
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    private void checkTransition(SandboxId sandboxId, SandboxStatus from, SandboxStatus to) {
        if (from == to) {
            return;
        }
        StatusTransition.validate(from, to);
        log.debug("Sandbox {} {} -> {}", sandboxId, from, to);
    }

    // ===== keepalive / stop / delete / extendTtl =====

    @Override
    public void keepalive(String owner, SandboxId sandboxId) {
        requireOwned(owner, sandboxId);
        Optional<Session> current = sessionStore.findBySandboxId(sandboxId);
        if (current.isEmpty() || !current.get().isReady()) {
            log.debug("Keepalive for {} without running session, nothing to extend", sandboxId);
            return;
        }

        try (SandboxLocks.Guard guard = acquireOrTimeout(sandboxId)) {
            Sandbox sandbox = requireLive(sandboxId);
            Optional<Session> session = sessionStore.findBySandboxId(sandboxId);
            if (session.isPresent() && session.get().isReady()) {
                touchSession(session.get(), sandbox, clock.instant());
            }
        }
    }

    @Override
    public void stop(String owner, SandboxId sandboxId) {
        requireOwned(owner, sandboxId);
        try (SandboxLocks.Guard guard = acquireOrTimeout(sandboxId)) {
            Sandbox sandbox = requireLive(sandboxId);
            Optional<Session> session = sessionStore.findBySandboxId(sandboxId);
            if (session.isEmpty()) {
                return;
            }
            Instant now = clock.instant();
            SandboxStatus from = abandonIfStarting(sandboxId, StatusResolver.resolve(sandbox, session.get(), now));
            checkTransition(sandboxId, from, StatusResolver.resolve(sandbox, null, now));
            destroySession(session.get());
            log.info("Stopped session {} of {}", session.get().id(), sandboxId);
        }
    }

    @Override
    public void delete(String owner, SandboxId sandboxId) {
        requireOwner(owner);
        Sandbox sandbox = sandboxStore.findById(sandboxId)
            .filter(s -> s.owner().equals(owner))
            .orElseThrow(() -> new NotFoundException("sandbox", sandboxId.getValue()));
        if (sandbox.isDeleted()) {
            return;
        }

        try (SandboxLocks.Guard guard = acquireOrTimeout(sandboxId)) {
            performDelete(sandboxId);
        }
    }

    @Override
    public SandboxView extendTtl(String owner, SandboxId sandboxId, long extendBySeconds) {
        if (extendBySeconds <= 0 || extendBySeconds > config.maxExtendSeconds()) {
            throw new ValidationException(
                "extend_by must be between 1 and " + config.maxExtendSeconds() + " seconds",
                "extend_by", extendBySeconds);
        }
        requireOwned(owner, sandboxId);

        try (SandboxLocks.Guard guard = acquireOrTimeout(sandboxId)) {
            Sandbox sandbox = requireLive(sandboxId);
            Instant now = clock.instant();
            Instant old = sandbox.expiresAt();
            if (old == null) {
                throw new SandboxTtlInfiniteException(sandboxId.getValue());
            }
            if (old.isBefore(now)) {
                throw new SandboxExpiredException(sandboxId.getValue(), old);
            }

            // 이미 지난 마감은 위에서 거부하므로 base가 now가 되는 것은 마감과 같은 순간뿐
            Instant base = old.isAfter(now) ? old : now;
            Sandbox extended = sandbox.withExpiresAt(base.plusSeconds(extendBySeconds));
            sandboxStore.save(extended);
            log.info("Extended TTL of {} from {} to {}", sandboxId, old, extended.expiresAt());

            return toView(extended, sessionStore.findBySandboxId(sandboxId).orElse(null), now);
        }
    }

    // ===== GC 회수 =====

    @Override
    public boolean reclaimIdleSession(SandboxId sandboxId) {
        Optional<SandboxLocks.Guard> acquired = locks.tryAcquire(sandboxId, 0);
        if (acquired.isEmpty()) {
            log.debug("Sandbox {} busy, idle reclamation deferred", sandboxId);
            return false;
        }
        try (SandboxLocks.Guard guard = acquired.get()) {
            Instant now = clock.instant();
            Optional<Session> session = sessionStore.findBySandboxId(sandboxId);
            if (session.isEmpty() || !session.get().isIdleExpiredAt(now)) {
                return false;
            }
            Optional<Sandbox> sandbox = sandboxStore.findById(sandboxId);
            if (sandbox.isPresent()) {
                checkTransition(sandboxId, StatusResolver.resolve(sandbox.get(), session.get(), now),
                    StatusResolver.resolve(sandbox.get(), null, now));
            }
            destroySession(session.get());
            log.info("Reclaimed idle session {} of {}", session.get().id(), sandboxId);
            return true;
        }
    }

    @Override
    public boolean reclaimExpiredSandbox(SandboxId sandboxId) {
        Optional<SandboxLocks.Guard> acquired = locks.tryAcquire(sandboxId, 0);
        if (acquired.isEmpty()) {
            log.debug("Sandbox {} busy, expiry reclamation deferred", sandboxId);
            return false;
        }
        try (SandboxLocks.Guard guard = acquired.get()) {
            Optional<Sandbox> sandbox = sandboxStore.findById(sandboxId);
            if (sandbox.isEmpty() || sandbox.get().isDeleted() || !sandbox.get().isExpiredAt(clock.instant())) {
                return false;
            }
            performDelete(sandboxId);
            return true;
        }
    }

    // ===== 내부 절차 =====

    /**
     * stop 후 soft delete, managed Workspace는 볼륨 삭제 후 기록 삭제 (구역 안에서 호출).
     */
    private void performDelete(SandboxId sandboxId) {
        Optional<Sandbox> found = sandboxStore.findById(sandboxId);
        if (found.isEmpty() || found.get().isDeleted()) {
            return;
        }
        Sandbox sandbox = found.get();
        Instant now = clock.instant();

        Optional<Session> session = sessionStore.findBySandboxId(sandboxId);
        checkTransition(sandboxId, StatusResolver.resolve(sandbox, session.orElse(null), now), SandboxStatus.DELETED);
        session.ifPresent(this::destroySession);

        Optional<Workspace> workspace = workspaceStore.findById(sandbox.workspaceId());
        sandboxStore.save(sandbox.markDeleted(now));
        locks.forget(sandboxId);
        log.info("Deleted sandbox {}", sandboxId);

        if (workspace.isPresent() && workspace.get().managed()) {
            driver.deleteVolume(workspace.get().volumeRef());
            workspaceStore.delete(workspace.get().id());
            log.info("Deleted managed workspace {} of {}", workspace.get().id(), sandboxId);
        }
    }

    /**
     * 인스턴스 destroy 후 Session 기록 삭제 (destroy 실패 시 기록은 남김).
     */
    private void destroySession(Session session) {
        if (session.instanceRef() != null) {
            driver.destroy(session.instanceRef());
        }
        sessionStore.delete(session.id());
    }

    private Session touchSession(Session session, Sandbox sandbox, Instant now) {
        long idleTimeout = profiles.find(session.profileId())
            .map(ProfileConfig::idleTimeoutSeconds)
            .orElseGet(() -> profiles.require(sandbox.profileId()).idleTimeoutSeconds());
        Session touched = session.touch(now.plusSeconds(idleTimeout), now);
        sessionStore.update(touched);
        sandboxStore.save(sandbox.withLastActiveAt(now));
        return touched;
    }

    private Workspace createManagedWorkspace(String owner, SandboxId sandboxId, Instant now) {
        WorkspaceId workspaceId = WorkspaceId.generate();
        Map<String, String> labels = new LinkedHashMap<>(InstanceLabels.managedFilter());
        labels.put(InstanceLabels.OWNER, owner);
        labels.put(InstanceLabels.SANDBOX_ID, sandboxId.getValue());
        labels.put(InstanceLabels.WORKSPACE_ID, workspaceId.getValue());

        String volumeRef = driver.createVolume("bay-" + workspaceId.getValue(), labels);
        Workspace workspace = Workspace.managed(workspaceId, owner, sandboxId, volumeRef,
            config.defaultWorkspaceSizeMb(), now);
        workspaceStore.save(workspace);
        return workspace;
    }

    private Workspace requireExternalWorkspace(String owner, String workspaceIdValue) {
        WorkspaceId workspaceId;
        try {
            workspaceId = WorkspaceId.of(workspaceIdValue);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid workspace id", "workspace_id", workspaceIdValue);
        }
        Workspace workspace = workspaceStore.findById(workspaceId)
            .filter(w -> w.owner().equals(owner))
            .orElseThrow(() -> new NotFoundException("workspace", workspaceIdValue));
        if (workspace.managed()) {
            throw new ValidationException(
                "Managed workspace belongs to another sandbox", "workspace_id", workspaceIdValue);
        }
        return workspace;
    }

    private SandboxLocks.Guard acquireOrTimeout(SandboxId sandboxId) {
        return locks.tryAcquire(sandboxId, config.lockWaitMs())
            .orElseThrow(() -> new OperationTimeoutException(
                "Timed out waiting for sandbox " + sandboxId, sandboxId.getValue(), config.lockWaitMs()));
    }

    private Sandbox requireOwned(String owner, SandboxId sandboxId) {
        requireOwner(owner);
        if (sandboxId == null) {
            throw new IllegalArgumentException("sandboxId cannot be null");
        }
        return sandboxStore.findById(sandboxId)
            .filter(s -> s.owner().equals(owner))
            .filter(s -> !s.isDeleted())
            .orElseThrow(() -> new NotFoundException("sandbox", sandboxId.getValue()));
    }

    private Sandbox requireLive(SandboxId sandboxId) {
        return sandboxStore.findById(sandboxId)
            .filter(s -> !s.isDeleted())
            .orElseThrow(() -> new NotFoundException("sandbox", sandboxId.getValue()));
    }

    private void requireNotExpired(Sandbox sandbox, Instant now) {
        if (sandbox.isExpiredAt(now)) {
            throw new SandboxExpiredException(sandbox.id().getValue(), sandbox.expiresAt());
        }
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
    }

    private static SandboxId parseCursor(String cursor) {
        if (cursor == null || cursor.isEmpty()) {
            return null;
        }
        try {
            return SandboxId.of(cursor);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cursor", "cursor", cursor);
        }
    }

    private SandboxView toView(Sandbox sandbox, Session session, Instant now) {
        List<String> capabilities = profiles.find(sandbox.profileId())
            .map(ProfileConfig::capabilities)
            .orElse(List.of());
        Instant idleExpiresAt = session != null && session.isReady() ? session.idleExpiresAt() : null;
        return new SandboxView(
            sandbox.id().getValue(),
            StatusResolver.resolve(sandbox, session, now),
            sandbox.profileId(),
            sandbox.workspaceId() == null ? null : sandbox.workspaceId().getValue(),
            capabilities,
            sandbox.createdAt(),
            sandbox.expiresAt(),
            idleExpiresAt
        );
    }
}
