package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.adapter.inmemory.store.InMemorySandboxStore;
import com.ryuqq.bay.adapter.inmemory.store.InMemorySessionStore;
import com.ryuqq.bay.adapter.inmemory.store.InMemoryWorkspaceStore;
import com.ryuqq.bay.application.sandbox.CreateSandboxRequest;
import com.ryuqq.bay.application.sandbox.SandboxPage;
import com.ryuqq.bay.application.sandbox.SandboxView;
import com.ryuqq.bay.core.config.OrchestratorConfig;
import com.ryuqq.bay.core.config.ProfileRegistry;
import com.ryuqq.bay.core.error.DriverException;
import com.ryuqq.bay.core.error.NotFoundException;
import com.ryuqq.bay.core.error.SandboxExpiredException;
import com.ryuqq.bay.core.error.SandboxTtlInfiniteException;
import com.ryuqq.bay.core.error.SessionNotReadyException;
import com.ryuqq.bay.core.error.ValidationException;
import com.ryuqq.bay.core.model.RuntimeType;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.model.WorkspaceId;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.StartedInstance;
import com.ryuqq.bay.core.statemachine.SandboxStatus;
import com.ryuqq.bay.core.statemachine.StatusTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DefaultSandboxOrchestrator 유닛 테스트.
 *
 * <p>In-memory 저장소와 mock 드라이버로 수명주기 연산을 검증합니다:</p>
 * <ul>
 *   <li>create / get / list</li>
 *   <li>ensureRunning: 단일 시작, fast path, 실패 후 재시도, 동시 호출</li>
 *   <li>keepalive / stop / delete</li>
 *   <li>extendTtl: 무한 TTL, 만료, 연장 계산</li>
 *   <li>GC 회수 연산</li>
 *   <li>상태 전이 규칙 확인, 끝나지 않은 이전 시작 정리</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultSandboxOrchestratorTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    private static final String OWNER = "alice";

    @Mock
    private ComputeDriver driver;

    @Mock
    private ReadinessWaiter readinessWaiter;

    private TestClock clock;
    private InMemorySandboxStore sandboxStore;
    private InMemorySessionStore sessionStore;
    private InMemoryWorkspaceStore workspaceStore;
    private DefaultSandboxOrchestrator orchestrator;
    private final AtomicInteger instanceSequence = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        sandboxStore = new InMemorySandboxStore();
        sessionStore = new InMemorySessionStore();
        workspaceStore = new InMemoryWorkspaceStore();
        orchestrator = newOrchestrator(new OrchestratorConfig());

        lenient().when(driver.createVolume(anyString(), anyMap())).thenAnswer(inv -> "vol-" + inv.getArgument(0));
        lenient().when(driver.start(any(), any(), anyMap())).thenAnswer(inv -> {
            int n = instanceSequence.incrementAndGet();
            return new StartedInstance("inst-" + n, "http://10.0.0." + n + ":8123");
        });
    }

    private DefaultSandboxOrchestrator newOrchestrator(OrchestratorConfig config) {
        SessionStarter starter = new SessionStarter(sessionStore, driver, readinessWaiter, clock);
        return new DefaultSandboxOrchestrator(sandboxStore, sessionStore, workspaceStore, driver,
            starter, ProfileRegistry.defaults(), config, clock);
    }

    private SandboxId createSandbox(Long ttlSeconds) {
        SandboxView view = orchestrator.create(OWNER, new CreateSandboxRequest("python-default", null, ttlSeconds));
        return SandboxId.of(view.id());
    }

    // ============================================================
    // 1. create / get / list
    // ============================================================

    @Test
    void create는_managed_Workspace와_IDLE_Sandbox를_만듦() {
        // when
        SandboxView view = orchestrator.create(OWNER, new CreateSandboxRequest("python-default", null, 3600L));

        // then
        assertThat(view.status()).isEqualTo(SandboxStatus.IDLE);
        assertThat(view.expiresAt()).isEqualTo(START.plusSeconds(3600));
        assertThat(view.capabilities()).containsExactly("filesystem", "shell", "python");
        assertThat(view.idleExpiresAt()).isNull();

        Workspace workspace = workspaceStore.findById(WorkspaceId.of(view.workspaceId())).orElseThrow();
        assertThat(workspace.managed()).isTrue();
        assertThat(workspace.managedBySandboxId().getValue()).isEqualTo(view.id());
        assertThat(workspace.sizeLimitMb()).isEqualTo(1024);
        verify(driver, never()).start(any(), any(), anyMap());
    }

    @Test
    void create의_TTL이_0이면_만료_없음() {
        SandboxView view = orchestrator.create(OWNER, new CreateSandboxRequest("python-default", null, 0L));

        assertThat(view.expiresAt()).isNull();
    }

    @Test
    void create는_알_수_없는_Profile이나_음수_TTL을_거부() {
        assertThatThrownBy(() -> orchestrator.create(OWNER, new CreateSandboxRequest("nope", null, null)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orchestrator.create(OWNER, new CreateSandboxRequest("python-default", null, -1L)))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void create는_다른_소유자의_external_Workspace를_not_found로_거부() {
        // given
        WorkspaceId workspaceId = WorkspaceId.generate();
        workspaceStore.save(Workspace.external(workspaceId, "bob", "vol-x", 1024, START));

        // when & then
        assertThatThrownBy(() -> orchestrator.create(OWNER,
            new CreateSandboxRequest("python-default", workspaceId.getValue(), null)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void create는_external_Workspace를_공유할_수_있음() {
        // given
        WorkspaceId workspaceId = WorkspaceId.generate();
        workspaceStore.save(Workspace.external(workspaceId, OWNER, "vol-x", 1024, START));

        // when
        SandboxView first = orchestrator.create(OWNER, new CreateSandboxRequest("python-default", workspaceId.getValue(), null));
        SandboxView second = orchestrator.create(OWNER, new CreateSandboxRequest("python-data", workspaceId.getValue(), null));

        // then
        assertThat(first.workspaceId()).isEqualTo(workspaceId.getValue());
        assertThat(second.workspaceId()).isEqualTo(workspaceId.getValue());
        assertThat(sandboxStore.countLiveByWorkspace(workspaceId)).isEqualTo(2);
        verify(driver, never()).createVolume(anyString(), anyMap());
    }

    @Test
    void get은_다른_소유자에게_not_found() {
        SandboxId sandboxId = createSandbox(null);

        assertThatThrownBy(() -> orchestrator.get("bob", sandboxId))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void list는_커서로_페이지를_나눔() {
        // given
        List<String> created = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            created.add(createSandbox(null).getValue());
        }
        created.sort(String::compareTo);
        createSandboxFor("bob");

        // when
        SandboxPage first = orchestrator.list(OWNER, null, null, 2);
        SandboxPage second = orchestrator.list(OWNER, null, first.nextCursor(), 2);

        // then
        assertThat(first.items()).extracting(SandboxView::id).containsExactly(created.get(0), created.get(1));
        assertThat(first.hasMore()).isTrue();
        assertThat(second.items()).extracting(SandboxView::id).containsExactly(created.get(2));
        assertThat(second.hasMore()).isFalse();
    }

    @Test
    void list는_상태로_거르고_삭제된_Sandbox는_제외() {
        // given
        SandboxId running = createSandbox(null);
        SandboxId idle = createSandbox(null);
        SandboxId deleted = createSandbox(null);
        orchestrator.ensureRunning(OWNER, running);
        orchestrator.delete(OWNER, deleted);

        // when
        SandboxPage ready = orchestrator.list(OWNER, SandboxStatus.READY, null, null);
        SandboxPage all = orchestrator.list(OWNER, null, null, null);

        // then
        assertThat(ready.items()).extracting(SandboxView::id).containsExactly(running.getValue());
        assertThat(all.items()).extracting(SandboxView::id)
            .containsExactlyInAnyOrder(running.getValue(), idle.getValue());
    }

    @Test
    void list는_잘못된_limit과_cursor를_거부() {
        assertThatThrownBy(() -> orchestrator.list(OWNER, null, null, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orchestrator.list(OWNER, null, null, 201)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orchestrator.list(OWNER, null, "not-a-sandbox", 10))
            .isInstanceOf(ValidationException.class);
    }

    private void createSandboxFor(String owner) {
        orchestrator.create(owner, new CreateSandboxRequest("python-default", null, null));
    }

    // ============================================================
    // 2. ensureRunning
    // ============================================================

    @Test
    void ensureRunning은_Session을_시작하고_READY로_만듦() {
        // given
        SandboxId sandboxId = createSandbox(null);

        // when
        Session session = orchestrator.ensureRunning(OWNER, sandboxId);

        // then
        assertThat(session.isReady()).isTrue();
        assertThat(session.idleExpiresAt()).isEqualTo(START.plusSeconds(1800));
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.READY);
        verify(readinessWaiter).await(any());
    }

    @Test
    void 준비된_Session이_있으면_드라이버를_다시_호출하지_않음() {
        // given
        SandboxId sandboxId = createSandbox(null);
        Session first = orchestrator.ensureRunning(OWNER, sandboxId);

        // when
        Session second = orchestrator.ensureRunning(OWNER, sandboxId);

        // then
        assertThat(second.id()).isEqualTo(first.id());
        verify(driver, times(1)).start(any(), any(), anyMap());
    }

    @Test
    void 만료된_Sandbox는_시작하지_않고_sandbox_expired() {
        // given
        SandboxId sandboxId = createSandbox(60L);
        clock.advance(Duration.ofSeconds(61));

        // when & then
        assertThatThrownBy(() -> orchestrator.ensureRunning(OWNER, sandboxId))
            .isInstanceOf(SandboxExpiredException.class);
        verify(driver, never()).start(any(), any(), anyMap());
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.EXPIRED);
    }

    @Test
    void 시작_실패_후_FAILED이고_다음_호출은_새로_시작함() {
        // given
        SandboxId sandboxId = createSandbox(null);
        when(driver.start(any(), any(), anyMap()))
            .thenThrow(new DriverException("start", "image pull failed", null))
            .thenReturn(new StartedInstance("inst-retry", "http://10.0.0.99:8123"));

        // when
        assertThatThrownBy(() -> orchestrator.ensureRunning(OWNER, sandboxId))
            .isInstanceOf(DriverException.class);
        SandboxStatus afterFailure = orchestrator.get(OWNER, sandboxId).status();
        Session retried = orchestrator.ensureRunning(OWNER, sandboxId);

        // then
        assertThat(afterFailure).isEqualTo(SandboxStatus.FAILED);
        assertThat(retried.instanceRef()).isEqualTo("inst-retry");
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.READY);
    }

    @Test
    void 동시_ensureRunning은_드라이버를_한_번만_호출하고_같은_Session을_반환() throws Exception {
        // given
        SandboxId sandboxId = createSandbox(null);
        when(driver.start(any(), any(), anyMap())).thenAnswer(inv -> {
            Thread.sleep(100);
            return new StartedInstance("inst-only", "http://10.0.0.1:8123");
        });
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(1);
        List<Future<Session>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                ready.await();
                return orchestrator.ensureRunning(OWNER, sandboxId);
            }));
        }
        ready.countDown();
        Set<Object> sessionIds = ConcurrentHashMap.newKeySet();
        for (Future<Session> future : futures) {
            sessionIds.add(future.get(10, TimeUnit.SECONDS).id());
        }
        executor.shutdown();

        // then
        assertThat(sessionIds).hasSize(1);
        verify(driver, times(1)).start(any(), any(), anyMap());
    }

    @Test
    void 구역_대기_예산을_넘기면_session_not_ready와_재시도_힌트() throws Exception {
        // given
        orchestrator = newOrchestrator(new OrchestratorConfig().withLockWaitMs(50));
        SandboxId sandboxId = createSandbox(null);
        CountDownLatch starting = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        when(driver.start(any(), any(), anyMap())).thenAnswer(inv -> {
            starting.countDown();
            finish.await(5, TimeUnit.SECONDS);
            return new StartedInstance("inst-slow", "http://10.0.0.1:8123");
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<Session> winner = executor.submit(() -> orchestrator.ensureRunning(OWNER, sandboxId));
        starting.await(5, TimeUnit.SECONDS);

        // when & then
        assertThatThrownBy(() -> orchestrator.ensureRunning(OWNER, sandboxId))
            .isInstanceOf(SessionNotReadyException.class)
            .satisfies(e -> assertThat(((SessionNotReadyException) e).getRetryAfterMs()).isEqualTo(1000));

        finish.countDown();
        assertThat(winner.get(5, TimeUnit.SECONDS).isReady()).isTrue();
        executor.shutdown();
    }

    // ============================================================
    // 3. keepalive / stop / delete
    // ============================================================

    @Test
    void keepalive는_idle_마감만_연장하고_컴퓨트를_시작하지_않음() {
        // given
        SandboxId running = createSandbox(null);
        SandboxId idle = createSandbox(null);
        orchestrator.ensureRunning(OWNER, running);
        clock.advance(Duration.ofSeconds(600));

        // when
        orchestrator.keepalive(OWNER, running);
        orchestrator.keepalive(OWNER, idle);

        // then
        assertThat(orchestrator.get(OWNER, running).idleExpiresAt()).isEqualTo(START.plusSeconds(600 + 1800));
        assertThat(orchestrator.get(OWNER, idle).status()).isEqualTo(SandboxStatus.IDLE);
        verify(driver, times(1)).start(any(), any(), anyMap());
    }

    @Test
    void stop은_인스턴스를_destroy하고_IDLE로_돌아감_두_번_호출해도_안전() {
        // given
        SandboxId sandboxId = createSandbox(null);
        Session session = orchestrator.ensureRunning(OWNER, sandboxId);

        // when
        orchestrator.stop(OWNER, sandboxId);
        orchestrator.stop(OWNER, sandboxId);

        // then
        verify(driver, times(1)).destroy(session.instanceRef());
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.IDLE);
        assertThat(sessionStore.findBySandboxId(sandboxId)).isEmpty();
    }

    @Test
    void stop_중_destroy가_실패하면_Session_기록을_남김() {
        // given
        SandboxId sandboxId = createSandbox(null);
        Session session = orchestrator.ensureRunning(OWNER, sandboxId);
        doThrow(new DriverException("destroy", "engine down", null)).when(driver).destroy(session.instanceRef());

        // when & then
        assertThatThrownBy(() -> orchestrator.stop(OWNER, sandboxId)).isInstanceOf(DriverException.class);
        assertThat(sessionStore.findBySandboxId(sandboxId)).isPresent();
    }

    @Test
    void delete는_Session_managed_Workspace까지_정리하고_이후_not_found() {
        // given
        SandboxId sandboxId = createSandbox(null);
        SandboxView view = orchestrator.get(OWNER, sandboxId);
        Session session = orchestrator.ensureRunning(OWNER, sandboxId);
        WorkspaceId workspaceId = WorkspaceId.of(view.workspaceId());
        String volumeRef = workspaceStore.findById(workspaceId).orElseThrow().volumeRef();

        // when
        orchestrator.delete(OWNER, sandboxId);

        // then
        verify(driver).destroy(session.instanceRef());
        verify(driver).deleteVolume(volumeRef);
        assertThat(workspaceStore.findById(workspaceId)).isEmpty();
        assertThat(sandboxStore.findById(sandboxId)).hasValueSatisfying(s -> assertThat(s.isDeleted()).isTrue());
        assertThatThrownBy(() -> orchestrator.get(OWNER, sandboxId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> orchestrator.ensureRunning(OWNER, sandboxId)).isInstanceOf(NotFoundException.class);
        assertThatCode(() -> orchestrator.delete(OWNER, sandboxId)).doesNotThrowAnyException();
    }

    @Test
    void delete는_external_Workspace를_남겨둠() {
        // given
        WorkspaceId workspaceId = WorkspaceId.generate();
        workspaceStore.save(Workspace.external(workspaceId, OWNER, "vol-ext", 1024, START));
        SandboxView view = orchestrator.create(OWNER,
            new CreateSandboxRequest("python-default", workspaceId.getValue(), null));

        // when
        orchestrator.delete(OWNER, SandboxId.of(view.id()));

        // then
        assertThat(workspaceStore.findById(workspaceId)).isPresent();
        verify(driver, never()).deleteVolume(anyString());
    }

    @Test
    void delete는_다른_소유자에게_not_found() {
        SandboxId sandboxId = createSandbox(null);

        assertThatThrownBy(() -> orchestrator.delete("bob", sandboxId)).isInstanceOf(NotFoundException.class);
    }

    // ============================================================
    // 4. extendTtl
    // ============================================================

    @Test
    void extendTtl은_기존_마감_시각에서_연장() {
        // given
        SandboxId sandboxId = createSandbox(600L);
        clock.advance(Duration.ofSeconds(100));

        // when
        SandboxView view = orchestrator.extendTtl(OWNER, sandboxId, 600);

        // then
        assertThat(view.expiresAt()).isEqualTo(START.plusSeconds(1200));
    }

    @Test
    void 같은_연장을_두_번_하면_두_번_연장됨() {
        SandboxId sandboxId = createSandbox(600L);

        orchestrator.extendTtl(OWNER, sandboxId, 600);
        SandboxView view = orchestrator.extendTtl(OWNER, sandboxId, 600);

        assertThat(view.expiresAt()).isEqualTo(START.plusSeconds(1800));
    }

    @Test
    void 무한_TTL은_연장_불가() {
        SandboxId sandboxId = createSandbox(null);

        assertThatThrownBy(() -> orchestrator.extendTtl(OWNER, sandboxId, 600))
            .isInstanceOf(SandboxTtlInfiniteException.class);
        assertThat(orchestrator.get(OWNER, sandboxId).expiresAt()).isNull();
    }

    @Test
    void 만료된_Sandbox는_되살릴_수_없음() {
        // given
        SandboxId sandboxId = createSandbox(60L);
        clock.advance(Duration.ofSeconds(61));

        // when & then
        assertThatThrownBy(() -> orchestrator.extendTtl(OWNER, sandboxId, 3600))
            .isInstanceOf(SandboxExpiredException.class);
        assertThat(orchestrator.get(OWNER, sandboxId).expiresAt()).isEqualTo(START.plusSeconds(60));
    }

    @Test
    void 마감_시각과_같은_순간의_연장은_허용() {
        // given
        SandboxId sandboxId = createSandbox(60L);
        clock.advance(Duration.ofSeconds(60));

        // when
        SandboxView view = orchestrator.extendTtl(OWNER, sandboxId, 60);

        // then
        assertThat(view.expiresAt()).isEqualTo(START.plusSeconds(120));
    }

    @Test
    void 연장_값은_양수이고_상한_이내여야_함() {
        SandboxId sandboxId = createSandbox(600L);

        assertThatThrownBy(() -> orchestrator.extendTtl(OWNER, sandboxId, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orchestrator.extendTtl(OWNER, sandboxId, 86_401)).isInstanceOf(ValidationException.class);
    }

    @Test
    void 삭제된_Sandbox_연장은_not_found() {
        SandboxId sandboxId = createSandbox(600L);
        orchestrator.delete(OWNER, sandboxId);

        assertThatThrownBy(() -> orchestrator.extendTtl(OWNER, sandboxId, 60)).isInstanceOf(NotFoundException.class);
    }

    // ============================================================
    // 5. GC 회수
    // ============================================================

    @Test
    void idle_만료_전에는_회수하지_않고_만료_후_회수() {
        // given
        SandboxId sandboxId = createSandbox(null);
        Session session = orchestrator.ensureRunning(OWNER, sandboxId);

        // when
        boolean early = orchestrator.reclaimIdleSession(sandboxId);
        clock.advance(Duration.ofSeconds(1801));
        boolean late = orchestrator.reclaimIdleSession(sandboxId);

        // then
        assertThat(early).isFalse();
        assertThat(late).isTrue();
        verify(driver).destroy(session.instanceRef());
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.IDLE);
    }

    @Test
    void 만료된_Sandbox_회수는_delete와_같은_cascade() {
        // given
        SandboxId sandboxId = createSandbox(60L);
        orchestrator.ensureRunning(OWNER, sandboxId);
        clock.advance(Duration.ofSeconds(61));

        // when
        boolean reclaimed = orchestrator.reclaimExpiredSandbox(sandboxId);

        // then
        assertThat(reclaimed).isTrue();
        assertThat(sandboxStore.findById(sandboxId)).hasValueSatisfying(s -> assertThat(s.isDeleted()).isTrue());
        assertThat(sessionStore.findBySandboxId(sandboxId)).isEmpty();
        verify(driver).deleteVolume(anyString());
    }

    @Test
    void 만료되지_않은_Sandbox는_회수하지_않음() {
        SandboxId sandboxId = createSandbox(600L);

        assertThat(orchestrator.reclaimExpiredSandbox(sandboxId)).isFalse();
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.IDLE);
    }

    // ============================================================
    // 6. 상태 전이 규칙
    // ============================================================

    @Test
    void 수명주기_연산은_상태_전이_규칙을_확인함() {
        // given
        SandboxId sandboxId = createSandbox(null);

        try (MockedStatic<StatusTransition> transitions = mockStatic(StatusTransition.class, CALLS_REAL_METHODS)) {
            // when
            orchestrator.ensureRunning(OWNER, sandboxId);
            orchestrator.stop(OWNER, sandboxId);
            orchestrator.ensureRunning(OWNER, sandboxId);
            orchestrator.delete(OWNER, sandboxId);

            // then
            transitions.verify(() -> StatusTransition.validate(SandboxStatus.IDLE, SandboxStatus.STARTING), times(2));
            transitions.verify(() -> StatusTransition.validate(SandboxStatus.STARTING, SandboxStatus.READY), times(2));
            transitions.verify(() -> StatusTransition.validate(SandboxStatus.READY, SandboxStatus.IDLE));
            transitions.verify(() -> StatusTransition.validate(SandboxStatus.READY, SandboxStatus.DELETED));
        }
    }

    @Test
    void idle_회수도_READY에서_IDLE_전이를_확인함() {
        // given
        SandboxId sandboxId = createSandbox(null);
        orchestrator.ensureRunning(OWNER, sandboxId);
        clock.advance(Duration.ofSeconds(1801));

        try (MockedStatic<StatusTransition> transitions = mockStatic(StatusTransition.class, CALLS_REAL_METHODS)) {
            // when
            boolean reclaimed = orchestrator.reclaimIdleSession(sandboxId);

            // then
            assertThat(reclaimed).isTrue();
            transitions.verify(() -> StatusTransition.validate(SandboxStatus.READY, SandboxStatus.IDLE));
        }
    }

    @Test
    void 끝나지_않은_이전_시작은_FAILED를_거쳐_다시_시작함() {
        // given
        SandboxId sandboxId = createSandbox(null);
        Session abandoned = Session.pending(sandboxId, RuntimeType.SHIP, "python-default", START).markStarting();
        sessionStore.insertIfNoLiveSession(abandoned);
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.STARTING);

        try (MockedStatic<StatusTransition> transitions = mockStatic(StatusTransition.class, CALLS_REAL_METHODS)) {
            // when
            Session started = orchestrator.ensureRunning(OWNER, sandboxId);

            // then
            assertThat(started.id()).isNotEqualTo(abandoned.id());
            transitions.verify(() -> StatusTransition.validate(SandboxStatus.STARTING, SandboxStatus.FAILED));
            transitions.verify(() -> StatusTransition.validate(SandboxStatus.FAILED, SandboxStatus.STARTING));
        }
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.READY);
    }

    @Test
    void 끝나지_않은_이전_시작도_stop으로_정리됨() {
        // given
        SandboxId sandboxId = createSandbox(null);
        sessionStore.insertIfNoLiveSession(
            Session.pending(sandboxId, RuntimeType.SHIP, "python-default", START).markStarting());

        // when
        orchestrator.stop(OWNER, sandboxId);

        // then
        assertThat(sessionStore.findBySandboxId(sandboxId)).isEmpty();
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.IDLE);
        verify(driver, never()).destroy(anyString());
    }

    @Test
    void 만료된_Sandbox의_컴퓨트_정리는_전이_없이_허용() {
        // given
        SandboxId sandboxId = createSandbox(60L);
        Session session = orchestrator.ensureRunning(OWNER, sandboxId);
        clock.advance(Duration.ofSeconds(61));

        // when
        orchestrator.stop(OWNER, sandboxId);

        // then
        verify(driver).destroy(session.instanceRef());
        assertThat(orchestrator.get(OWNER, sandboxId).status()).isEqualTo(SandboxStatus.EXPIRED);
    }
}
