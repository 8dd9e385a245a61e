package com.ryuqq.bay.adapter.runner.gc;

import com.ryuqq.bay.application.gc.GcResult;
import com.ryuqq.bay.application.gc.GcTask;
import com.ryuqq.bay.core.config.GcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GC 작업 스케줄러.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. start()
 *    a. runOnStartup이면 모든 작업을 한 번씩 동기 실행 (이전 프로세스가 남긴 상태 정리)
 *    b. 각 작업을 자신의 주기로 scheduleWithFixedDelay
 * 2. 각 실행은 runSafely()로 감싸져 예외가 스케줄을 취소하지 않음
 * 3. stop() / close(): 스케줄 중단 후 진행 중인 패스 종료 대기
 * </pre>
 *
 * <p>작업마다 fixed delay로 스케줄되므로 같은 작업의 패스는 겹치지 않습니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class GcScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GcScheduler.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    /**
     * 작업과 실행 주기.
     *
     * @param task GC 작업
     * @param intervalMs 실행 주기 (밀리초, 양수)
     */
    public record ScheduledGcTask(GcTask task, long intervalMs) {

        public ScheduledGcTask {
            if (task == null) {
                throw new IllegalArgumentException("task cannot be null");
            }
            if (intervalMs <= 0) {
                throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
            }
        }
    }

    private final List<ScheduledGcTask> tasks;
    private final GcConfig config;
    private ScheduledExecutorService executor;

    public GcScheduler(List<ScheduledGcTask> tasks, GcConfig config) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.tasks = List.copyOf(tasks);
        this.config = config;
    }

    /**
     * 표준 5개 작업을 설정의 주기로 구성.
     *
     * @param config GC 설정
     * @param expiredSandbox 만료 Sandbox 작업
     * @param idleSession idle Session 작업
     * @param orphanWorkspace 고아 Workspace 작업
     * @param orphanInstance 고아 인스턴스 작업
     * @param expiredIdempotency 만료 멱등성 기록 작업
     * @return GcScheduler
     */
    public static GcScheduler standard(GcConfig config, GcTask expiredSandbox, GcTask idleSession,
                                       GcTask orphanWorkspace, GcTask orphanInstance, GcTask expiredIdempotency) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new GcScheduler(List.of(
            new ScheduledGcTask(expiredSandbox, config.expiredSandboxIntervalMs()),
            new ScheduledGcTask(idleSession, config.idleSessionIntervalMs()),
            new ScheduledGcTask(orphanWorkspace, config.orphanWorkspaceIntervalMs()),
            new ScheduledGcTask(orphanInstance, config.orphanInstanceIntervalMs()),
            new ScheduledGcTask(expiredIdempotency, config.expiredIdempotencyIntervalMs())
        ), config);
    }

    /**
     * 시작 패스 실행 후 주기 스케줄 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (!config.enabled()) {
            log.info("GC scheduler disabled");
            return;
        }
        if (executor != null) {
            throw new IllegalStateException("GC scheduler already started");
        }

        if (config.runOnStartup()) {
            List<GcResult> results = runOnce();
            int cleaned = results.stream().mapToInt(GcResult::cleaned).sum();
            int errors = results.stream().mapToInt(GcResult::errors).sum();
            log.info("GC startup pass completed: {} cleaned, {} errors", cleaned, errors);
        }

        executor = Executors.newScheduledThreadPool(tasks.size(), new GcThreadFactory());
        for (ScheduledGcTask scheduled : tasks) {
            executor.scheduleWithFixedDelay(
                () -> runScheduled(scheduled.task()),
                scheduled.intervalMs(),
                scheduled.intervalMs(),
                TimeUnit.MILLISECONDS
            );
        }
        log.info("GC scheduler started with {} tasks", tasks.size());
    }

    /**
     * 모든 작업을 순서대로 한 번씩 실행.
     *
     * @return 작업별 결과
     */
    public List<GcResult> runOnce() {
        List<GcResult> results = new ArrayList<>(tasks.size());
        for (ScheduledGcTask scheduled : tasks) {
            results.add(runSafely(scheduled.task()));
        }
        return results;
    }

    /**
     * 스케줄 중단.
     *
     * <p>진행 중인 패스는 최대 30초까지 기다린 뒤 인터럽트합니다.</p>
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            executor = null;
        }
        log.info("GC scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * 주기 실행용. 예외가 빠져나가면 executor가 해당 작업의 이후 실행을 모두 취소하므로 Error도 여기서 멈춤.
     */
    private void runScheduled(GcTask task) {
        try {
            runSafely(task);
        } catch (Throwable t) {
            log.error("GC task {} failed with {}, keeping its schedule", task.name(), t.getClass().getSimpleName(), t);
        }
    }

    private GcResult runSafely(GcTask task) {
        long startNanos = System.nanoTime();
        try {
            return task.run();
        } catch (RuntimeException e) {
            log.error("GC task {} failed", task.name(), e);
            return GcResult.failed(task.name(), Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private static final class GcThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "bay-gc-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
