package com.ryuqq.bay.adapter.runner.gc;

import com.ryuqq.bay.adapter.runner.BackoffCalculator;
import com.ryuqq.bay.application.gc.GcResult;
import com.ryuqq.bay.application.gc.GcTask;
import com.ryuqq.bay.core.config.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * 스캔 → 항목별 회수 구조의 GC 작업 기반 클래스.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. scan() → [item1, item2, ...] (배치 크기 이내)
 * 2. For each item:
 *    a. reclaim(item) 시도
 *    b. 예외 시 RetryPolicy에 따라 백오프 후 재시도
 *    c. 최종 실패는 로깅 후 errors 카운트 (다음 항목 계속)
 * 3. 결과 로깅 후 GcResult 반환
 * </pre>
 *
 * <p>{@code reclaim}이 false를 반환하면 "이번 패스에서는 건너뜀"(다른 호출자가 사용 중이거나
 * 이미 정리됨)으로 보고 cleaned에도 errors에도 세지 않습니다.</p>
 *
 * @param <T> 스캔 항목 타입
 * @author Bay Team
 * @since 1.0.0
 */
public abstract class AbstractGcTask<T> implements GcTask {

    private static final Logger log = LoggerFactory.getLogger(AbstractGcTask.class);

    private final RetryPolicy retryPolicy;
    private final BackoffCalculator backoff;

    protected AbstractGcTask(RetryPolicy retryPolicy) {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        this.retryPolicy = retryPolicy;
        this.backoff = BackoffCalculator.forRetry(retryPolicy);
    }

    /**
     * 회수 대상 스캔.
     *
     * @return 대상 목록 (배치 크기 이내)
     */
    protected abstract List<T> scan();

    /**
     * 항목 하나 회수.
     *
     * @param item 대상
     * @return 회수했으면 true, 건너뛰었으면 false
     */
    protected abstract boolean reclaim(T item);

    /**
     * 로그용 항목 표현.
     */
    protected String describe(T item) {
        return String.valueOf(item);
    }

    @Override
    public GcResult run() {
        long startNanos = System.nanoTime();

        // 1. 대상 스캔
        List<T> items = scan();

        // 2. 항목별 회수
        int cleaned = 0;
        int errors = 0;
        for (T item : items) {
            try {
                if (reclaimWithRetry(item)) {
                    cleaned++;
                }
            } catch (RuntimeException e) {
                errors++;
                log.error("Failed to reclaim {} in {} after {} attempt(s)",
                    describe(item), name(), retryPolicy.maxAttempts(), e);
            }
        }

        // 3. 결과
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        if (!items.isEmpty()) {
            log.info("{} completed: {} cleaned, {} errors out of {} scanned ({}ms)",
                name(), cleaned, errors, items.size(), duration.toMillis());
        } else {
            log.debug("{} completed: nothing to reclaim", name());
        }
        return new GcResult(name(), cleaned, errors, duration);
    }

    private boolean reclaimWithRetry(T item) {
        int attempt = 1;
        while (true) {
            try {
                return reclaim(item);
            } catch (RuntimeException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    throw e;
                }
                long delayMs = backoff.calculate(attempt);
                log.warn("Reclaim of {} in {} failed (attempt {}/{}), retrying in {}ms: {}",
                    describe(item), name(), attempt, retryPolicy.maxAttempts(), delayMs, e.getMessage());
                sleep(delayMs);
                attempt++;
            }
        }
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during GC retry backoff", e);
        }
    }
}
