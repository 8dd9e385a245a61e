package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.core.config.ReadinessPolicy;
import com.ryuqq.bay.core.error.OperationTimeoutException;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.spi.RuntimeAdapter;
import com.ryuqq.bay.core.spi.RuntimeAdapterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 런타임 readiness 대기.
 *
 * <p>인스턴스가 시작된 뒤 런타임의 health가 확인될 때까지 지수 백오프로 폴링합니다.
 * 전체 대기는 {@link ReadinessPolicy#budgetMs()}로 제한되며, 호출자가 무한히
 * 블로킹되는 경우는 없습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>시작 시각 기록 (System.nanoTime)</li>
 *   <li>while (경과 시간 &lt; budget): isHealthy() 확인, 성공 시 반환</li>
 *   <li>  - 미완료 시: min(backoff, 남은 예산) 만큼 sleep</li>
 *   <li>예산 초과 시: {@link OperationTimeoutException}</li>
 * </ol>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class ReadinessWaiter {

    private static final Logger log = LoggerFactory.getLogger(ReadinessWaiter.class);

    private final RuntimeAdapterFactory adapterFactory;
    private final ReadinessPolicy policy;
    private final BackoffCalculator backoff;

    public ReadinessWaiter(RuntimeAdapterFactory adapterFactory, ReadinessPolicy policy) {
        if (adapterFactory == null) {
            throw new IllegalArgumentException("adapterFactory cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.adapterFactory = adapterFactory;
        this.policy = policy;
        this.backoff = BackoffCalculator.forReadiness(policy);
    }

    /**
     * Session의 런타임이 healthy 해질 때까지 대기.
     *
     * @param session endpoint가 기록된 Session
     * @throws OperationTimeoutException 예산 안에 healthy 해지지 않은 경우
     * @throws IllegalStateException 대기 중 인터럽트된 경우
     */
    public void await(Session session) {
        if (session.endpoint() == null) {
            throw new IllegalArgumentException("session has no endpoint: " + session.id());
        }
        RuntimeAdapter adapter = adapterFactory.create(session.runtimeType(), session.endpoint());

        long startTimeNanos = System.nanoTime();
        long budgetNanos = policy.budgetMs() * 1_000_000L;
        int attempt = 0;

        while (true) {
            attempt++;
            if (probe(adapter, session, attempt)) {
                log.debug("Runtime ready for {} after {} probes", session.sandboxId(), attempt);
                return;
            }

            long remainingMs = (budgetNanos - (System.nanoTime() - startTimeNanos)) / 1_000_000L;
            if (remainingMs <= 0) {
                break;
            }
            sleep(Math.min(backoff.calculate(attempt), remainingMs));
        }

        throw new OperationTimeoutException(
            "Runtime did not become ready within " + policy.budgetMs() + "ms",
            session.sandboxId().getValue(),
            policy.budgetMs()
        );
    }

    private boolean probe(RuntimeAdapter adapter, Session session, int attempt) {
        try {
            return adapter.isHealthy();
        } catch (RuntimeException e) {
            // 시작 직후에는 연결 거부가 정상
            log.debug("Health probe {} failed for {}: {}", attempt, session.sandboxId(), e.getMessage());
            return false;
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Readiness wait interrupted", e);
        }
    }
}
