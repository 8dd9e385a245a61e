package com.ryuqq.bay.adapter.runner.gc;

import com.ryuqq.bay.application.gc.GcResult;
import com.ryuqq.bay.application.gc.GcTask;
import com.ryuqq.bay.application.idempotency.IdempotencyLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 만료된 멱등성 기록 일괄 삭제.
 *
 * <p>외부 리소스가 없는 단일 저장소 연산이므로 항목별 재시도 없이 배치 단위로 삭제합니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class ExpiredIdempotencyGc implements GcTask {

    private static final Logger log = LoggerFactory.getLogger(ExpiredIdempotencyGc.class);

    public static final String NAME = "expired_idempotency";

    private final IdempotencyLedger ledger;
    private final int batchSize;

    public ExpiredIdempotencyGc(IdempotencyLedger ledger, int batchSize) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        this.ledger = ledger;
        this.batchSize = batchSize;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GcResult run() {
        long startNanos = System.nanoTime();
        int purged = ledger.purgeExpired(batchSize);
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        if (purged > 0) {
            log.info("{} completed: {} expired records purged ({}ms)", NAME, purged, duration.toMillis());
        }
        return new GcResult(NAME, purged, 0, duration);
    }
}
