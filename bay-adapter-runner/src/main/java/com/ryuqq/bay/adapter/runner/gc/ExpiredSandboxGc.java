package com.ryuqq.bay.adapter.runner.gc;

import com.ryuqq.bay.application.sandbox.SandboxReclaimer;
import com.ryuqq.bay.core.config.RetryPolicy;
import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.spi.SandboxStore;

import java.time.Clock;
import java.util.List;

/**
 * hard TTL이 지난 Sandbox 회수 (delete와 같은 cascade).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class ExpiredSandboxGc extends AbstractGcTask<SandboxId> {

    public static final String NAME = "expired_sandbox";

    private final SandboxStore sandboxStore;
    private final SandboxReclaimer reclaimer;
    private final Clock clock;
    private final int batchSize;

    public ExpiredSandboxGc(SandboxStore sandboxStore, SandboxReclaimer reclaimer, Clock clock,
                            int batchSize, RetryPolicy retryPolicy) {
        super(retryPolicy);
        if (sandboxStore == null) {
            throw new IllegalArgumentException("sandboxStore cannot be null");
        }
        if (reclaimer == null) {
            throw new IllegalArgumentException("reclaimer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sandboxStore = sandboxStore;
        this.reclaimer = reclaimer;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<SandboxId> scan() {
        return sandboxStore.findExpired(clock.instant(), batchSize).stream()
            .map(Sandbox::id)
            .toList();
    }

    @Override
    protected boolean reclaim(SandboxId sandboxId) {
        return reclaimer.reclaimExpiredSandbox(sandboxId);
    }
}
