package com.ryuqq.bay.adapter.runner.gc;

import com.ryuqq.bay.application.sandbox.SandboxReclaimer;
import com.ryuqq.bay.core.config.RetryPolicy;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.spi.SessionStore;

import java.time.Clock;
import java.util.List;

/**
 * idle 만료된 Session 회수 (stop과 같은 절차, Sandbox는 IDLE로 돌아감).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class IdleSessionGc extends AbstractGcTask<SandboxId> {

    public static final String NAME = "idle_session";

    private final SessionStore sessionStore;
    private final SandboxReclaimer reclaimer;
    private final Clock clock;
    private final int batchSize;

    public IdleSessionGc(SessionStore sessionStore, SandboxReclaimer reclaimer, Clock clock,
                         int batchSize, RetryPolicy retryPolicy) {
        super(retryPolicy);
        if (sessionStore == null) {
            throw new IllegalArgumentException("sessionStore cannot be null");
        }
        if (reclaimer == null) {
            throw new IllegalArgumentException("reclaimer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sessionStore = sessionStore;
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
        return sessionStore.findIdleExpired(clock.instant(), batchSize).stream()
            .map(Session::sandboxId)
            .toList();
    }

    @Override
    protected boolean reclaim(SandboxId sandboxId) {
        return reclaimer.reclaimIdleSession(sandboxId);
    }
}
