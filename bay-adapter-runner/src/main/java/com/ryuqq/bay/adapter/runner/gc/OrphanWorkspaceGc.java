package com.ryuqq.bay.adapter.runner.gc;

import com.ryuqq.bay.core.config.RetryPolicy;
import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.SandboxStore;
import com.ryuqq.bay.core.spi.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 소유자를 잃은 Workspace 회수 (볼륨 먼저, 기록 나중).
 *
 * <p><strong>대상:</strong></p>
 * <ul>
 *   <li>managed: 소유 Sandbox가 soft delete 되었거나 기록이 없는 경우
 *       (delete 중 볼륨 삭제가 실패해 남은 것)</li>
 *   <li>external: {@code reclaimExternal}이 켜져 있고 살아있는 Sandbox 참조가 0인 경우</li>
 * </ul>
 *
 * <p>create는 Workspace를 Sandbox보다 먼저 저장하므로, 소유 Sandbox 기록이 없거나 external인
 * Workspace는 유예 시간(grace)보다 최근에 접근되었다면 건드리지 않습니다.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class OrphanWorkspaceGc extends AbstractGcTask<Workspace> {

    private static final Logger log = LoggerFactory.getLogger(OrphanWorkspaceGc.class);

    public static final String NAME = "orphan_workspace";

    /**
     * 기본 유예 시간.
     */
    public static final Duration DEFAULT_GRACE = Duration.ofMinutes(5);

    private final WorkspaceStore workspaceStore;
    private final SandboxStore sandboxStore;
    private final ComputeDriver driver;
    private final Clock clock;
    private final int batchSize;
    private final boolean reclaimExternal;
    private final Duration grace;

    public OrphanWorkspaceGc(WorkspaceStore workspaceStore, SandboxStore sandboxStore, ComputeDriver driver,
                             Clock clock, int batchSize, RetryPolicy retryPolicy,
                             boolean reclaimExternal, Duration grace) {
        super(retryPolicy);
        if (workspaceStore == null) {
            throw new IllegalArgumentException("workspaceStore cannot be null");
        }
        if (sandboxStore == null) {
            throw new IllegalArgumentException("sandboxStore cannot be null");
        }
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (grace == null || grace.isNegative()) {
            throw new IllegalArgumentException("grace cannot be null or negative");
        }
        this.workspaceStore = workspaceStore;
        this.sandboxStore = sandboxStore;
        this.driver = driver;
        this.clock = clock;
        this.batchSize = batchSize;
        this.reclaimExternal = reclaimExternal;
        this.grace = grace;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<Workspace> scan() {
        Instant now = clock.instant();
        List<Workspace> orphans = new ArrayList<>();
        for (Workspace workspace : workspaceStore.findAll(true)) {
            if (orphans.size() >= batchSize) {
                return orphans;
            }
            if (isOrphan(workspace, now)) {
                orphans.add(workspace);
            }
        }
        if (reclaimExternal) {
            for (Workspace workspace : workspaceStore.findAll(false)) {
                if (orphans.size() >= batchSize) {
                    break;
                }
                if (isOrphan(workspace, now)) {
                    orphans.add(workspace);
                }
            }
        }
        return orphans;
    }

    @Override
    protected boolean reclaim(Workspace workspace) {
        // 재시도 사이에 상태가 바뀌었을 수 있으므로 다시 확인
        Optional<Workspace> current = workspaceStore.findById(workspace.id());
        if (current.isEmpty() || !isOrphan(current.get(), clock.instant())) {
            return false;
        }

        driver.deleteVolume(workspace.volumeRef());
        workspaceStore.delete(workspace.id());
        log.info("Reclaimed orphan {} workspace {} (volume: {})",
            workspace.managed() ? "managed" : "external", workspace.id(), workspace.volumeRef());
        return true;
    }

    @Override
    protected String describe(Workspace workspace) {
        return "workspace " + workspace.id();
    }

    private boolean isOrphan(Workspace workspace, Instant now) {
        if (!workspace.managed()) {
            return isPastGrace(workspace, now) && sandboxStore.countLiveByWorkspace(workspace.id()) == 0;
        }
        Optional<Sandbox> owner = sandboxStore.findById(workspace.managedBySandboxId());
        if (owner.isPresent()) {
            return owner.get().isDeleted();
        }
        return isPastGrace(workspace, now);
    }

    private boolean isPastGrace(Workspace workspace, Instant now) {
        Instant lastTouched = workspace.lastAccessedAt() != null ? workspace.lastAccessedAt() : workspace.createdAt();
        return !lastTouched.plus(grace).isAfter(now);
    }
}
