package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.application.workspace.WorkspaceService;
import com.ryuqq.bay.core.config.OrchestratorConfig;
import com.ryuqq.bay.core.error.ConflictException;
import com.ryuqq.bay.core.error.NotFoundException;
import com.ryuqq.bay.core.error.ValidationException;
import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.model.WorkspaceId;
import com.ryuqq.bay.core.spi.ComputeDriver;
import com.ryuqq.bay.core.spi.InstanceLabels;
import com.ryuqq.bay.core.spi.SandboxStore;
import com.ryuqq.bay.core.spi.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * external Workspace 관리 기본 구현.
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class DefaultWorkspaceService implements WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkspaceService.class);

    private final WorkspaceStore workspaceStore;
    private final SandboxStore sandboxStore;
    private final ComputeDriver driver;
    private final OrchestratorConfig config;
    private final Clock clock;

    public DefaultWorkspaceService(WorkspaceStore workspaceStore, SandboxStore sandboxStore,
                                   ComputeDriver driver, OrchestratorConfig config, Clock clock) {
        if (workspaceStore == null) {
            throw new IllegalArgumentException("workspaceStore cannot be null");
        }
        if (sandboxStore == null) {
            throw new IllegalArgumentException("sandboxStore cannot be null");
        }
        if (driver == null) {
            throw new IllegalArgumentException("driver cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.workspaceStore = workspaceStore;
        this.sandboxStore = sandboxStore;
        this.driver = driver;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Workspace create(String owner, Integer sizeLimitMb) {
        requireOwner(owner);
        int size = sizeLimitMb == null ? config.defaultWorkspaceSizeMb() : sizeLimitMb;
        if (size <= 0) {
            throw new ValidationException("size_limit_mb must be positive", "size_limit_mb", sizeLimitMb);
        }

        WorkspaceId workspaceId = WorkspaceId.generate();
        Map<String, String> labels = new LinkedHashMap<>(InstanceLabels.managedFilter());
        labels.put(InstanceLabels.OWNER, owner);
        labels.put(InstanceLabels.WORKSPACE_ID, workspaceId.getValue());

        Instant now = clock.instant();
        String volumeRef = driver.createVolume("bay-" + workspaceId.getValue(), labels);
        Workspace workspace = Workspace.external(workspaceId, owner, volumeRef, size, now);
        workspaceStore.save(workspace);

        log.info("Created external workspace {} (owner: {}, size: {}MB)", workspaceId, owner, size);
        return workspace;
    }

    @Override
    public Workspace get(String owner, WorkspaceId workspaceId) {
        requireOwner(owner);
        if (workspaceId == null) {
            throw new IllegalArgumentException("workspaceId cannot be null");
        }
        return workspaceStore.findById(workspaceId)
            .filter(w -> w.owner().equals(owner))
            .orElseThrow(() -> new NotFoundException("workspace", workspaceId.getValue()));
    }

    @Override
    public List<Workspace> list(String owner) {
        requireOwner(owner);
        return workspaceStore.findByOwner(owner, false);
    }

    @Override
    public void delete(String owner, WorkspaceId workspaceId) {
        Workspace workspace = get(owner, workspaceId);
        if (workspace.managed()) {
            throw ConflictException.managedWorkspace(workspaceId.getValue());
        }
        long references = sandboxStore.countLiveByWorkspace(workspaceId);
        if (references > 0) {
            throw ConflictException.workspaceInUse(workspaceId.getValue(), references);
        }

        driver.deleteVolume(workspace.volumeRef());
        workspaceStore.delete(workspaceId);
        log.info("Deleted external workspace {}", workspaceId);
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
    }
}
