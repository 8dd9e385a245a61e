package com.ryuqq.bay.adapter.inmemory.store;

import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.model.WorkspaceId;
import com.ryuqq.bay.core.spi.WorkspaceStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link WorkspaceStore} for testing and reference purposes.
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class InMemoryWorkspaceStore implements WorkspaceStore {

    private static final Comparator<Workspace> BY_ID = Comparator.comparing(w -> w.id().getValue());

    private final ConcurrentHashMap<WorkspaceId, Workspace> workspaces = new ConcurrentHashMap<>();

    @Override
    public void save(Workspace workspace) {
        if (workspace == null) {
            throw new IllegalArgumentException("workspace cannot be null");
        }
        workspaces.put(workspace.id(), workspace);
    }

    @Override
    public Optional<Workspace> findById(WorkspaceId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(workspaces.get(id));
    }

    @Override
    public void delete(WorkspaceId id) {
        workspaces.remove(id);
    }

    @Override
    public List<Workspace> findByOwner(String owner, Boolean managed) {
        return workspaces.values().stream()
            .filter(w -> w.owner().equals(owner))
            .filter(w -> managed == null || w.managed() == managed)
            .sorted(BY_ID)
            .collect(Collectors.toList());
    }

    @Override
    public List<Workspace> findAll(boolean managed) {
        return workspaces.values().stream()
            .filter(w -> w.managed() == managed)
            .sorted(BY_ID)
            .collect(Collectors.toList());
    }

    public void clear() {
        workspaces.clear();
    }

    public int size() {
        return workspaces.size();
    }
}
