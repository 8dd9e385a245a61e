package com.ryuqq.bay.adapter.inmemory.store;

import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.WorkspaceId;
import com.ryuqq.bay.core.spi.SandboxStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SandboxStore} for testing and reference purposes.
 *
 * <p>Records live in a {@link ConcurrentHashMap}; every read returns an immutable
 * record, so callers never observe a partially applied update.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class InMemorySandboxStore implements SandboxStore {

    private final ConcurrentHashMap<SandboxId, Sandbox> sandboxes = new ConcurrentHashMap<>();

    @Override
    public void save(Sandbox sandbox) {
        if (sandbox == null) {
            throw new IllegalArgumentException("sandbox cannot be null");
        }
        sandboxes.put(sandbox.id(), sandbox);
    }

    @Override
    public Optional<Sandbox> findById(SandboxId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(sandboxes.get(id));
    }

    @Override
    public List<Sandbox> findLiveByOwner(String owner, SandboxId after, int limit) {
        return sandboxes.values().stream()
            .filter(s -> s.owner().equals(owner))
            .filter(s -> !s.isDeleted())
            .filter(s -> after == null || s.id().compareTo(after) > 0)
            .sorted(Comparator.comparing(Sandbox::id))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<Sandbox> findExpired(Instant now, int limit) {
        return sandboxes.values().stream()
            .filter(s -> !s.isDeleted())
            .filter(s -> s.isExpiredAt(now))
            .sorted(Comparator.comparing(Sandbox::expiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countLiveByWorkspace(WorkspaceId workspaceId) {
        return sandboxes.values().stream()
            .filter(s -> !s.isDeleted())
            .filter(s -> workspaceId.equals(s.workspaceId()))
            .count();
    }

    /**
     * Clears all records. Used for test cleanup.
     */
    public void clear() {
        sandboxes.clear();
    }

    public int size() {
        return sandboxes.size();
    }
}
