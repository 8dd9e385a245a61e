package com.ryuqq.bay.adapter.inmemory.store;

import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.WorkspaceId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemorySandboxStore}.
 *
 * @author Bay Team
 * @since 1.0.0
 */
class InMemorySandboxStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemorySandboxStore store = new InMemorySandboxStore();

    private Sandbox sandbox(String id, String owner, WorkspaceId workspaceId, Instant expiresAt) {
        return Sandbox.create(SandboxId.of(id), owner, "python-default", workspaceId, expiresAt, NOW);
    }

    @Test
    void findLiveByOwner_OrderedByIdAfterCursor_ExcludesDeletedAndOtherOwners() {
        // Given
        WorkspaceId ws = WorkspaceId.of("ws-1");
        store.save(sandbox("sandbox-c", "alice", ws, null));
        store.save(sandbox("sandbox-a", "alice", ws, null));
        store.save(sandbox("sandbox-b", "alice", ws, null).markDeleted(NOW));
        store.save(sandbox("sandbox-d", "bob", ws, null));
        store.save(sandbox("sandbox-e", "alice", ws, null));

        // When
        List<Sandbox> firstPage = store.findLiveByOwner("alice", null, 2);
        List<Sandbox> secondPage = store.findLiveByOwner("alice", SandboxId.of("sandbox-c"), 2);

        // Then
        assertEquals(List.of("sandbox-a", "sandbox-c"),
            firstPage.stream().map(s -> s.id().getValue()).toList());
        assertEquals(List.of("sandbox-e"),
            secondPage.stream().map(s -> s.id().getValue()).toList());
    }

    @Test
    void findExpired_StrictlyBeforeNow_NotDeleted() {
        // Given
        WorkspaceId ws = WorkspaceId.of("ws-1");
        store.save(sandbox("sandbox-1", "alice", ws, NOW.minusSeconds(1)));
        store.save(sandbox("sandbox-2", "alice", ws, NOW));
        store.save(sandbox("sandbox-3", "alice", ws, null));
        store.save(sandbox("sandbox-4", "alice", ws, NOW.minusSeconds(5)).markDeleted(NOW));

        // When
        List<Sandbox> expired = store.findExpired(NOW, 10);

        // Then
        assertEquals(1, expired.size());
        assertEquals("sandbox-1", expired.get(0).id().getValue());
    }

    @Test
    void countLiveByWorkspace_IgnoresDeleted() {
        // Given
        WorkspaceId shared = WorkspaceId.of("ws-shared");
        store.save(sandbox("sandbox-1", "alice", shared, null));
        store.save(sandbox("sandbox-2", "alice", shared, null).markDeleted(NOW));

        // When & Then
        assertEquals(1, store.countLiveByWorkspace(shared));
        assertEquals(0, store.countLiveByWorkspace(WorkspaceId.of("ws-other")));
    }

    @Test
    void findById_IncludesSoftDeleted() {
        store.save(sandbox("sandbox-1", "alice", WorkspaceId.of("ws-1"), null).markDeleted(NOW));

        assertTrue(store.findById(SandboxId.of("sandbox-1")).orElseThrow().isDeleted());
    }
}
