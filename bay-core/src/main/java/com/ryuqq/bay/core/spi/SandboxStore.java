package com.ryuqq.bay.core.spi;

import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.WorkspaceId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Record Store SPI for {@link Sandbox} records.
 *
 * <p>Sandboxes are never hard-deleted by the control plane: a delete sets the
 * soft-delete marker and the record stays readable through {@link #findById(SandboxId)}.
 * Owner-scoped listing excludes soft-deleted records.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Read-committed isolation at minimum</li>
 * </ul>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface SandboxStore {

    /**
     * Inserts or replaces the record with the same id.
     *
     * @param sandbox the record to persist
     * @throws IllegalArgumentException if sandbox is null
     */
    void save(Sandbox sandbox);

    /**
     * Looks up a record by id, including soft-deleted ones.
     *
     * @param id sandbox id
     * @return the record, or empty if it was never created
     */
    Optional<Sandbox> findById(SandboxId id);

    /**
     * Lists the owner's live (not soft-deleted) sandboxes ordered by id.
     *
     * @param owner owner identifier
     * @param after exclusive lower bound on id (null = from the start)
     * @param limit maximum number of records to return
     * @return records with {@code id > after}, at most {@code limit}
     */
    List<Sandbox> findLiveByOwner(String owner, SandboxId after, int limit);

    /**
     * Finds live sandboxes whose hard TTL has passed ({@code expiresAt < now}).
     *
     * @param now reference time
     * @param limit maximum number of records to return
     * @return expired, not soft-deleted records
     */
    List<Sandbox> findExpired(Instant now, int limit);

    /**
     * Counts live sandboxes bound to the given workspace.
     *
     * @param workspaceId workspace id
     * @return number of referencing sandboxes without a soft-delete marker
     */
    long countLiveByWorkspace(WorkspaceId workspaceId);
}
