package com.ryuqq.bay.core.spi;

import com.ryuqq.bay.core.model.Workspace;
import com.ryuqq.bay.core.model.WorkspaceId;

import java.util.List;
import java.util.Optional;

/**
 * Record Store SPI for {@link Workspace} records.
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface WorkspaceStore {

    void save(Workspace workspace);

    Optional<Workspace> findById(WorkspaceId id);

    /**
     * Hard-deletes a workspace record. Deleting a missing record is a no-op.
     *
     * @param id workspace id
     */
    void delete(WorkspaceId id);

    /**
     * Lists the owner's workspaces ordered by id.
     *
     * @param owner owner identifier
     * @param managed filter by managed flag (null = both)
     * @return workspaces
     */
    List<Workspace> findByOwner(String owner, Boolean managed);

    /**
     * Lists every workspace with the given managed flag, ordered by id.
     *
     * @param managed true for managed workspaces, false for external ones
     * @return workspaces
     */
    List<Workspace> findAll(boolean managed);
}
