package com.ryuqq.bay.core.spi;

import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.model.SessionId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Record Store SPI for {@link Session} records.
 *
 * <p>Sessions are hard-deleted on stop or destroy. The store owns the
 * "at most one live session per sandbox" invariant through
 * {@link #insertIfNoLiveSession(Session)}, an atomic conditional insert.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public interface SessionStore {

    /**
     * Atomically inserts the session unless the sandbox already has a live
     * (non-terminal) session.
     *
     * @param session a new session
     * @return true if inserted, false if another live session exists
     */
    boolean insertIfNoLiveSession(Session session);

    /**
     * Replaces an existing session record.
     *
     * @param session the updated record
     * @throws IllegalStateException if the session does not exist
     */
    void update(Session session);

    /**
     * Returns the sandbox's current session: the live one if present,
     * otherwise the most recent failed one.
     *
     * @param sandboxId sandbox id
     * @return current session, or empty when the sandbox has no compute
     */
    Optional<Session> findBySandboxId(SandboxId sandboxId);

    /**
     * Hard-deletes a session record. Deleting a missing record is a no-op.
     *
     * @param sessionId session id
     */
    void delete(SessionId sessionId);

    /**
     * Finds running sessions with {@code idleExpiresAt < now}.
     *
     * @param now reference time
     * @param limit maximum number of records to return
     * @return idle-expired sessions
     */
    List<Session> findIdleExpired(Instant now, int limit);

    /**
     * Returns every live (non-terminal) session.
     *
     * @return live sessions
     */
    List<Session> findLive();
}
