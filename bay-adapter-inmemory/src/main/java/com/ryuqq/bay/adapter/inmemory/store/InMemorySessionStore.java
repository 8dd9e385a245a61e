package com.ryuqq.bay.adapter.inmemory.store;

import com.ryuqq.bay.core.model.SandboxId;
import com.ryuqq.bay.core.model.Session;
import com.ryuqq.bay.core.model.SessionId;
import com.ryuqq.bay.core.spi.SessionStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SessionStore} for testing and reference purposes.
 *
 * <p><strong>Thread Safety:</strong> all methods synchronize on the store, which makes
 * {@link #insertIfNoLiveSession(Session)} an atomic check-then-insert. This is the
 * in-memory counterpart of a partial unique index on {@code (sandbox_id)} for
 * non-terminal sessions.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<SessionId, Session> sessions = new LinkedHashMap<>();

    @Override
    public synchronized boolean insertIfNoLiveSession(Session session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        boolean hasLive = sessions.values().stream()
            .anyMatch(s -> s.sandboxId().equals(session.sandboxId()) && s.isLive());
        if (hasLive) {
            return false;
        }
        sessions.put(session.id(), session);
        return true;
    }

    @Override
    public synchronized void update(Session session) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (!sessions.containsKey(session.id())) {
            throw new IllegalStateException("Session not found: " + session.id());
        }
        sessions.put(session.id(), session);
    }

    @Override
    public synchronized Optional<Session> findBySandboxId(SandboxId sandboxId) {
        Session latestFailed = null;
        for (Session session : sessions.values()) {
            if (!session.sandboxId().equals(sandboxId)) {
                continue;
            }
            if (session.isLive()) {
                return Optional.of(session);
            }
            if (latestFailed == null || !session.createdAt().isBefore(latestFailed.createdAt())) {
                latestFailed = session;
            }
        }
        return Optional.ofNullable(latestFailed);
    }

    @Override
    public synchronized void delete(SessionId sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public synchronized List<Session> findIdleExpired(Instant now, int limit) {
        return sessions.values().stream()
            .filter(s -> s.isIdleExpiredAt(now))
            .sorted(Comparator.comparing(Session::idleExpiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Session> findLive() {
        return sessions.values().stream()
            .filter(Session::isLive)
            .collect(Collectors.toList());
    }

    public synchronized void clear() {
        sessions.clear();
    }

    public synchronized int size() {
        return sessions.size();
    }
}
