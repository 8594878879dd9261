package io.helios.streaming.service.session;

import io.helios.streaming.domain.session.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live client sessions. A session is present from successful connect until its
 * disconnect is observed; removal of an absent session is a no-op.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Set<ClientSession> sessions = ConcurrentHashMap.newKeySet();

    /**
     * @return false if the session was already registered
     */
    public boolean add(ClientSession session) {
        boolean added = sessions.add(session);
        if (added) {
            log.debug("[REGISTRY] Added {} (total: {})", session, sessions.size());
        }
        return added;
    }

    /**
     * @return true if the session was present
     */
    public boolean remove(ClientSession session) {
        boolean removed = sessions.remove(session);
        if (removed) {
            log.debug("[REGISTRY] Removed {} (total: {})", session, sessions.size());
        }
        return removed;
    }

    public boolean contains(ClientSession session) {
        return sessions.contains(session);
    }

    /**
     * Point-in-time copy for iteration. Sessions removed after the copy is
     * taken are still in it; sends to them fail and are discarded.
     */
    public List<ClientSession> snapshot() {
        return List.copyOf(sessions);
    }

    public int count() {
        return sessions.size();
    }
}
