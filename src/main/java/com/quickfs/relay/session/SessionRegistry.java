package com.quickfs.relay.session;

import com.quickfs.relay.net.SignalConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide table of live sessions, keyed by their public code.
 *
 * Constructed once at startup and handed to the connection handlers. A session is
 * fully built before it is published, so lookups never see a partial one.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    static final int MAX_ID_ATTEMPTS = 16;

    private final Map<String, Session> sessions;
    private final Supplier<String> sessionIds;
    private final Supplier<String> receiverIds;

    public SessionRegistry() {
        this(new ConcurrentHashMap<>(), Ids::sessionId, Ids::receiverId);
    }

    public SessionRegistry(Map<String, Session> storage, Supplier<String> sessionIds,
                           Supplier<String> receiverIds) {
        this.sessions = storage;
        this.sessionIds = sessionIds;
        this.receiverIds = receiverIds;
    }

    /**
     * Create and publish a session under a fresh id.
     *
     * @throws IllegalStateException if no free id is found after {@value #MAX_ID_ATTEMPTS} attempts
     */
    public Session create(FileMetadata metadata, SignalConnection host) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String id = sessionIds.get();
            Session session = new Session(id, metadata, host);
            if (sessions.putIfAbsent(id, session) == null) {
                return session;
            }
            log.debug("Session id '{}' already in use, retrying", id);
        }
        throw new IllegalStateException("No free session id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    /**
     * Find a live session, or null if not found.
     */
    public Session lookup(String sessionId) {
        return sessionId == null ? null : sessions.get(sessionId);
    }

    /**
     * Remove exactly this session. No-op if it is already gone.
     */
    public boolean remove(Session session) {
        return sessions.remove(session.id(), session);
    }

    /**
     * Remove whatever session is registered under this id. No-op if there is none.
     */
    public boolean remove(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    public int size() {
        return sessions.size();
    }

    /** Id source for receivers joining any session of this registry. */
    public Supplier<String> receiverIds() {
        return receiverIds;
    }
}
