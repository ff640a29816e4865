package com.phillippitts.voicedaemon.service.session;

import com.phillippitts.voicedaemon.config.DaemonProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live {@link Session}. Sessions are created on connect and removed on disconnect
 * or eviction; removal closes the session exactly once.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<UUID, Session> sessions = new ConcurrentHashMap<>();
    private final DaemonProperties.Session limits;

    public SessionRegistry(DaemonProperties properties) {
        this.limits = properties.getSession();
    }

    /**
     * Creates and registers a session with a fresh id.
     */
    public Session open() {
        Session session = new Session(UUID.randomUUID(), limits.getQueueCapacity(),
                limits.getMaxConsecutiveDrops());
        register(session);
        return session;
    }

    public void register(Session session) {
        if (sessions.putIfAbsent(session.id(), session) != null) {
            throw new IllegalStateException("Session already registered: " + session.id());
        }
        LOG.info("Session {} connected ({} live)", session.id(), sessions.size());
    }

    /**
     * Removes and closes a session. Safe to call more than once.
     *
     * @return true if this call removed the session
     */
    public boolean unregister(UUID id) {
        Session removed = sessions.remove(id);
        if (removed == null) {
            return false;
        }
        removed.close();
        LOG.info("Session {} removed ({} live)", id, sessions.size());
        return true;
    }

    public boolean isLive(UUID id) {
        return id != null && sessions.containsKey(id);
    }

    public Optional<Session> find(UUID id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /** Point-in-time copy of the live sessions. */
    public List<Session> sessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public void closeAll() {
        sessions.keySet().forEach(this::unregister);
    }
}
