package com.acks.websocket;

import com.acks.exception.IllegalActionException;
import com.acks.model.ViewerRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected sessions by STOMP session id.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final ConcurrentHashMap<String, SyncSession> sessions = new ConcurrentHashMap<>();

    public SyncSession register(String sessionId, ViewerRole role) {
        SyncSession session = new SyncSession(sessionId, role);
        sessions.put(sessionId, session);
        log.info("Session {} registered for {} ({})", sessionId, role.username(), role.isDm() ? "DM" : "player");
        return session;
    }

    /**
     * Replace a connected session's role, keeping what it has acknowledged.
     */
    public SyncSession refresh(String sessionId, ViewerRole role) {
        SyncSession refreshed = sessions.computeIfPresent(sessionId, (id, session) -> session.withRole(role));
        if (refreshed == null) {
            throw new IllegalActionException("Session " + sessionId + " is not registered");
        }
        log.debug("Session {} of {} refreshed", sessionId, role.username());
        return refreshed;
    }

    public Optional<SyncSession> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public Optional<SyncSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public SyncSession require(String sessionId) {
        return find(sessionId)
                .orElseThrow(() -> new IllegalActionException("Session " + sessionId + " is not registered"));
    }

    public Collection<SyncSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
