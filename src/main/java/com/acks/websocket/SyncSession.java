package com.acks.websocket;

import com.acks.model.ViewerRole;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One connected client: its role, the view that role implies, and the latest map revision it
 * has confirmed receiving.
 */
@Getter
public class SyncSession {

    private final String sessionId;
    private final ViewerRole role;
    private final MapViewFilter viewFilter;
    private final Instant connectedAt;
    private final Map<String, Long> acknowledged = new ConcurrentHashMap<>();

    public SyncSession(String sessionId, ViewerRole role) {
        this(sessionId, role, Instant.now());
    }

    private SyncSession(String sessionId, ViewerRole role, Instant connectedAt) {
        this.sessionId = sessionId;
        this.role = role;
        this.viewFilter = MapViewFilter.forRole(role);
        this.connectedAt = connectedAt;
    }

    /**
     * The same connection under a re-resolved role, e.g. after the player gained a character.
     * Acknowledged revisions carry over.
     */
    public SyncSession withRole(ViewerRole newRole) {
        SyncSession session = new SyncSession(sessionId, newRole, connectedAt);
        session.acknowledged.putAll(acknowledged);
        return session;
    }

    public long lastAcknowledged(String mapId) {
        return acknowledged.getOrDefault(mapId, 0L);
    }

    /** Revisions only move forward; a stale acknowledgement is ignored. */
    public void acknowledge(String mapId, long revision) {
        acknowledged.merge(mapId, revision, Math::max);
    }

    public boolean isDm() {
        return role.isDm();
    }
}
