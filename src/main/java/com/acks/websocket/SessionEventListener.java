package com.acks.websocket;

import com.acks.exception.CampaignException;
import com.acks.model.ViewerRole;
import com.acks.service.ViewerRoleResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.List;

/**
 * Registers a {@link SyncSession} for every STOMP connection and drops it on disconnect.
 * Fights are keyed to combatants, not connections, so a disconnect changes nothing else.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionEventListener {

    static final String USER_HEADER = "x-user";
    static final String ROLE_HEADER = "x-role";
    static final String DM_TOKEN_HEADER = "x-dm-token";

    private final SessionRegistry sessionRegistry;
    private final ViewerRoleResolver viewerRoleResolver;

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        if (sessionId == null) {
            log.warn("SessionConnectEvent without a session id");
            return;
        }
        String username = firstHeader(accessor, USER_HEADER);
        try {
            ViewerRole role = viewerRoleResolver.resolve(username,
                    firstHeader(accessor, ROLE_HEADER), firstHeader(accessor, DM_TOKEN_HEADER));
            sessionRegistry.register(sessionId, role);
        } catch (CampaignException e) {
            log.warn("Session {} for '{}' not registered: {}", sessionId, username, e.getMessage());
        }
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        sessionRegistry.remove(event.getSessionId()).ifPresentOrElse(
                session -> log.info("Session {} of {} disconnected", session.getSessionId(),
                        session.getRole().username()),
                () -> log.debug("Unregistered session {} disconnected", event.getSessionId()));
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> values = accessor.getNativeHeader(key);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }
}
