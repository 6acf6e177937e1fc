package com.acks.websocket;

import com.acks.exception.IllegalActionException;
import com.acks.model.ViewerRole;
import com.acks.service.ViewerRoleResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionEventListener.
 */
@ExtendWith(MockitoExtension.class)
class SessionEventListenerTest {

    @Mock
    private ViewerRoleResolver viewerRoleResolver;

    private SessionRegistry sessionRegistry;
    private SessionEventListener listener;

    @BeforeEach
    void setUp() {
        sessionRegistry = new SessionRegistry();
        listener = new SessionEventListener(sessionRegistry, viewerRoleResolver);
    }

    private static Message<byte[]> connectFrame(String sessionId, Map<String, String> headers) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.setSessionId(sessionId);
        headers.forEach(accessor::addNativeHeader);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    @Test
    @DisplayName("a connecting player should be registered with their characters")
    void shouldRegisterPlayer() {
        var alice = new ViewerRole.Player("alice", Set.of("brannoc"));
        when(viewerRoleResolver.resolve("alice", null, null)).thenReturn(alice);

        listener.handleSessionConnect(new SessionConnectEvent(this, connectFrame("s1", Map.of("x-user", "alice"))));

        assertEquals(alice, sessionRegistry.require("s1").getRole());
    }

    @Test
    @DisplayName("the DM headers should be passed to the resolver")
    void shouldPassDmHeaders() {
        when(viewerRoleResolver.resolve("gm", "DM", "s3cret")).thenReturn(new ViewerRole.DungeonMaster("gm"));

        listener.handleSessionConnect(new SessionConnectEvent(this, connectFrame("s2",
                Map.of("x-user", "gm", "x-role", "DM", "x-dm-token", "s3cret"))));

        assertTrue(sessionRegistry.require("s2").isDm());
    }

    @Test
    @DisplayName("a rejected connect should leave no session behind")
    void rejectedConnectShouldNotRegister() {
        when(viewerRoleResolver.resolve("mallory", "DM", "guess"))
                .thenThrow(new IllegalActionException("Invalid DM token"));

        assertDoesNotThrow(() -> listener.handleSessionConnect(new SessionConnectEvent(this, connectFrame("s3",
                Map.of("x-user", "mallory", "x-role", "DM", "x-dm-token", "guess")))));

        assertTrue(sessionRegistry.find("s3").isEmpty());
    }

    @Test
    @DisplayName("disconnect should only drop the session")
    void disconnectShouldDropSession() {
        sessionRegistry.register("s1", new ViewerRole.Player("alice", Set.of("brannoc")));

        listener.handleSessionDisconnect(new SessionDisconnectEvent(this,
                connectFrame("s1", Map.of()), "s1", CloseStatus.NORMAL));

        assertEquals(0, sessionRegistry.size());
        verifyNoInteractions(viewerRoleResolver);
    }
}
