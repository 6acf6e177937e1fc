package com.acks.websocket;

import com.acks.dto.ActionRejection;
import com.acks.dto.AllocateXpRequest;
import com.acks.dto.AllocationResult;
import com.acks.dto.DmOverrideRequest;
import com.acks.dto.MapView;
import com.acks.dto.ResolutionResult;
import com.acks.exception.CampaignException;
import com.acks.exception.ErrorKind;
import com.acks.exception.IllegalActionException;
import com.acks.model.CombatAction;
import com.acks.model.ViewerRole;
import com.acks.service.FightService;
import com.acks.service.MapService;
import com.acks.service.PartyLedgerService;
import com.acks.service.ViewerRoleResolver;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * STOMP entry points. Every request is checked against the sender's session; the sender gets
 * either the result or a rejection on its own queue, while the resulting state change reaches
 * everyone through {@link StateBroadcaster}.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class CampaignWebSocketController {

    private static final String ACTION_SUFFIX = "/action";

    private final FightService fightService;
    private final MapService mapService;
    private final PartyLedgerService partyLedgerService;
    private final SessionRegistry sessionRegistry;
    private final StateBroadcaster stateBroadcaster;
    private final ViewerRoleResolver viewerRoleResolver;

    /**
     * Handle a combat action request.
     */
    @MessageMapping("/fight/{fightId}/action")
    public void handleAction(@DestinationVariable String fightId,
                             @Payload ActionMessage message,
                             SimpMessageHeaderAccessor headerAccessor) {
        String destination = "fight/" + fightId + ACTION_SUFFIX;
        handle(headerAccessor, destination, connected -> {
            SyncSession session = withCurrentCharacters(connected);
            log.debug("Action {} from {} in fight {}", message.getAction() == null ? null : message.getAction().getType(),
                    session.getRole().username(), fightId);
            ResolutionResult result = fightService.submitAction(fightId, session.getRole(),
                    message.getAction(), message.isForce());
            stateBroadcaster.sendResolution(session, result);
        });
    }

    /**
     * Handle a DM override.
     */
    @MessageMapping("/fight/{fightId}/override")
    public void handleOverride(@DestinationVariable String fightId,
                               @Payload DmOverrideRequest request,
                               SimpMessageHeaderAccessor headerAccessor) {
        handle(headerAccessor, "fight/" + fightId + "/override", session -> {
            log.debug("Override {} in fight {}", request.getKind(), fightId);
            ResolutionResult result = fightService.dmOverride(fightId, session.getRole(), request);
            stateBroadcaster.sendResolution(session, result);
        });
    }

    /**
     * Send the sender a full snapshot of a map as their role sees it.
     */
    @MessageMapping("/map/{mapId}/snapshot")
    public void handleSnapshot(@DestinationVariable String mapId, SimpMessageHeaderAccessor headerAccessor) {
        handle(headerAccessor, "map/" + mapId + "/snapshot", connected -> {
            SyncSession session = withCurrentCharacters(connected);
            MapView view = mapService.getMapSnapshot(mapId, session.getRole());
            session.acknowledge(mapId, view.getRevision());
            stateBroadcaster.sendSnapshot(session.getSessionId(), view);
        });
    }

    /**
     * Record the latest map revision a client has applied.
     */
    @MessageMapping("/map/{mapId}/ack")
    public void handleAck(@DestinationVariable String mapId,
                          @Payload AckMessage message,
                          SimpMessageHeaderAccessor headerAccessor) {
        handle(headerAccessor, "map/" + mapId + "/ack",
                session -> session.acknowledge(mapId, message.getRevision()));
    }

    /**
     * Handle a DM's XP allocation.
     */
    @MessageMapping("/party/{partyId}/allocate")
    public void handleAllocate(@DestinationVariable String partyId,
                               @Payload AllocateXpRequest message,
                               SimpMessageHeaderAccessor headerAccessor) {
        handle(headerAccessor, "party/" + partyId + "/allocate", session -> {
            if (!session.isDm()) {
                throw new IllegalActionException("Only the DM can allocate XP");
            }
            AllocationResult result = partyLedgerService.allocate(partyId, message.getDistribution());
            stateBroadcaster.sendResult(session.getSessionId(), result);
            stateBroadcaster.broadcastPartyUpdate(partyLedgerService.getParty(partyId));
        });
    }

    /**
     * A player's characters are looked up again, so one imported after connecting is visible
     * and controllable without reconnecting.
     */
    private SyncSession withCurrentCharacters(SyncSession session) {
        if (session.isDm()) {
            return session;
        }
        ViewerRole role = viewerRoleResolver.resolve(session.getRole().username(), null, null);
        if (role.equals(session.getRole())) {
            return session;
        }
        return sessionRegistry.refresh(session.getSessionId(), role);
    }

    private void handle(SimpMessageHeaderAccessor headerAccessor, String destination, SessionAction action) {
        String sessionId = headerAccessor.getSessionId();
        SyncSession session = null;
        try {
            session = sessionRegistry.require(sessionId);
            action.run(session);
        } catch (CampaignException e) {
            log.warn("Rejected {} from session {}: {}", destination, sessionId, e.getMessage());
            boolean forceAvailable = session != null && session.isDm()
                    && e.getKind() == ErrorKind.ILLEGAL_ACTION && destination.endsWith(ACTION_SUFFIX);
            reject(sessionId, destination, e.getMessage(), e.getKind(), forceAvailable);
        } catch (RuntimeException e) {
            log.error("Error processing {} from session {}", destination, sessionId, e);
            reject(sessionId, destination, "An unexpected error occurred", null, false);
        }
    }

    private void reject(String sessionId, String destination, String reason, ErrorKind kind, boolean forceAvailable) {
        if (sessionId == null) {
            return;
        }
        stateBroadcaster.sendRejection(sessionId, ActionRejection.builder()
                .destination(destination)
                .reason(reason)
                .kind(kind)
                .forceAvailable(forceAvailable)
                .build());
    }

    @FunctionalInterface
    private interface SessionAction {
        void run(SyncSession session);
    }

    // Message DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionMessage {
        private CombatAction action;
        /** DM only: resolve even though the action is not legal right now. */
        private boolean force;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AckMessage {
        private long revision;
    }
}
