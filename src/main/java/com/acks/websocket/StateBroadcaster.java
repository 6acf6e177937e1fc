package com.acks.websocket;

import com.acks.dto.ActionRejection;
import com.acks.dto.MapView;
import com.acks.dto.PartyDTO;
import com.acks.dto.ResolutionResult;
import com.acks.dto.StateDelta;
import com.acks.exception.CampaignException;
import com.acks.model.DungeonMap;
import com.acks.model.Fight;
import com.acks.model.FightRef;
import com.acks.model.Party;
import com.acks.model.Room;
import com.acks.model.ViewerRole;
import com.acks.service.RoomGraphStore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pushes state to connected sessions. Every message goes to one session at a time, already run
 * through that session's view, so nobody receives what they may not see.
 *
 * <p>Broadcasting never fails the change that triggered it: errors are logged and the client
 * catches up with its next snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StateBroadcaster {

    static final String USER_QUEUE = "/queue/campaign";

    private final SimpMessagingTemplate messagingTemplate;
    private final SessionRegistry sessionRegistry;
    private final RoomGraphStore roomGraphStore;

    /**
     * Send the changed rooms of a map to every session that can see at least one of them.
     *
     * @param result the resolution that caused the change, or null for a plain edit
     */
    public void broadcastRoomChange(String mapId, Collection<String> roomIds, ResolutionResult result) {
        try {
            Snapshot snapshot = roomGraphStore.read(mapId, map -> new Snapshot(map.getRevision(),
                    roomIds.stream()
                            .map(id -> map.findRoom(id).orElse(null))
                            .filter(Objects::nonNull)
                            .toList(),
                    roomIds.stream().filter(id -> map.findRoom(id).isEmpty()).toList()));

            Fight fight = result == null ? null : snapshot.rooms().stream()
                    .map(Room::getFight)
                    .filter(f -> f != null && f.getId().equals(result.getFightId()))
                    .findFirst()
                    .orElse(null);

            for (SyncSession session : sessionRegistry.all()) {
                MapViewFilter view = session.getViewFilter();
                List<Room> visible = snapshot.rooms().stream().filter(view::canSee).toList();
                if (visible.isEmpty() && !session.isDm()) {
                    continue;
                }
                StateDelta delta = StateDelta.builder()
                        .mapId(mapId)
                        .revision(snapshot.revision())
                        .sinceRevision(session.lastAcknowledged(mapId))
                        .rooms(visible.stream().map(view::projectRoom).toList())
                        .removedRoomIds(session.isDm() ? snapshot.removed() : List.of())
                        .result(view.projectResult(result, fight))
                        .build();
                sendToSession(session.getSessionId(), CampaignMessage.stateDelta(delta));
            }
            log.debug("Broadcast change of {} in map {} at revision {}", roomIds, mapId, snapshot.revision());
        } catch (RuntimeException e) {
            log.error("Error broadcasting change of {} in map {}", roomIds, mapId, e);
        }
    }

    public void broadcastRoomChange(String mapId, String roomId, ResolutionResult result) {
        broadcastRoomChange(mapId, Set.of(roomId), result);
    }

    /**
     * Send a full, filtered snapshot of a map to every session, e.g. after the map was replaced.
     */
    public void broadcastMapReplaced(String mapId) {
        try {
            DungeonMap map = roomGraphStore.loadMap(mapId);
            for (SyncSession session : sessionRegistry.all()) {
                sendToSession(session.getSessionId(), CampaignMessage.snapshot(session.getViewFilter().project(map)));
            }
        } catch (RuntimeException e) {
            log.error("Error broadcasting map {}", mapId, e);
        }
    }

    /**
     * Party pool changes go to the DM and to players with a character in the party.
     */
    public void broadcastPartyUpdate(Party party) {
        try {
            PartyDTO dto = PartyDTO.from(party);
            for (SyncSession session : sessionRegistry.all()) {
                if (session.isDm() || isMember(session, party)) {
                    sendToSession(session.getSessionId(), CampaignMessage.partyUpdate(dto));
                }
            }
        } catch (RuntimeException e) {
            log.error("Error broadcasting party {}", party.getId(), e);
        }
    }

    public void sendSnapshot(String sessionId, MapView view) {
        sendToSession(sessionId, CampaignMessage.snapshot(view));
    }

    /**
     * Answer a fight request with its outcome, as the requesting session may see it.
     */
    public void sendResolution(SyncSession session, ResolutionResult result) {
        ResolutionResult visible = result;
        if (!session.isDm()) {
            visible = session.getViewFilter().projectResult(result, null);
            if (result.getFightId() != null) {
                try {
                    FightRef ref = FightRef.parse(result.getFightId());
                    visible = roomGraphStore.read(ref.mapId(), map -> session.getViewFilter().projectResult(result,
                            map.findRoom(ref.roomId()).map(Room::getFight).orElse(null)));
                } catch (CampaignException e) {
                    log.debug("Fight {} is gone; sending its result without combatant detail", result.getFightId());
                }
            }
        }
        sendResult(session.getSessionId(), visible);
    }

    public void sendResult(String sessionId, Object result) {
        sendToSession(sessionId, CampaignMessage.result(result));
    }

    public void sendRejection(String sessionId, ActionRejection rejection) {
        sendToSession(sessionId, CampaignMessage.rejected(rejection));
    }

    private static boolean isMember(SyncSession session, Party party) {
        if (!(session.getRole() instanceof ViewerRole.Player player)) {
            return false;
        }
        return party.getMembers().stream().anyMatch(m -> player.characterIds().contains(m.getCharacterId()));
    }

    /**
     * Address one session. Clients subscribe to {@code /user/queue/campaign}; the session id
     * header routes the message without needing an authenticated principal.
     */
    private void sendToSession(String sessionId, CampaignMessage message) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(sessionId);
        headers.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(sessionId, USER_QUEUE, message, headers.getMessageHeaders());
    }

    private record Snapshot(long revision, List<Room> rooms, List<String> removed) {
    }

    /**
     * Envelope of every message sent to clients.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CampaignMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static CampaignMessage snapshot(MapView map) {
            return of("MAP_SNAPSHOT", map);
        }

        public static CampaignMessage stateDelta(StateDelta delta) {
            return of("STATE_DELTA", delta);
        }

        public static CampaignMessage partyUpdate(PartyDTO party) {
            return of("PARTY_UPDATE", party);
        }

        public static CampaignMessage result(Object result) {
            return of("ACTION_RESULT", result);
        }

        public static CampaignMessage rejected(ActionRejection rejection) {
            return of("ACTION_REJECTED", rejection);
        }

        private static CampaignMessage of(String type, Object payload) {
            return CampaignMessage.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }
}
