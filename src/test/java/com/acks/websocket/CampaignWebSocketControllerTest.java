package com.acks.websocket;

import com.acks.dto.*;
import com.acks.exception.ErrorKind;
import com.acks.exception.IllegalActionException;
import com.acks.exception.NotFoundException;
import com.acks.model.ActionType;
import com.acks.model.CombatAction;
import com.acks.model.Party;
import com.acks.model.ViewerRole;
import com.acks.service.FightService;
import com.acks.service.MapService;
import com.acks.service.PartyLedgerService;
import com.acks.service.ViewerRoleResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CampaignWebSocketController message handlers.
 */
@ExtendWith(MockitoExtension.class)
class CampaignWebSocketControllerTest {

    private static final String FIGHT_ID = "warren:r2:f1";

    @Mock private FightService fightService;
    @Mock private MapService mapService;
    @Mock private PartyLedgerService partyLedgerService;
    @Mock private SessionRegistry sessionRegistry;
    @Mock private StateBroadcaster stateBroadcaster;
    @Mock private ViewerRoleResolver viewerRoleResolver;

    @InjectMocks
    private CampaignWebSocketController controller;

    private SyncSession dmSession;
    private SyncSession playerSession;
    private CombatAction attack;

    @BeforeEach
    void setUp() {
        dmSession = new SyncSession("dm-session", new ViewerRole.DungeonMaster("DM"));
        playerSession = new SyncSession("alice-session", new ViewerRole.Player("alice", Set.of("brannoc")));
        lenient().when(viewerRoleResolver.resolve("alice", null, null)).thenReturn(playerSession.getRole());
        attack = CombatAction.builder()
                .type(ActionType.ATTACK).actorId("pc-brannoc").targetId("goblin-1")
                .attackRoll(16).damageRoll(3)
                .build();
    }

    private static SimpMessageHeaderAccessor headersFor(String sessionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create();
        accessor.setSessionId(sessionId);
        return accessor;
    }

    private ActionRejection capturedRejection(String sessionId) {
        ArgumentCaptor<ActionRejection> captor = ArgumentCaptor.forClass(ActionRejection.class);
        verify(stateBroadcaster).sendRejection(eq(sessionId), captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("handleAction")
    class ActionTests {

        @Test
        @DisplayName("should submit as the session's role and reply with the result")
        void shouldSubmitAndReply() {
            ResolutionResult result = ResolutionResult.builder().fightId(FIGHT_ID).summary("hit").build();
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);
            when(fightService.submitAction(FIGHT_ID, playerSession.getRole(), attack, false)).thenReturn(result);

            controller.handleAction(FIGHT_ID, new CampaignWebSocketController.ActionMessage(attack, false),
                    headersFor("alice-session"));

            verify(stateBroadcaster).sendResolution(playerSession, result);
            verify(stateBroadcaster, never()).sendRejection(any(), any());
        }

        @Test
        @DisplayName("an illegal action should be rejected to the player without a force offer")
        void playerRejectionShouldNotOfferForce() {
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);
            when(fightService.submitAction(any(), any(), any(), anyBoolean()))
                    .thenThrow(new IllegalActionException("It is not Brannoc's turn"));

            controller.handleAction(FIGHT_ID, new CampaignWebSocketController.ActionMessage(attack, false),
                    headersFor("alice-session"));

            ActionRejection rejection = capturedRejection("alice-session");
            assertEquals("It is not Brannoc's turn", rejection.getReason());
            assertEquals(ErrorKind.ILLEGAL_ACTION, rejection.getKind());
            assertFalse(rejection.isForceAvailable());
            verify(stateBroadcaster, never()).sendResolution(any(), any());
        }

        @Test
        @DisplayName("an illegal action should offer the DM a forced resend")
        void dmRejectionShouldOfferForce() {
            when(sessionRegistry.require("dm-session")).thenReturn(dmSession);
            when(fightService.submitAction(any(), any(), any(), anyBoolean()))
                    .thenThrow(new IllegalActionException("It is not Brannoc's turn"));

            controller.handleAction(FIGHT_ID, new CampaignWebSocketController.ActionMessage(attack, false),
                    headersFor("dm-session"));

            ActionRejection rejection = capturedRejection("dm-session");
            assertTrue(rejection.isForceAvailable());
            assertEquals("fight/" + FIGHT_ID + "/action", rejection.getDestination());
        }

        @Test
        @DisplayName("other failures should not offer a force")
        void notFoundShouldNotOfferForce() {
            when(sessionRegistry.require("dm-session")).thenReturn(dmSession);
            when(fightService.submitAction(any(), any(), any(), anyBoolean()))
                    .thenThrow(NotFoundException.of("Fight", FIGHT_ID));

            controller.handleAction(FIGHT_ID, new CampaignWebSocketController.ActionMessage(attack, false),
                    headersFor("dm-session"));

            ActionRejection rejection = capturedRejection("dm-session");
            assertEquals(ErrorKind.NOT_FOUND, rejection.getKind());
            assertFalse(rejection.isForceAvailable());
        }

        @Test
        @DisplayName("an unregistered session should be rejected before anything runs")
        void unknownSessionShouldBeRejected() {
            when(sessionRegistry.require("ghost"))
                    .thenThrow(new IllegalActionException("Session ghost is not registered"));

            controller.handleAction(FIGHT_ID, new CampaignWebSocketController.ActionMessage(attack, false),
                    headersFor("ghost"));

            verifyNoInteractions(fightService);
            assertFalse(capturedRejection("ghost").isForceAvailable());
        }

        @Test
        @DisplayName("an unexpected error should be reported without details")
        void unexpectedErrorShouldBeGeneric() {
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);
            when(fightService.submitAction(any(), any(), any(), anyBoolean()))
                    .thenThrow(new IllegalStateException("boom"));

            controller.handleAction(FIGHT_ID, new CampaignWebSocketController.ActionMessage(attack, false),
                    headersFor("alice-session"));

            ActionRejection rejection = capturedRejection("alice-session");
            assertEquals("An unexpected error occurred", rejection.getReason());
            assertNull(rejection.getKind());
        }
    }

    @Nested
    @DisplayName("handleOverride")
    class OverrideTests {

        @Test
        @DisplayName("an applied override should be answered through the session's view")
        void overrideShouldReply() {
            var request = DmOverrideRequest.builder().kind(DmOverrideRequest.Kind.BEGIN_ROUND).build();
            ResolutionResult result = ResolutionResult.builder().fightId(FIGHT_ID).dmOverride(true).build();
            when(sessionRegistry.require("dm-session")).thenReturn(dmSession);
            when(fightService.dmOverride(FIGHT_ID, dmSession.getRole(), request)).thenReturn(result);

            controller.handleOverride(FIGHT_ID, request, headersFor("dm-session"));

            verify(stateBroadcaster).sendResolution(dmSession, result);
        }

        @Test
        @DisplayName("an override rejection should never offer a force")
        void overrideRejectionShouldNotOfferForce() {
            var request = DmOverrideRequest.builder().kind(DmOverrideRequest.Kind.START).build();
            when(sessionRegistry.require("dm-session")).thenReturn(dmSession);
            when(fightService.dmOverride(FIGHT_ID, dmSession.getRole(), request))
                    .thenThrow(new IllegalActionException("Cannot start while the fight is RESOLVED"));

            controller.handleOverride(FIGHT_ID, request, headersFor("dm-session"));

            assertFalse(capturedRejection("dm-session").isForceAvailable());
        }
    }

    @Nested
    @DisplayName("Map sync")
    class MapSyncTests {

        @Test
        @DisplayName("a snapshot should include a character imported after the player connected")
        void snapshotShouldRefreshCharacters() {
            ViewerRole current = new ViewerRole.Player("alice", Set.of("brannoc", "sly"));
            playerSession.acknowledge("warren", 5);
            SyncSession refreshed = playerSession.withRole(current);
            MapView view = MapView.builder().id("warren").revision(12).build();
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);
            when(viewerRoleResolver.resolve("alice", null, null)).thenReturn(current);
            when(sessionRegistry.refresh("alice-session", current)).thenReturn(refreshed);
            when(mapService.getMapSnapshot("warren", current)).thenReturn(view);

            controller.handleSnapshot("warren", headersFor("alice-session"));

            verify(stateBroadcaster).sendSnapshot("alice-session", view);
            assertEquals(12, refreshed.lastAcknowledged("warren"));
        }

        @Test
        @DisplayName("an unchanged player should keep their session")
        void unchangedPlayerShouldNotRefresh() {
            MapView view = MapView.builder().id("warren").revision(3).build();
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);
            when(mapService.getMapSnapshot("warren", playerSession.getRole())).thenReturn(view);

            controller.handleSnapshot("warren", headersFor("alice-session"));

            verify(sessionRegistry, never()).refresh(any(), any());
        }

        @Test
        @DisplayName("the DM's session should not be re-resolved")
        void dmSnapshotShouldNotResolve() {
            MapView view = MapView.builder().id("warren").revision(3).build();
            when(sessionRegistry.require("dm-session")).thenReturn(dmSession);
            when(mapService.getMapSnapshot("warren", dmSession.getRole())).thenReturn(view);

            controller.handleSnapshot("warren", headersFor("dm-session"));

            verifyNoInteractions(viewerRoleResolver);
            verify(stateBroadcaster).sendSnapshot("dm-session", view);
        }

        @Test
        @DisplayName("a snapshot request should reply with the filtered view and record its revision")
        void snapshotShouldAcknowledge() {
            MapView view = MapView.builder().id("warren").revision(12).build();
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);
            when(mapService.getMapSnapshot("warren", playerSession.getRole())).thenReturn(view);

            controller.handleSnapshot("warren", headersFor("alice-session"));

            verify(stateBroadcaster).sendSnapshot("alice-session", view);
            assertEquals(12, playerSession.lastAcknowledged("warren"));
        }

        @Test
        @DisplayName("acknowledgements should only move forward")
        void ackShouldOnlyMoveForward() {
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);

            controller.handleAck("warren", new CampaignWebSocketController.AckMessage(9), headersFor("alice-session"));
            controller.handleAck("warren", new CampaignWebSocketController.AckMessage(4), headersFor("alice-session"));

            assertEquals(9, playerSession.lastAcknowledged("warren"));
        }
    }

    @Nested
    @DisplayName("handleAllocate")
    class AllocateTests {

        @Test
        @DisplayName("the DM's allocation should be applied and broadcast")
        void dmShouldAllocate() {
            var request = new AllocateXpRequest(Map.of("brannoc", 40L));
            AllocationResult result = AllocationResult.builder().partyId("heroes").distributed(40).build();
            Party party = Party.builder().id("heroes").name("Heroes").build();
            when(sessionRegistry.require("dm-session")).thenReturn(dmSession);
            when(partyLedgerService.allocate("heroes", request.getDistribution())).thenReturn(result);
            when(partyLedgerService.getParty("heroes")).thenReturn(party);

            controller.handleAllocate("heroes", request, headersFor("dm-session"));

            verify(stateBroadcaster).sendResult("dm-session", result);
            verify(stateBroadcaster).broadcastPartyUpdate(party);
        }

        @Test
        @DisplayName("players may not allocate")
        void playerShouldBeRejected() {
            when(sessionRegistry.require("alice-session")).thenReturn(playerSession);

            controller.handleAllocate("heroes", new AllocateXpRequest(Map.of("brannoc", 40L)),
                    headersFor("alice-session"));

            verifyNoInteractions(partyLedgerService);
            assertEquals(ErrorKind.ILLEGAL_ACTION, capturedRejection("alice-session").getKind());
        }
    }
}
