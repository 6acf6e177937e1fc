package com.acks.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.acks.dto.AddMemberRequest;
import com.acks.dto.AllocateXpRequest;
import com.acks.dto.AllocationResult;
import com.acks.dto.CreatePartyRequest;
import com.acks.dto.PartyDTO;
import com.acks.exception.IllegalActionException;
import com.acks.model.MemberRole;
import com.acks.model.Party;
import com.acks.model.PartyMember;
import com.acks.service.PartyLedgerService;
import com.acks.service.ViewerRoleResolver;
import com.acks.websocket.StateBroadcaster;

/**
 * Unit tests for PartyController REST API.
 */
@ExtendWith(MockitoExtension.class)
class PartyControllerTest {

    @Mock private PartyLedgerService partyLedgerService;
    @Mock private ViewerRoleResolver viewerRoleResolver;
    @Mock private StateBroadcaster stateBroadcaster;

    @InjectMocks
    private PartyController controller;

    private static Party heroes() {
        Party party = Party.builder().id("heroes").name("Heroes").pendingXp(45).build();
        party.getMembers().add(new PartyMember("brannoc", MemberRole.MEMBER));
        return party;
    }

    @Nested
    @DisplayName("Reading parties")
    class ReadTests {

        @Test
        @DisplayName("listParties should return every party as a DTO")
        void listShouldMapToDtos() {
            when(partyLedgerService.listParties()).thenReturn(List.of(heroes()));

            ResponseEntity<List<PartyDTO>> response = controller.listParties();

            assertEquals(1, response.getBody().size());
            assertEquals(45, response.getBody().get(0).getPendingXp());
            assertEquals("brannoc", response.getBody().get(0).getMembers().get(0).getCharacterId());
        }

        @Test
        @DisplayName("proposeSplit should only suggest a distribution")
        void proposeSplitShouldDelegate() {
            when(partyLedgerService.proposeSplit("heroes", 40)).thenReturn(Map.of("brannoc", 40L));

            ResponseEntity<Map<String, Long>> response = controller.proposeSplit("heroes", 40);

            assertEquals(Map.of("brannoc", 40L), response.getBody());
            verify(partyLedgerService, never()).allocate(any(), any());
        }
    }

    @Nested
    @DisplayName("Managing parties")
    class WriteTests {

        @Test
        @DisplayName("createParty should return 201 CREATED")
        void createShouldReturnCreated() {
            when(partyLedgerService.createParty("heroes", "Heroes"))
                    .thenReturn(Party.builder().id("heroes").name("Heroes").build());

            ResponseEntity<PartyDTO> response = controller.createParty(new CreatePartyRequest("heroes", "Heroes"), "s3cret");

            assertEquals(HttpStatus.CREATED, response.getStatusCode());
            assertEquals("Heroes", response.getBody().getName());
            verify(viewerRoleResolver).requireDm(null, "s3cret");
        }

        @Test
        @DisplayName("adding a member should broadcast the party")
        void addMemberShouldBroadcast() {
            Party party = heroes();
            when(partyLedgerService.addMember("heroes", "brannoc", MemberRole.MEMBER)).thenReturn(party);

            controller.addMember("heroes", new AddMemberRequest("brannoc", MemberRole.MEMBER), "s3cret");

            verify(stateBroadcaster).broadcastPartyUpdate(party);
        }

        @Test
        @DisplayName("removing a member without the DM token should change nothing")
        void removeMemberShouldNeedDmToken() {
            when(viewerRoleResolver.requireDm(null, null))
                    .thenThrow(new IllegalActionException("DM access requires a valid DM token"));

            assertThrows(IllegalActionException.class, () -> controller.removeMember("heroes", "brannoc", null));
            verifyNoInteractions(partyLedgerService, stateBroadcaster);
        }

        @Test
        @DisplayName("an allocation should return the result and broadcast the drained pool")
        void allocateShouldBroadcast() {
            var request = new AllocateXpRequest(Map.of("brannoc", 40L));
            AllocationResult result = AllocationResult.builder().partyId("heroes").distributed(40).build();
            Party drained = heroes();
            drained.setPendingXp(5);
            when(partyLedgerService.allocate("heroes", request.getDistribution())).thenReturn(result);
            when(partyLedgerService.getParty("heroes")).thenReturn(drained);

            ResponseEntity<AllocationResult> response = controller.allocate("heroes", request, "s3cret");

            assertSame(result, response.getBody());
            verify(stateBroadcaster).broadcastPartyUpdate(drained);
        }

        @Test
        @DisplayName("an allocation without the DM token should never reach the ledger")
        void allocateShouldNeedDmToken() {
            when(viewerRoleResolver.requireDm(null, "guess"))
                    .thenThrow(new IllegalActionException("DM access requires a valid DM token"));

            assertThrows(IllegalActionException.class,
                    () -> controller.allocate("heroes", new AllocateXpRequest(Map.of("brannoc", 40L)), "guess"));
            verifyNoInteractions(partyLedgerService, stateBroadcaster);
        }
    }
}
