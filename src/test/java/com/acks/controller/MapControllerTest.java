package com.acks.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.acks.dto.AttachEncounterRequest;
import com.acks.dto.CombatantSpec;
import com.acks.dto.CreateMapRequest;
import com.acks.dto.MapView;
import com.acks.dto.RevealRoomRequest;
import com.acks.exception.IllegalActionException;
import com.acks.exception.ValidationException;
import com.acks.model.CombatantKind;
import com.acks.model.DungeonMap;
import com.acks.model.Room;
import com.acks.model.ViewerRole;
import com.acks.service.FightService;
import com.acks.service.MapService;
import com.acks.service.ViewerRoleResolver;

/**
 * Unit tests for MapController REST API.
 */
@ExtendWith(MockitoExtension.class)
class MapControllerTest {

    @Mock private MapService mapService;
    @Mock private FightService fightService;
    @Mock private ViewerRoleResolver viewerRoleResolver;

    @InjectMocks
    private MapController controller;

    @Nested
    @DisplayName("Reading maps")
    class ReadTests {

        @Test
        @DisplayName("a player should get the map filtered to their role")
        void playerShouldGetFilteredSnapshot() {
            var alice = new ViewerRole.Player("alice", Set.of("brannoc"));
            var view = MapView.builder().id("goblin-warren").revision(3).rooms(List.of()).build();
            when(viewerRoleResolver.resolve("alice", null, null)).thenReturn(alice);
            when(mapService.getMapSnapshot("goblin-warren", alice)).thenReturn(view);

            ResponseEntity<MapView> response = controller.getMap("goblin-warren", "alice", null);

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertSame(view, response.getBody());
            verify(viewerRoleResolver, never()).requireDm(any(), any());
        }

        @Test
        @DisplayName("a DM token should select the DM view")
        void dmTokenShouldSelectDmView() {
            var dm = new ViewerRole.DungeonMaster("gm");
            when(viewerRoleResolver.requireDm("gm", "s3cret")).thenReturn(dm);
            when(mapService.getMapSnapshot("goblin-warren", dm))
                    .thenReturn(MapView.builder().id("goblin-warren").build());

            controller.getMap("goblin-warren", "gm", "s3cret");

            verify(mapService).getMapSnapshot("goblin-warren", dm);
        }
    }

    @Nested
    @DisplayName("Editing maps")
    class EditTests {

        @Test
        @DisplayName("createMap should return 201 CREATED")
        void createMapShouldReturnCreated() {
            var created = DungeonMap.builder().id("crypt").name("Old Crypt").revision(1).build();
            when(mapService.createMap("crypt", "Old Crypt", null)).thenReturn(created);

            ResponseEntity<DungeonMap> response = controller.createMap(
                    new CreateMapRequest("crypt", "Old Crypt", null), "s3cret");

            assertEquals(HttpStatus.CREATED, response.getStatusCode());
            assertEquals(1, response.getBody().getRevision());
            verify(viewerRoleResolver).requireDm(null, "s3cret");
        }

        @Test
        @DisplayName("writes without the DM token should be refused before any change")
        void writesShouldNeedDmToken() {
            when(viewerRoleResolver.requireDm(null, null))
                    .thenThrow(new IllegalActionException("DM access requires a valid DM token"));

            assertThrows(IllegalActionException.class, () -> controller.deleteMap("goblin-warren", null));
            verify(mapService, never()).deleteMap(any());
        }

        @Test
        @DisplayName("a room body whose id differs from the path should be rejected")
        void putRoomShouldCheckId() {
            Room room = Room.builder().id("r9").name("Cellar").build();

            assertThrows(ValidationException.class,
                    () -> controller.putRoom("goblin-warren", "r1", 4, room, "s3cret"));
            verify(mapService, never()).putRoom(any(), any(), anyLong());
        }

        @Test
        @DisplayName("a map body whose id differs from the path should be rejected")
        void saveMapShouldCheckId() {
            DungeonMap map = DungeonMap.builder().id("crypt").name("Old Crypt").build();

            assertThrows(ValidationException.class, () -> controller.saveMap("goblin-warren", map, "s3cret"));
        }

        @Test
        @DisplayName("revealRoom should return the new revision")
        void revealRoomShouldReturnRevision() {
            when(mapService.revealRoom("goblin-warren", "r2", List.of("brannoc"))).thenReturn(8L);

            ResponseEntity<Map<String, Long>> response = controller.revealRoom("goblin-warren", "r2",
                    new RevealRoomRequest(List.of("brannoc")), "s3cret");

            assertEquals(8L, response.getBody().get("revision"));
        }
    }

    @Test
    @DisplayName("attachEncounter should return the new fight id")
    void attachEncounterShouldReturnFightId() {
        var request = AttachEncounterRequest.builder()
                .combatants(List.of(CombatantSpec.builder()
                        .kind(CombatantKind.NPC).templateId("goblin").hitPoints(7).count(2).build()))
                .treasureValue(40)
                .build();
        when(fightService.attachEncounter(eq("goblin-warren"), eq("r2"), any())).thenReturn("goblin-warren:r2:a1b2");

        ResponseEntity<Map<String, String>> response = controller.attachEncounter("goblin-warren", "r2", request, "s3cret");

        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        assertEquals("goblin-warren:r2:a1b2", response.getBody().get("fightId"));
    }
}
