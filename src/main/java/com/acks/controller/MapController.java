package com.acks.controller;

import com.acks.dto.AttachEncounterRequest;
import com.acks.dto.CreateMapRequest;
import com.acks.dto.MapView;
import com.acks.dto.RevealRoomRequest;
import com.acks.exception.ValidationException;
import com.acks.model.DungeonMap;
import com.acks.model.Room;
import com.acks.model.ViewerRole;
import com.acks.service.FightService;
import com.acks.service.MapService;
import com.acks.service.ViewerRoleResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the DM's map tooling. Reads are open to players, filtered to what their
 * characters have discovered; every write needs the DM token.
 */
@RestController
@RequestMapping("/api/maps")
@RequiredArgsConstructor
@Slf4j
public class MapController {

    static final String DM_TOKEN_HEADER = "X-DM-Token";
    static final String USER_HEADER = "X-User";

    private final MapService mapService;
    private final FightService fightService;
    private final ViewerRoleResolver viewerRoleResolver;

    @GetMapping
    public ResponseEntity<List<String>> listMaps() {
        return ResponseEntity.ok(mapService.listMapIds());
    }

    @PostMapping
    public ResponseEntity<DungeonMap> createMap(@Valid @RequestBody CreateMapRequest request,
                                                @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        log.info("Creating map {} ({})", request.getId(), request.getName());
        DungeonMap map = mapService.createMap(request.getId(), request.getName(), request.getSummary());
        return ResponseEntity.status(HttpStatus.CREATED).body(map);
    }

    /**
     * Snapshot of a map as the caller may see it.
     */
    @GetMapping("/{mapId}")
    public ResponseEntity<MapView> getMap(@PathVariable String mapId,
                                          @RequestHeader(value = USER_HEADER, required = false) String user,
                                          @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        ViewerRole role = dmToken != null
                ? viewerRoleResolver.requireDm(user, dmToken)
                : viewerRoleResolver.resolve(user, null, null);
        return ResponseEntity.ok(mapService.getMapSnapshot(mapId, role));
    }

    /**
     * The stored map document, for editing and re-uploading with {@code PUT}.
     */
    @GetMapping("/{mapId}/document")
    public ResponseEntity<DungeonMap> getMapDocument(@PathVariable String mapId,
                                                     @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        return ResponseEntity.ok(mapService.getMap(mapId));
    }

    /**
     * Replace a whole map. The body's revision must be the one it was read at.
     */
    @PutMapping("/{mapId}")
    public ResponseEntity<DungeonMap> saveMap(@PathVariable String mapId,
                                              @RequestBody DungeonMap map,
                                              @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        if (!mapId.equals(map.getId())) {
            throw new ValidationException("Map id " + map.getId() + " does not match path " + mapId);
        }
        return ResponseEntity.ok(mapService.saveMap(map));
    }

    @DeleteMapping("/{mapId}")
    public ResponseEntity<Void> deleteMap(@PathVariable String mapId,
                                          @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        mapService.deleteMap(mapId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{mapId}/rooms/{roomId}")
    public ResponseEntity<DungeonMap> putRoom(@PathVariable String mapId,
                                              @PathVariable String roomId,
                                              @RequestParam long expectedRevision,
                                              @RequestBody Room room,
                                              @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        if (!roomId.equals(room.getId())) {
            throw new ValidationException("Room id " + room.getId() + " does not match path " + roomId);
        }
        return ResponseEntity.ok(mapService.putRoom(mapId, room, expectedRevision));
    }

    @DeleteMapping("/{mapId}/rooms/{roomId}")
    public ResponseEntity<DungeonMap> deleteRoom(@PathVariable String mapId,
                                                 @PathVariable String roomId,
                                                 @RequestParam long expectedRevision,
                                                 @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        return ResponseEntity.ok(mapService.deleteRoom(mapId, roomId, expectedRevision));
    }

    @PostMapping("/{mapId}/rooms/{roomId}/reveal")
    public ResponseEntity<Map<String, Long>> revealRoom(@PathVariable String mapId,
                                                        @PathVariable String roomId,
                                                        @Valid @RequestBody RevealRoomRequest request,
                                                        @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        long revision = mapService.revealRoom(mapId, roomId, request.getCharacterIds());
        return ResponseEntity.ok(Map.of("revision", revision));
    }

    /**
     * Attach an encounter to a room.
     */
    @PostMapping("/{mapId}/rooms/{roomId}/encounters")
    public ResponseEntity<Map<String, String>> attachEncounter(@PathVariable String mapId,
                                                               @PathVariable String roomId,
                                                               @Valid @RequestBody AttachEncounterRequest request,
                                                               @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        log.info("Attaching encounter of {} line(s) to {}/{}", request.getCombatants().size(), mapId, roomId);
        String fightId = fightService.attachEncounter(mapId, roomId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("fightId", fightId));
    }
}
