package com.acks.service;

import com.acks.config.MapTemplateLoader;
import com.acks.dto.MapView;
import com.acks.model.DungeonMap;
import com.acks.model.Room;
import com.acks.model.ViewerRole;
import com.acks.websocket.MapViewFilter;
import com.acks.websocket.StateBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Map editing and viewing for the DM and the session layer. Every successful change is pushed
 * to connected sessions after it is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MapService {

    private final RoomGraphStore roomGraphStore;
    private final MapTemplateLoader mapTemplateLoader;
    private final StateBroadcaster stateBroadcaster;

    @Value("${campaign.maps.seed-on-startup:true}")
    private boolean seedOnStartup = true;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!seedOnStartup) {
            log.debug("Map seeding disabled");
            return;
        }
        seedTemplates();
    }

    /**
     * Store every map template whose id is not in the store yet. Maps already stored are left
     * alone, so play progress is never overwritten by a template.
     *
     * @return the ids of the maps created
     */
    public List<String> seedTemplates() {
        Map<String, DungeonMap> templates = mapTemplateLoader.loadTemplates();
        List<String> created = templates.values().stream()
                .filter(template -> !roomGraphStore.exists(template.getId()))
                .map(roomGraphStore::saveMap)
                .map(DungeonMap::getId)
                .toList();
        if (!created.isEmpty()) {
            log.info("Seeded {} map(s) from templates: {}", created.size(), created);
        }
        return created;
    }

    public List<String> listMapIds() {
        return roomGraphStore.listMapIds();
    }

    /**
     * The map as {@code role} is allowed to see it.
     */
    public MapView getMapSnapshot(String mapId, ViewerRole role) {
        MapViewFilter view = MapViewFilter.forRole(role);
        return roomGraphStore.read(mapId, view::project);
    }

    /**
     * The full, unfiltered map, for DM editing.
     */
    public DungeonMap getMap(String mapId) {
        return roomGraphStore.loadMap(mapId);
    }

    public DungeonMap createMap(String mapId, String name, String summary) {
        DungeonMap map = roomGraphStore.createMap(mapId, name, summary);
        stateBroadcaster.broadcastMapReplaced(mapId);
        return map;
    }

    public DungeonMap saveMap(DungeonMap map) {
        DungeonMap saved = roomGraphStore.saveMap(map);
        stateBroadcaster.broadcastMapReplaced(saved.getId());
        return saved;
    }

    public void deleteMap(String mapId) {
        roomGraphStore.deleteMap(mapId);
    }

    public DungeonMap putRoom(String mapId, Room room, long expectedRevision) {
        DungeonMap map = roomGraphStore.putRoom(mapId, room, expectedRevision);
        stateBroadcaster.broadcastRoomChange(mapId, room.getId(), null);
        return map;
    }

    public DungeonMap deleteRoom(String mapId, String roomId, long expectedRevision) {
        DungeonMap map = roomGraphStore.deleteRoom(mapId, roomId, expectedRevision);
        stateBroadcaster.broadcastMapReplaced(mapId);
        return map;
    }

    /**
     * Mark a room as discovered, which makes it visible to those characters' players.
     *
     * @return the map revision after the change
     */
    public long revealRoom(String mapId, String roomId, Collection<String> characterIds) {
        long revision = roomGraphStore.revealRoom(mapId, roomId, characterIds);
        stateBroadcaster.broadcastRoomChange(mapId, roomId, null);
        return revision;
    }
}
