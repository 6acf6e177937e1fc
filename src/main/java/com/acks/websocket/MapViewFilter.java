package com.acks.websocket;

import com.acks.dto.FightView;
import com.acks.dto.MapView;
import com.acks.dto.ResolutionResult;
import com.acks.dto.RoomView;
import com.acks.model.DungeonMap;
import com.acks.model.Fight;
import com.acks.model.Room;
import com.acks.model.ViewerRole;

/**
 * Projection of campaign state for one kind of viewer. Every snapshot and delta leaving the
 * server passes through exactly one of these.
 */
public interface MapViewFilter {

    boolean canSee(Room room);

    RoomView projectRoom(Room room);

    FightView projectFight(Fight fight);

    /**
     * Strip from a resolution what this viewer may not see of the combatants involved.
     *
     * @param fight the fight after the change, or null when it is gone
     */
    ResolutionResult projectResult(ResolutionResult result, Fight fight);

    default MapView project(DungeonMap map) {
        return MapView.builder()
                .id(map.getId())
                .name(map.getName())
                .summary(map.getSummary())
                .revision(map.getRevision())
                .rooms(map.getRooms().values().stream()
                        .filter(this::canSee)
                        .map(this::projectRoom)
                        .toList())
                .build();
    }

    static MapViewFilter forRole(ViewerRole role) {
        if (role instanceof ViewerRole.Player player) {
            return new PlayerMapView(player);
        }
        return new DmMapView(role);
    }
}
