package com.acks.model;

import com.acks.exception.NotFoundException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;
import java.util.TreeMap;

/**
 * A dungeon, town or wilderness area: a graph of rooms without spatial layout. A map is
 * loaded and saved as one unit.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DungeonMap {

    private String id;

    private String name;

    private String summary;

    /** Bumped on every committed change. */
    private long revision;

    /** Rooms keyed by id; a sorted map keeps iteration in room-number order. */
    @Builder.Default
    private TreeMap<String, Room> rooms = new TreeMap<>();

    public Optional<Room> findRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Room requireRoom(String roomId) {
        return findRoom(roomId)
                .orElseThrow(() -> NotFoundException.of("Room", id + "/" + roomId));
    }

    public void putRoom(Room room) {
        rooms.put(room.getId(), room);
    }
}
