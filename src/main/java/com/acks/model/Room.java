package com.acks.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeMap;

/**
 * A room of a map. The room owns its fight outright; nothing else holds a reference to it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Room {

    private String id;

    private String name;

    /** DM-facing description. */
    private String description;

    /** Outgoing connections keyed by target room id. */
    @Builder.Default
    private TreeMap<String, RoomConnection> connections = new TreeMap<>();

    /** Character ids that have discovered this room. */
    @Builder.Default
    private Set<String> discoveredBy = new LinkedHashSet<>();

    private Fight fight;

    @JsonIgnore
    public FightState getFightState() {
        return fight == null ? FightState.EMPTY : fight.getState();
    }

    public boolean isDiscoveredByAny(Set<String> characterIds) {
        return discoveredBy.stream().anyMatch(characterIds::contains);
    }

    public void connectTo(String targetRoomId, String description) {
        connections.put(targetRoomId, RoomConnection.builder()
                .targetRoomId(targetRoomId)
                .description(description)
                .build());
    }
}
