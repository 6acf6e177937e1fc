package com.acks.service;

import com.acks.exception.PersistenceFailureException;
import com.acks.model.DungeonMap;
import com.acks.model.Room;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON form of maps, also used to take deep copies so live state is never shared with callers.
 */
@Component
@RequiredArgsConstructor
public class MapCodec {

    private final ObjectMapper objectMapper;

    public String toJson(DungeonMap map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new PersistenceFailureException("Could not serialize map " + map.getId(), e);
        }
    }

    public DungeonMap fromJson(String json) {
        try {
            return objectMapper.readValue(json, DungeonMap.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceFailureException("Stored map is unreadable", e);
        }
    }

    public DungeonMap copy(DungeonMap map) {
        return objectMapper.convertValue(map, DungeonMap.class);
    }

    public Room copy(Room room) {
        return objectMapper.convertValue(room, Room.class);
    }
}
