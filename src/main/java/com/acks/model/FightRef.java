package com.acks.model;

import com.acks.exception.ValidationException;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identity of a fight. The id names the map and room the fight is embedded in, so a fight
 * can always be located without a separate index and can never belong to two rooms.
 */
public record FightRef(String mapId, String roomId, String token) {

    public static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String SEPARATOR = ":";

    public FightRef {
        requireValidId("map", mapId);
        requireValidId("room", roomId);
        requireValidId("fight token", token);
    }

    public static FightRef newFight(String mapId, String roomId) {
        return new FightRef(mapId, roomId, UUID.randomUUID().toString().substring(0, 8));
    }

    public static FightRef parse(String fightId) {
        if (fightId == null) {
            throw new ValidationException("Fight id is required");
        }
        String[] parts = fightId.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new ValidationException("Malformed fight id: " + fightId);
        }
        return new FightRef(parts[0], parts[1], parts[2]);
    }

    public static void requireValidId(String what, String id) {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new ValidationException("Invalid " + what + " id: " + id);
        }
    }

    /** Key of the exclusion scope shared by every mutation of this fight's room. */
    public String roomKey() {
        return mapId + SEPARATOR + roomId;
    }

    public String asId() {
        return mapId + SEPARATOR + roomId + SEPARATOR + token;
    }

    @Override
    public String toString() {
        return asId();
    }
}
