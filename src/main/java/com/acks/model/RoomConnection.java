package com.acks.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A door, passage or stair leading from one room to another.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoomConnection {

    private String targetRoomId;

    private String description;

    @Builder.Default
    private boolean oneWay = false;

    @Builder.Default
    private boolean passable = true;

    @Builder.Default
    private boolean locked = false;

    private RoomTrap trap;
}
