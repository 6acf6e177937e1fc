package com.acks.dto;

import com.acks.model.FightState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomView {
    private String id;
    private String name;
    /** Null for players. */
    private String description;
    @Builder.Default
    private List<ConnectionView> connections = new ArrayList<>();
    /** Null for players. */
    private List<String> discoveredBy;
    private FightState fightState;
    private FightView fight;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionView {
        private String targetRoomId;
        private String description;
        private boolean oneWay;
        private boolean passable;
        private boolean locked;
        /** Only shown to the DM. */
        private String trap;
    }
}
