package com.acks.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Change notification for one session. {@link #sinceRevision} is the last revision the session
 * acknowledged; a client that holds a different revision has missed something and should ask
 * for a snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateDelta {
    private String mapId;
    private long revision;
    private long sinceRevision;
    @Builder.Default
    private List<RoomView> rooms = new ArrayList<>();
    @Builder.Default
    private List<String> removedRoomIds = new ArrayList<>();
    private ResolutionResult result;
}
