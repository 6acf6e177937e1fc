package com.acks.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A map as one viewer is allowed to see it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapView {
    private String id;
    private String name;
    private String summary;
    private long revision;
    @Builder.Default
    private List<RoomView> rooms = new ArrayList<>();
}
