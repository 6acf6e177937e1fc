package com.acks.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Characters who have just discovered a room.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RevealRoomRequest {

    @NotEmpty
    private List<String> characterIds = new ArrayList<>();
}
