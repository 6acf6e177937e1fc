package com.acks.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class MoraleResult {

    public enum Outcome { STANDS, FLEES, SURRENDERS }

    private String combatantId;
    private int roll;
    /** Null for players; it gives away the morale score. */
    private Integer total;
    private Outcome outcome;
}
