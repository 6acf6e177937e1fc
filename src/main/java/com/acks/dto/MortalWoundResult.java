package com.acks.dto;

import com.acks.model.MortalWoundOutcome;
import com.acks.model.WoundCondition;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class MortalWoundResult {
    private String combatantId;
    /** Null when the combatant died without a roll. */
    private Integer roll;
    private Integer total;
    private WoundCondition condition;
    private MortalWoundOutcome outcome;
    private String description;
}
