package com.acks.dto;

import com.acks.model.SavingThrowType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class SavingThrowResult {
    private String combatantId;
    private SavingThrowType saveType;
    private int roll;
    private Integer total;
    private boolean passed;
}
