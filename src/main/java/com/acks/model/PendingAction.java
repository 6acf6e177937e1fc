package com.acks.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A player action waiting for the DM's approval in a fight that requires it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingAction {
    private String id;
    private String submittedBy;
    private CombatAction action;
    private Instant submittedAt;
}
