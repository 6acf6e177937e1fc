package com.acks.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One line of a fight's history. Player-requested and DM-forced resolutions are recorded the
 * same way, distinguished only by {@link #dmOverride}. Entries marked {@link #dmOnly} name
 * detail players never see, such as a foe's hit points.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FightLogEntry {
    private long sequence;
    private int round;
    private String actorId;
    private String action;
    private String summary;
    private boolean dmOverride;
    private boolean dmOnly;
    private Instant recordedAt;
}
