package com.acks.dto;

import com.acks.model.SpecialManeuver;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one attack: the throw, whether it hit, and the damage dealt.
 */
@Data
@Builder(toBuilder = true)
public class AttackResult {
    private String attackerId;
    private String targetId;
    private String weaponName;
    /** Set for a special maneuver, which deals no damage; {@link #hit} then means it worked. */
    private SpecialManeuver maneuver;
    private int attackRoll;
    /** Null for viewers who may not see the target's armour class. */
    private Integer total;
    private boolean hit;
    private boolean criticalHit;
    private boolean criticalMiss;
    private int damage;
    /** Null for viewers who may not see the target's hit points. */
    private Integer targetHitPoints;
    private MortalWoundResult mortalWound;
}
