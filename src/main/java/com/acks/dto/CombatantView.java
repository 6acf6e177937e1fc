package com.acks.dto;

import com.acks.model.CombatantKind;
import com.acks.model.PreRoundDeclaration;
import com.acks.model.Side;
import com.acks.model.WoundCondition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A combatant as seen by one viewer. Stat fields are null where the viewer may not see them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CombatantView {
    private String id;
    private String name;
    private CombatantKind kind;
    private String characterId;
    private Side side;
    private int initiative;
    private Integer hitPoints;
    private Integer maxHitPoints;
    private Integer armorClass;
    private Integer morale;
    private boolean fled;
    private boolean surrendered;
    private boolean mortallyWounded;
    private boolean dead;
    private WoundCondition woundCondition;
    private PreRoundDeclaration declaration;
    private String declaredSpell;
    /** Whether the viewer may submit actions for this combatant. */
    private boolean controlled;
}
