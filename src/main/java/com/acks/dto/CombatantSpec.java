package com.acks.dto;

import com.acks.model.AttackType;
import com.acks.model.CombatantKind;
import com.acks.model.HitDie;
import com.acks.model.SavingThrows;
import com.acks.model.Side;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of an encounter: a player character by id, or an NPC stat block instantiated
 * {@link #count} times.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CombatantSpec {

    @NotNull
    private CombatantKind kind;

    /** Required for CHARACTER. */
    private String characterId;

    /** Required for NPC; also the stem of the generated combatant ids. */
    private String templateId;

    private String name;

    /** Defaults to PARTY for characters and FOES for NPCs. */
    private Side side;

    @Min(1)
    @Builder.Default
    private int count = 1;

    private int hitPoints;
    private int armorClass;
    private int attackThrow;
    private String damage;
    private AttackType attackType;
    @Builder.Default
    private int attacksPerRound = 1;
    private int initiativeModifier;
    private int morale;
    private long xpValue;
    private HitDie hitDie;
    private SavingThrows savingThrows;
}
