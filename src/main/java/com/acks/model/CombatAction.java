package com.acks.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A combat action together with the dice values it is resolved with. Rolls are always supplied
 * by the caller so a resolution can be replayed, or overridden by the DM before it is committed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CombatAction {

    private ActionType type;

    private String actorId;

    private String targetId;

    /** Group morale checks; falls back to {@link #targetId} when empty. */
    @Builder.Default
    private List<String> targetIds = new ArrayList<>();

    private SavingThrowType saveType;

    private PreRoundDeclaration declaration;

    private MovementAction movement;

    private SpecialManeuver maneuver;

    /** Spell being declared, or cast when none was declared. */
    private String spellName;

    private String weaponName;

    /** Dice notation overriding the actor's default damage. */
    private String weaponDamage;

    private AttackType weaponAttackType;

    private int modifier;

    /** Exploding d20 total. */
    private Integer attackRoll;

    /** Raw damage dice total, before modifiers. */
    private Integer damageRoll;

    private Integer mortalWoundRoll;

    private Integer saveRoll;

    /** 2d6 total. */
    private Integer moraleRoll;
}
