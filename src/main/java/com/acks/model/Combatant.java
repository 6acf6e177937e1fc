package com.acks.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One participant of a fight: a player character (by reference) or an NPC instantiated from a
 * template. Combatants are never removed from their fight; being out of the fight is expressed
 * by the status flags.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Combatant {

    private String id;

    private String name;

    private CombatantKind kind;

    /** Set when {@link #kind} is CHARACTER. */
    private String characterId;

    /** Set when {@link #kind} is NPC. */
    private String templateId;

    private Side side;

    private int hitPoints;

    private int maxHitPoints;

    private int armorClass;

    /** Attack throw bonus: d20 + attackThrow - AC must reach 20. */
    private int attackThrow;

    @Builder.Default
    private String damage = "1d2";

    @Builder.Default
    private AttackType attackType = AttackType.MELEE;

    @Builder.Default
    private int attacksPerRound = 1;

    private int attacksMade;

    private int initiativeModifier;

    private int initiative;

    private int morale;

    private long xpValue;

    @Builder.Default
    private HitDie hitDie = HitDie.D8;

    private int constitutionModifier;

    @Builder.Default
    private SavingThrows savingThrows = new SavingThrows();

    private boolean fled;

    private boolean surrendered;

    private boolean mortallyWounded;

    private boolean dead;

    private WoundCondition woundCondition;

    @Builder.Default
    private PreRoundDeclaration declaration = PreRoundDeclaration.NONE;

    private String declaredSpell;

    @JsonIgnore
    public boolean isOutOfFight() {
        return dead || fled || surrendered || mortallyWounded;
    }

    @JsonIgnore
    public boolean isEligible() {
        return !isOutOfFight();
    }

    /** HP at or below zero without a resolved mortal wound yet. */
    @JsonIgnore
    public boolean needsMortalWoundCheck() {
        return hitPoints <= 0 && !dead && !mortallyWounded;
    }

    @JsonIgnore
    public boolean isCharacter() {
        return kind == CombatantKind.CHARACTER;
    }

    /** A character, or anything fighting on the party's side; players see these statistics. */
    @JsonIgnore
    public boolean isPartyMember() {
        return isCharacter() || side == Side.PARTY;
    }

    @JsonIgnore
    public DamageDice damageDice() {
        return DamageDice.parse(damage);
    }
}
