package com.acks.service;

import com.acks.dto.AttackResult;
import com.acks.dto.MoraleResult;
import com.acks.dto.MortalWoundResult;
import com.acks.dto.ResolutionResult;
import com.acks.dto.SavingThrowResult;
import com.acks.exception.IllegalActionException;
import com.acks.exception.ValidationException;
import com.acks.model.CombatAction;
import com.acks.model.Combatant;
import com.acks.model.Fight;
import com.acks.model.MortalWoundModifiers;
import com.acks.model.MortalWoundOutcome;
import com.acks.model.MovementAction;
import com.acks.model.PreRoundDeclaration;
import com.acks.model.SavingThrowType;
import com.acks.model.Side;
import com.acks.model.Weapon;
import com.acks.model.WoundCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Applies the combat rules to a fight. Every roll comes in with the request; nothing here draws
 * random numbers, so the same inputs always give the same outcome.
 *
 * <p>Methods mutate the combatants they are given. Callers pass working copies and only commit
 * them once the whole action has resolved.
 */
@Service
@Slf4j
public class CombatResolutionEngine {

    static final int HIT_THRESHOLD = 20;
    static final int CRITICAL_THRESHOLD = 30;
    static final int SAVE_TARGET = 20;
    static final int MANEUVER_PENALTY = 4;
    /** Upper bound for any supplied attack or damage roll and for the size of a modifier. */
    static final int MAX_ROLL = 1000;

    @Value("${campaign.combat.monsters-die-at-zero-hp:true}")
    private boolean monstersDieAtZeroHp = true;

    /**
     * Resolve one action and record it in the fight's history.
     *
     * @param dmOverride skips the fight-state and eligibility checks; roll ranges for damage are
     *                   not enforced either, so the DM can force a result
     */
    public ResolutionResult resolve(Fight fight, CombatAction action, boolean dmOverride) {
        if (action == null || action.getType() == null) {
            throw new ValidationException("Action type is required");
        }
        if (action.getActorId() == null) {
            throw new ValidationException("Actor is required");
        }
        if (!dmOverride && !fight.getState().isActive()) {
            throw new IllegalActionException("Fight " + fight.getId() + " is " + fight.getState() + ", not active");
        }
        Combatant actor = fight.requireCombatant(action.getActorId());
        if (!dmOverride && !actor.isEligible()) {
            throw new IllegalActionException(actor.getName() + " is out of the fight");
        }

        ResolutionResult.ResolutionResultBuilder result = ResolutionResult.builder()
                .fightId(fight.getId())
                .action(action.getType().name())
                .actorId(actor.getId())
                .dmOverride(dmOverride);

        boolean dmOnly = false;
        String summary = switch (action.getType()) {
            case ATTACK -> {
                requireNotWithdrawing(actor, dmOverride);
                Combatant target = fight.requireCombatant(requireTarget(action));
                AttackResult attack = resolveAttack(actor, target, Weapon.forAction(actor, action), action, dmOverride);
                result.attack(attack);
                yield describe(actor, target, attack);
            }
            case SAVING_THROW -> {
                Combatant subject = action.getTargetId() != null
                        ? fight.requireCombatant(action.getTargetId())
                        : actor;
                if (action.getSaveType() == null) {
                    throw new ValidationException("Saving throw type is required");
                }
                SavingThrowResult save = resolveSavingThrow(subject, action.getSaveType(),
                        requireRoll(action.getSaveRoll(), "saveRoll", 1, 20), action.getModifier());
                result.savingThrow(save);
                yield subject.getName() + (save.isPassed() ? " saved" : " failed") + " vs "
                        + action.getSaveType().getDisplayName();
            }
            case MORALE_CHECK -> {
                List<Combatant> group = moraleGroup(fight, actor, action);
                List<MoraleResult> morale = resolveMoraleCheck(group,
                        requireRoll(action.getMoraleRoll(), "moraleRoll", 2, 12), action.getModifier());
                result.morale(morale);
                yield describeMorale(fight, morale);
            }
            case PASS -> actor.getName() + " passed";
            case DECLARE -> {
                dmOnly = !actor.isPartyMember();
                yield declare(actor, action);
            }
            case MOVE -> move(actor, action, dmOverride);
            case SPECIAL_MANEUVER -> {
                requireNotWithdrawing(actor, dmOverride);
                Combatant target = fight.requireCombatant(requireTarget(action));
                AttackResult maneuver = resolveManeuver(actor, target, action, dmOverride);
                result.attack(maneuver);
                yield actor.getName() + " tries to " + maneuver.getManeuver().getVerb() + " " + target.getName()
                        + (maneuver.isHit() ? " and succeeds" : " and fails");
            }
            case CAST_SPELL -> castSpell(actor, action, dmOverride);
        };

        fight.log(actor.getId(), action.getType().name(), summary, dmOverride, dmOnly);
        log.debug("Fight {}: {}", fight.getId(), summary);
        return result.summary(summary).dmOnly(dmOnly).build();
    }

    public AttackResult resolveAttack(Combatant attacker, Combatant target, Weapon weapon,
                                      CombatAction rolls, boolean dmOverride) {
        if (!dmOverride) {
            if (target.isOutOfFight()) {
                throw new IllegalActionException(target.getName() + " is out of the fight");
            }
            if (attacker.getId().equals(target.getId())) {
                throw new IllegalActionException("A combatant cannot attack itself");
            }
        }
        int attackRoll = requireRoll(rolls.getAttackRoll(), "attackRoll", 1, MAX_ROLL);
        requireRoll(rolls.getModifier(), "modifier", -MAX_ROLL, MAX_ROLL);
        AttackResult.AttackResultBuilder result = AttackResult.builder()
                .attackerId(attacker.getId())
                .targetId(target.getId())
                .weaponName(weapon.name())
                .attackRoll(attackRoll);

        if (attackRoll <= 1) {
            return result.criticalMiss(true).targetHitPoints(target.getHitPoints()).build();
        }

        int total = attackRoll + attacker.getAttackThrow() + rolls.getModifier() - target.getArmorClass();
        result.total(total);
        if (total < HIT_THRESHOLD) {
            return result.targetHitPoints(target.getHitPoints()).build();
        }

        boolean critical = total >= CRITICAL_THRESHOLD;
        int raw = requireRoll(rolls.getDamageRoll(), "damageRoll", -MAX_ROLL, MAX_ROLL);
        if (!dmOverride && !weapon.dice().accepts(raw)) {
            throw new ValidationException("Damage roll " + raw + " is outside the range of "
                    + weapon.dice().toNotation());
        }
        int damage = Math.max(1, (critical ? raw * 2 : raw) + weapon.dice().modifier());
        target.setHitPoints(target.getHitPoints() - damage);
        result.hit(true).criticalHit(critical).damage(damage).targetHitPoints(target.getHitPoints());

        if (target.needsMortalWoundCheck()) {
            result.mortalWound(resolveMortalWound(target, rolls.getMortalWoundRoll(), MortalWoundModifiers.NONE));
        }
        return result.build();
    }

    /**
     * An attack throw at a penalty that deals no damage. Whether it worked is reported as a hit;
     * what a success does to the target is for the DM to apply.
     */
    public AttackResult resolveManeuver(Combatant attacker, Combatant target, CombatAction rolls, boolean dmOverride) {
        if (rolls.getManeuver() == null) {
            throw new ValidationException("Special maneuver is required");
        }
        if (!dmOverride) {
            if (target.isOutOfFight()) {
                throw new IllegalActionException(target.getName() + " is out of the fight");
            }
            if (attacker.getId().equals(target.getId())) {
                throw new IllegalActionException("A combatant cannot " + rolls.getManeuver().getVerb() + " itself");
            }
        }
        int attackRoll = requireRoll(rolls.getAttackRoll(), "attackRoll", 1, MAX_ROLL);
        requireRoll(rolls.getModifier(), "modifier", -MAX_ROLL, MAX_ROLL);
        AttackResult.AttackResultBuilder result = AttackResult.builder()
                .attackerId(attacker.getId())
                .targetId(target.getId())
                .maneuver(rolls.getManeuver())
                .attackRoll(attackRoll)
                .targetHitPoints(target.getHitPoints());
        if (attackRoll <= 1) {
            return result.criticalMiss(true).build();
        }
        int total = attackRoll + attacker.getAttackThrow() + rolls.getModifier() - target.getArmorClass()
                - MANEUVER_PENALTY;
        return result.total(total).hit(total >= HIT_THRESHOLD).build();
    }

    private static String declare(Combatant actor, CombatAction action) {
        PreRoundDeclaration declaration = action.getDeclaration();
        if (declaration == null) {
            throw new ValidationException("Declaration is required");
        }
        String spell = null;
        if (declaration == PreRoundDeclaration.CAST_SPELL) {
            if (action.getSpellName() == null || action.getSpellName().isBlank()) {
                throw new ValidationException("A spell declaration needs the spell's name");
            }
            spell = action.getSpellName();
        }
        actor.setDeclaration(declaration);
        actor.setDeclaredSpell(spell);
        if (declaration == PreRoundDeclaration.NONE) {
            return actor.getName() + " withdraws their declaration";
        }
        return actor.getName() + " declares " + (spell != null ? spell : declaration.getDisplayName());
    }

    private static String move(Combatant actor, CombatAction action, boolean dmOverride) {
        MovementAction movement = action.getMovement();
        if (movement == null) {
            throw new ValidationException("Movement is required");
        }
        PreRoundDeclaration required = movement.getRequiredDeclaration();
        if (!dmOverride && required != null && actor.getDeclaration() != required) {
            throw new IllegalActionException(actor.getName() + " did not declare " + required.getDisplayName());
        }
        if (movement == MovementAction.FULL_RETREAT) {
            actor.setFled(true);
        }
        return actor.getName() + " " + movement.getVerb();
    }

    private static String castSpell(Combatant actor, CombatAction action, boolean dmOverride) {
        if (!dmOverride && actor.getDeclaration() != PreRoundDeclaration.CAST_SPELL) {
            throw new IllegalActionException(actor.getName() + " did not declare a spell");
        }
        String spell = actor.getDeclaration() == PreRoundDeclaration.CAST_SPELL
                ? actor.getDeclaredSpell()
                : action.getSpellName();
        if (spell == null || spell.isBlank()) {
            throw new ValidationException("Spell name is required");
        }
        return actor.getName() + " casts " + spell;
    }

    private static void requireNotWithdrawing(Combatant actor, boolean dmOverride) {
        if (!dmOverride && actor.getDeclaration().isWithdrawing()) {
            throw new IllegalActionException(actor.getName() + " declared "
                    + actor.getDeclaration().getDisplayName() + " and cannot attack");
        }
    }

    /**
     * Settle what happens to a combatant at or below zero hit points.
     *
     * @param roll the d20; may be null only for an NPC that dies outright
     */
    public MortalWoundResult resolveMortalWound(Combatant combatant, Integer roll, MortalWoundModifiers modifiers) {
        if (!combatant.isCharacter() && monstersDieAtZeroHp) {
            combatant.setDead(true);
            combatant.setWoundCondition(WoundCondition.INSTANT_DEATH);
            return MortalWoundResult.builder()
                    .combatantId(combatant.getId())
                    .condition(WoundCondition.INSTANT_DEATH)
                    .outcome(MortalWoundOutcome.DIES)
                    .description(combatant.getName() + " is slain.")
                    .build();
        }

        int d20 = requireRoll(roll, "mortalWoundRoll", 1, 20);
        int total = d20
                + combatant.getConstitutionModifier()
                + combatant.getHitDie().getMortalWoundBonus()
                + hitPointRatioBonus(combatant.getHitPoints(), combatant.getMaxHitPoints())
                + modifiers.total();
        WoundCondition condition = WoundCondition.fromTotal(total);
        combatant.setWoundCondition(condition);
        if (condition.getOutcome() == MortalWoundOutcome.DIES) {
            combatant.setDead(true);
        } else {
            combatant.setMortallyWounded(true);
        }
        return MortalWoundResult.builder()
                .combatantId(combatant.getId())
                .roll(d20)
                .total(total)
                .condition(condition)
                .outcome(condition.getOutcome())
                .description(condition.getDescription())
                .build();
    }

    /**
     * One shared roll for the whole group. Combatants already out of the fight are skipped.
     */
    public List<MoraleResult> resolveMoraleCheck(List<Combatant> group, int roll, int modifier) {
        requireRoll(roll, "moraleRoll", 2, 12);
        List<MoraleResult> results = new ArrayList<>();
        for (Combatant combatant : group) {
            if (combatant.isOutOfFight()) {
                continue;
            }
            int total = roll + combatant.getMorale() + modifier;
            MoraleResult.Outcome outcome;
            if (total <= 2) {
                outcome = MoraleResult.Outcome.SURRENDERS;
                combatant.setSurrendered(true);
            } else if (total <= 5) {
                outcome = MoraleResult.Outcome.FLEES;
                combatant.setFled(true);
            } else {
                outcome = MoraleResult.Outcome.STANDS;
            }
            results.add(MoraleResult.builder()
                    .combatantId(combatant.getId())
                    .roll(roll)
                    .total(total)
                    .outcome(outcome)
                    .build());
        }
        return results;
    }

    public SavingThrowResult resolveSavingThrow(Combatant combatant, SavingThrowType type, int roll, int modifier) {
        requireRoll(roll, "saveRoll", 1, 20);
        int total = roll + combatant.getSavingThrows().valueFor(type) + modifier;
        return SavingThrowResult.builder()
                .combatantId(combatant.getId())
                .saveType(type)
                .roll(roll)
                .total(total)
                .passed(roll >= SAVE_TARGET || total >= SAVE_TARGET)
                .build();
    }

    /**
     * Set every combatant's initiative from its d6 and reorder the fight: highest first, FOES
     * before PARTY on a tie, then attach order.
     */
    public void rollInitiative(Fight fight, Map<String, Integer> rolls) {
        for (Combatant combatant : fight.getCombatants()) {
            Integer roll = rolls.get(combatant.getId());
            if (roll == null && combatant.isOutOfFight()) {
                combatant.setInitiative(0);
                continue;
            }
            int d6 = requireRoll(roll, "initiative roll for " + combatant.getId(), 1, 6);
            combatant.setInitiative(d6 + combatant.getInitiativeModifier());
            combatant.setAttacksMade(0);
        }
        List<Combatant> ordered = new ArrayList<>(fight.getCombatants());
        ordered.sort(Comparator.comparingInt(Combatant::getInitiative).reversed()
                .thenComparingInt(c -> c.getSide() == Side.FOES ? 0 : 1));
        fight.setCombatants(ordered);
    }

    static int hitPointRatioBonus(int hitPoints, int maxHitPoints) {
        double ratio = (double) hitPoints / Math.max(1, maxHitPoints);
        if (ratio >= -0.25) return 5;
        if (ratio >= -0.5) return -2;
        if (ratio >= -1.0) return -5;
        if (ratio >= -2.0) return -10;
        return -20;
    }

    private static List<Combatant> moraleGroup(Fight fight, Combatant actor, CombatAction action) {
        if (action.getTargetIds() != null && !action.getTargetIds().isEmpty()) {
            return action.getTargetIds().stream().map(fight::requireCombatant).toList();
        }
        if (action.getTargetId() != null) {
            return List.of(fight.requireCombatant(action.getTargetId()));
        }
        return List.of(actor);
    }

    private static String requireTarget(CombatAction action) {
        if (action.getTargetId() == null) {
            throw new ValidationException("Attack target is required");
        }
        return action.getTargetId();
    }

    private static int requireRoll(Integer roll, String name, int min, int max) {
        if (roll == null) {
            throw new ValidationException("Missing " + name);
        }
        if (roll < min || roll > max) {
            throw new ValidationException(name + " " + roll + " is out of range");
        }
        return roll;
    }

    private static String describe(Combatant attacker, Combatant target, AttackResult attack) {
        if (attack.isCriticalMiss()) {
            return attacker.getName() + " critically missed " + target.getName();
        }
        if (!attack.isHit()) {
            return attacker.getName() + " missed " + target.getName();
        }
        StringBuilder text = new StringBuilder(attacker.getName())
                .append(attack.isCriticalHit() ? " critically hit " : " hit ")
                .append(target.getName())
                .append(" for ").append(attack.getDamage()).append(" damage");
        if (attack.getMortalWound() != null) {
            text.append("; ").append(attack.getMortalWound().getDescription());
        }
        return text.toString();
    }

    private static String describeMorale(Fight fight, List<MoraleResult> morale) {
        if (morale.isEmpty()) {
            return "Morale check had no effect";
        }
        List<String> parts = new ArrayList<>();
        for (MoraleResult m : morale) {
            parts.add(fight.requireCombatant(m.getCombatantId()).getName() + " "
                    + m.getOutcome().name().toLowerCase());
        }
        return "Morale: " + String.join(", ", parts);
    }
}
