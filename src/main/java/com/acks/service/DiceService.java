package com.acks.service;

import com.acks.model.CombatAction;
import com.acks.model.Combatant;
import com.acks.model.DamageDice;
import com.acks.model.Fight;
import com.acks.model.Weapon;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.HashMap;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Source of dice for requests that arrive without their own rolls. Rolls are drawn once, at the
 * edge, and written into the request; resolution itself never rolls.
 */
@Service
public class DiceService {

    private final RandomGenerator random;

    public DiceService() {
        this(new SecureRandom());
    }

    DiceService(RandomGenerator random) {
        this.random = random;
    }

    public int roll(int sides) {
        return random.nextInt(sides) + 1;
    }

    public int roll(DamageDice dice) {
        int total = 0;
        for (int i = 0; i < dice.count(); i++) {
            total += roll(dice.sides());
        }
        return total;
    }

    /** A d20 that rolls again and adds on a natural 20, up to the largest attack roll accepted. */
    public int explodingD20() {
        int total = 0;
        int roll;
        do {
            roll = roll(20);
            total += roll;
        } while (roll == 20 && total < CombatResolutionEngine.MAX_ROLL);
        return Math.min(total, CombatResolutionEngine.MAX_ROLL);
    }

    public int roll2d6() {
        return roll(6) + roll(6);
    }

    /**
     * Copy of {@code action} with every roll it could need filled in where the caller left it
     * empty. Rolls the caller supplied are kept as they are.
     */
    public CombatAction fillMissingRolls(Fight fight, CombatAction action) {
        CombatAction.CombatActionBuilder filled = action.toBuilder();
        if (action.getType() == null) {
            return action;
        }
        switch (action.getType()) {
            case ATTACK -> {
                if (action.getAttackRoll() == null) {
                    filled.attackRoll(explodingD20());
                }
                if (action.getDamageRoll() == null) {
                    DamageDice dice = fight.findCombatant(action.getActorId())
                            .map(actor -> Weapon.forAction(actor, action).dice())
                            .orElse(DamageDice.UNARMED);
                    filled.damageRoll(roll(dice));
                }
                if (action.getMortalWoundRoll() == null) {
                    filled.mortalWoundRoll(roll(20));
                }
            }
            case SAVING_THROW -> {
                if (action.getSaveRoll() == null) {
                    filled.saveRoll(roll(20));
                }
            }
            case MORALE_CHECK -> {
                if (action.getMoraleRoll() == null) {
                    filled.moraleRoll(roll2d6());
                }
            }
            case SPECIAL_MANEUVER -> {
                if (action.getAttackRoll() == null) {
                    filled.attackRoll(explodingD20());
                }
            }
            case PASS, DECLARE, MOVE, CAST_SPELL -> {
            }
        }
        return filled.build();
    }

    /** Initiative d6 for every combatant without one in {@code supplied}. */
    public Map<String, Integer> fillInitiative(Fight fight, Map<String, Integer> supplied) {
        Map<String, Integer> rolls = new HashMap<>(supplied == null ? Map.of() : supplied);
        for (Combatant combatant : fight.getCombatants()) {
            rolls.computeIfAbsent(combatant.getId(), id -> roll(6));
        }
        return rolls;
    }
}
