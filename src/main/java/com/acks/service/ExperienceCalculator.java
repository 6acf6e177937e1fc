package com.acks.service;

import com.acks.model.Combatant;
import com.acks.model.Fight;
import com.acks.model.Side;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * XP earned by a fight: the value of every defeated foe plus the treasure taken, one XP per gold
 * piece. Depends on nothing but its arguments.
 */
@Component
public class ExperienceCalculator {

    public long fightXp(List<Combatant> defeated, long treasureValue) {
        long total = Math.max(0, treasureValue);
        for (Combatant combatant : defeated) {
            total += Math.max(0, combatant.getXpValue());
        }
        return total;
    }

    /** Foes that are out of the fight by any means: killed, mortally wounded, fled or surrendered. */
    public List<Combatant> defeatedFoes(Fight fight) {
        return fight.getCombatants().stream()
                .filter(c -> c.getSide() == Side.FOES && c.isOutOfFight())
                .toList();
    }

    public long fightXp(Fight fight) {
        return fightXp(defeatedFoes(fight), fight.getTreasureValue());
    }
}
