package com.acks.service;

import com.acks.model.CharacterCondition;
import com.acks.model.CharacterSheet;

/**
 * The only changes the campaign engine makes to a character record. Each mutation can produce
 * its own inverse against the record it is about to change, which is how a failed transaction
 * puts characters back.
 */
public sealed interface CharacterMutation {

    void applyTo(CharacterSheet sheet);

    /** The mutation that restores {@code before} after this one has been applied to it. */
    CharacterMutation inverseFor(CharacterSheet before);

    static CharacterMutation hitPoints(int currentHitPoints) {
        return new SetHitPoints(currentHitPoints);
    }

    static CharacterMutation condition(CharacterCondition condition) {
        return new SetCondition(condition);
    }

    static CharacterMutation addBankedXp(long amount) {
        return new AddBankedXp(amount);
    }

    record SetHitPoints(int currentHitPoints) implements CharacterMutation {
        @Override
        public void applyTo(CharacterSheet sheet) {
            sheet.setCurrentHitPoints(currentHitPoints);
        }

        @Override
        public CharacterMutation inverseFor(CharacterSheet before) {
            return new SetHitPoints(before.getCurrentHitPoints());
        }
    }

    record SetCondition(CharacterCondition condition) implements CharacterMutation {
        @Override
        public void applyTo(CharacterSheet sheet) {
            sheet.setCondition(condition);
        }

        @Override
        public CharacterMutation inverseFor(CharacterSheet before) {
            return new SetCondition(before.getCondition());
        }
    }

    /**
     * Credits banked XP. The amount is final; any prime-requisite bonus has already been applied.
     */
    record AddBankedXp(long amount) implements CharacterMutation {
        @Override
        public void applyTo(CharacterSheet sheet) {
            sheet.setBankedXp(sheet.getBankedXp() + amount);
        }

        @Override
        public CharacterMutation inverseFor(CharacterSheet before) {
            return new AddBankedXp(-amount);
        }
    }
}
