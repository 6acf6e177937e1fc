package com.acks.model;

/**
 * Situational modifiers to a mortal wounds roll, on top of those derived from the combatant.
 *
 * @param healingMagic       bonus from magical healing received
 * @param healingProficiency bonus from the healer's proficiency
 * @param horsetail          whether horsetail was applied (+2)
 * @param treatmentTiming    how soon treatment came, or null if the roll is made untreated
 * @param other              any DM-assigned modifier
 */
public record MortalWoundModifiers(int healingMagic, int healingProficiency, boolean horsetail,
                                   TreatmentTiming treatmentTiming, int other) {

    public static final MortalWoundModifiers NONE = new MortalWoundModifiers(0, 0, false, null, 0);

    public int total() {
        int total = healingMagic + healingProficiency + other;
        if (horsetail) {
            total += 2;
        }
        if (treatmentTiming != null) {
            total += treatmentTiming.getModifier();
        }
        return total;
    }
}
