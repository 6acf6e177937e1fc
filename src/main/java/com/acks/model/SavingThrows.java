package com.acks.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Saving throw bonuses in the "target 20" form: roll 1d20 + value, 20 or more succeeds.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SavingThrows {

    @Column(name = "save_petrification_paralysis")
    private int petrificationParalysis;

    @Column(name = "save_poison_death")
    private int poisonDeath;

    @Column(name = "save_blast_breath")
    private int blastBreath;

    @Column(name = "save_staffs_wands")
    private int staffsWands;

    @Column(name = "save_spells")
    private int spells;

    public int valueFor(SavingThrowType type) {
        return switch (type) {
            case PETRIFICATION_PARALYSIS -> petrificationParalysis;
            case POISON_DEATH -> poisonDeath;
            case BLAST_BREATH -> blastBreath;
            case STAFFS_WANDS -> staffsWands;
            case SPELLS -> spells;
        };
    }

    public SavingThrows copy() {
        return new SavingThrows(petrificationParalysis, poisonDeath, blastBreath, staffsWands, spells);
    }
}
