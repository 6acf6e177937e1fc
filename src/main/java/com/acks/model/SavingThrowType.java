package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SavingThrowType {
    PETRIFICATION_PARALYSIS("Petrification & Paralysis"),
    POISON_DEATH("Poison & Death"),
    BLAST_BREATH("Blast & Breath"),
    STAFFS_WANDS("Staffs & Wands"),
    SPELLS("Spells");

    private final String displayName;
}
