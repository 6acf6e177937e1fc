package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Rows of the mortal wounds table, best to worst.
 */
@Getter
@RequiredArgsConstructor
public enum WoundCondition {
    DAZED(MortalWoundOutcome.STABLE,
            "Just dazed. Recovers immediately with 1 hp; no bed rest needed."),
    KNOCKED_OUT(MortalWoundOutcome.STABLE,
            "Knocked out. Recovers with 1 hp; needs magical healing or one night of bed rest."),
    IN_SHOCK(MortalWoundOutcome.STABLE,
            "In shock. Recovers with 1 hp; needs magical healing and a night of rest, or a week of bed rest."),
    CRITICALLY_WOUNDED(MortalWoundOutcome.MAIMED_BUT_STABLE,
            "Critically wounded. Dies unless healed to 1 hp within a day; then a week of bed rest."),
    GRIEVOUSLY_WOUNDED(MortalWoundOutcome.MAIMED_BUT_STABLE,
            "Grievously wounded. Dies unless healed to 1 hp within a turn; then two weeks of bed rest."),
    MORTALLY_WOUNDED(MortalWoundOutcome.MAIMED_BUT_STABLE,
            "Mortally wounded. Dies unless healed to 1 hp within a round; then a month of bed rest."),
    INSTANT_DEATH(MortalWoundOutcome.DIES, "Instantly killed.");

    private final MortalWoundOutcome outcome;
    private final String description;

    public static WoundCondition fromTotal(int total) {
        if (total >= 26) return DAZED;
        if (total >= 21) return KNOCKED_OUT;
        if (total >= 16) return IN_SHOCK;
        if (total >= 11) return CRITICALLY_WOUNDED;
        if (total >= 6) return GRIEVOUSLY_WOUNDED;
        if (total >= 1) return MORTALLY_WOUNDED;
        return INSTANT_DEATH;
    }
}
