package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What a combatant commits to before its turn comes up. A declaration lasts until the end of
 * the declarer's next turn.
 */
@Getter
@RequiredArgsConstructor
public enum PreRoundDeclaration {
    NONE("nothing"),
    FIGHTING_WITHDRAWAL("a fighting withdrawal"),
    FULL_RETREAT("a full retreat"),
    CAST_SPELL("a spell");

    private final String displayName;

    /** Declarations that rule out attacking this turn. */
    public boolean isWithdrawing() {
        return this == FIGHTING_WITHDRAWAL || this == FULL_RETREAT;
    }
}
