package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The movement half of a turn. Some movements use up the whole turn; the others leave the
 * combatant its attack half.
 */
@Getter
@RequiredArgsConstructor
public enum MovementAction {
    NONE("holds position", false, null),
    MOVE("moves", false, null),
    RUN("runs", true, null),
    CHARGE("charges", false, null),
    FIGHTING_WITHDRAWAL("makes a fighting withdrawal", true, PreRoundDeclaration.FIGHTING_WITHDRAWAL),
    FULL_RETREAT("makes a full retreat and leaves the fight", true, PreRoundDeclaration.FULL_RETREAT),
    SIMPLE_ACTION("performs a simple action", false, null);

    private final String verb;

    private final boolean endsTurn;

    /** Declaration the mover must have made first, or null. */
    private final PreRoundDeclaration requiredDeclaration;
}
