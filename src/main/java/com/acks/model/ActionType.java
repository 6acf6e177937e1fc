package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Combat actions a client can submit.
 */
@Getter
@RequiredArgsConstructor
public enum ActionType {
    ATTACK(true, true),
    SAVING_THROW(true, false),
    MORALE_CHECK(false, false),
    PASS(true, true),
    /** Commit to a withdrawal, retreat or spell before the turn comes up. */
    DECLARE(true, false),
    /** The movement half of a turn; the fight decides whether the attack half follows. */
    MOVE(true, false),
    SPECIAL_MANEUVER(true, true),
    CAST_SPELL(true, true);

    /** Whether a player may request this action for their own combatant. */
    private final boolean playerPermitted;

    /** Whether resolving the action uses up the actor's turn. */
    private final boolean consumesTurn;
}
