package com.acks.model;

/**
 * The half of the current combatant's turn in progress.
 */
public enum TurnPhase {
    MOVEMENT,
    ATTACK
}
