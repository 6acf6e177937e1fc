package com.acks.model;

/**
 * Lifecycle of the fight embedded in a room. Transitions only move forward, except that a
 * forming fight may be cancelled back to {@link #EMPTY}.
 */
public enum FightState {
    EMPTY,
    FORMING,
    ACTIVE_INITIATIVE,
    ACTIVE_ROUND,
    RESOLVED;

    public boolean isActive() {
        return this == ACTIVE_INITIATIVE || this == ACTIVE_ROUND;
    }
}
