package com.acks.model;

/**
 * Which side of a fight a combatant is on. FOES are run by the DM.
 */
public enum Side {
    PARTY,
    FOES;

    public Side opposite() {
        return this == PARTY ? FOES : PARTY;
    }
}
