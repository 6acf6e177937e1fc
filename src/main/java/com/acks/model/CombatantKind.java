package com.acks.model;

public enum CombatantKind {
    /** Backed by a record in the character sheet store. */
    CHARACTER,
    /** Instantiated from a monster or NPC template; lives only inside the fight. */
    NPC
}
