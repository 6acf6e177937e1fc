package com.acks.model;

public enum MortalWoundOutcome {
    DIES,
    MAIMED_BUT_STABLE,
    STABLE
}
