package com.acks.model;

public enum AttackType {
    MELEE,
    MISSILE
}
