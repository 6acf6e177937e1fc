package com.acks.model;

public enum CharacterCondition {
    HEALTHY,
    MORTALLY_WOUNDED,
    DEAD
}
