package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How soon after falling a character was treated, as a mortal wounds modifier.
 */
@Getter
@RequiredArgsConstructor
public enum TreatmentTiming {
    ONE_ROUND(2),
    ONE_TURN(-3),
    ONE_HOUR(-5),
    ONE_DAY(-8),
    OVER_ONE_DAY(-10);

    private final int modifier;
}
