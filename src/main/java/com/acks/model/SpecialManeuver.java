package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SpecialManeuver {
    DISARM("disarm"),
    FORCE_BACK("force back"),
    INCAPACITATE("incapacitate"),
    KNOCK_DOWN("knock down"),
    SUNDER("sunder"),
    WRESTLE("wrestle");

    private final String verb;
}
