package com.acks.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Hit die size, which also sets the bonus a character gets on the mortal wounds table.
 */
@Getter
@RequiredArgsConstructor
public enum HitDie {
    D4(4, 0),
    D6(6, 2),
    D8(8, 4),
    D10(10, 6),
    D12(12, 8);

    private final int sides;
    private final int mortalWoundBonus;
}
