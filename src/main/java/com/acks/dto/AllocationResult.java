package com.acks.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class AllocationResult {
    private String partyId;
    /** Total taken from the pending pool. */
    private long distributed;
    private long remainingPendingXp;
    /** XP actually banked per character, prime-requisite bonus included. */
    private Map<String, Long> credited;
}
