package com.acks.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachEncounterRequest {

    @NotEmpty
    @Valid
    @Builder.Default
    private List<CombatantSpec> combatants = new ArrayList<>();

    @Min(0)
    private long treasureValue;

    /** Party credited with the fight's XP; may be left out and set by the DM later. */
    private String partyId;

    /** Queue player actions for DM approval instead of resolving them at once. */
    private boolean requireApproval;
}
