package com.acks.dto;

import com.acks.model.CombatAction;
import com.acks.model.MortalWoundModifiers;
import com.acks.model.Side;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A DM instruction for a fight. Which fields matter depends on {@link #kind}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DmOverrideRequest {

    public enum Kind {
        /** Resolve {@link #action} without turn or eligibility checks. */
        FORCE_ACTION,
        /** Add {@link #combatants} to a forming fight. */
        ADD_COMBATANTS,
        /** Roll initiative; {@link #initiativeRolls} may supply some or all of the d6s. */
        START,
        BEGIN_ROUND,
        ADVANCE_TURN,
        /** Set {@link #combatantId}'s hit points; {@link #mortalWoundRoll} is needed at 0 or below. */
        SET_HIT_POINTS,
        /** Set or clear {@link #status} on {@link #combatantId}. */
        SET_STATUS,
        /** End the fight with {@link #winningSide}. */
        FORCE_RESOLVE,
        /** Resolve the queued {@link #pendingActionId}, with {@link #action}'s rolls if given. */
        APPROVE_PENDING,
        DISMISS_PENDING,
        CANCEL,
        CLEAR
    }

    public enum Status { ACTIVE, FLED, SURRENDERED, MORTALLY_WOUNDED, DEAD }

    @NotNull
    private Kind kind;

    private CombatAction action;

    private String combatantId;

    private Integer hitPoints;

    private Integer mortalWoundRoll;

    private MortalWoundModifiers mortalWoundModifiers;

    private Status status;

    private Side winningSide;

    private String pendingActionId;

    @Builder.Default
    private Map<String, Integer> initiativeRolls = new HashMap<>();

    @Builder.Default
    private List<CombatantSpec> combatants = new ArrayList<>();
}
