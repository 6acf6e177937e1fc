package com.acks.dto;

import com.acks.model.FightState;
import com.acks.model.Side;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a committed fight mutation, returned to the caller and broadcast to the sessions
 * that can see the fight.
 */
@Data
@Builder(toBuilder = true)
public class ResolutionResult {
    private String fightId;
    private String action;
    private String actorId;
    private boolean dmOverride;

    /** True when the action was queued for DM approval instead of being resolved. */
    private boolean queued;
    private String pendingActionId;

    private AttackResult attack;
    @Builder.Default
    private List<MoraleResult> morale = new ArrayList<>();
    private SavingThrowResult savingThrow;
    private MortalWoundResult mortalWound;

    private String summary;

    /** The summary names DM-only detail and is withheld from players. */
    private boolean dmOnly;

    private FightState fightState;
    private int round;
    private String currentActorId;
    private Side winningSide;
    private long xpAwarded;

    /** Map revision the change was committed at. */
    private long revision;
}
