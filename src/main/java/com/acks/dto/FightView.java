package com.acks.dto;

import com.acks.model.FightLogEntry;
import com.acks.model.FightState;
import com.acks.model.PendingAction;
import com.acks.model.Side;
import com.acks.model.TurnPhase;
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
public class FightView {
    private String id;
    private FightState state;
    private int round;
    private String currentActorId;
    private TurnPhase turnPhase;
    private boolean requireApproval;
    @Builder.Default
    private List<CombatantView> combatants = new ArrayList<>();
    /** Everything for the DM, a player's own requests for a player. */
    @Builder.Default
    private List<PendingAction> pendingActions = new ArrayList<>();
    @Builder.Default
    private List<FightLogEntry> history = new ArrayList<>();
    private String partyId;
    /** Null for players. */
    private Long treasureValue;
    private Side winningSide;
    private long xpAwarded;
}
