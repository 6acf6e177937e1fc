package com.acks.model;

import com.acks.exception.NotFoundException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A combat encounter, owned by exactly one {@link Room}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Fight {

    private String id;

    @Builder.Default
    private FightState state = FightState.FORMING;

    /** Starts at 0, becomes 1 when the first round begins, never decreases. */
    private int round;

    /** Index into {@link #combatants} of the combatant whose turn it is, or -1. */
    @Builder.Default
    private int currentTurn = -1;

    @Builder.Default
    private TurnPhase turnPhase = TurnPhase.MOVEMENT;

    /** Attach order while forming, initiative order once the fight has started. */
    @Builder.Default
    private List<Combatant> combatants = new ArrayList<>();

    @Builder.Default
    private List<PendingAction> pendingActions = new ArrayList<>();

    @Builder.Default
    private List<FightLogEntry> history = new ArrayList<>();

    private long treasureValue;

    private String partyId;

    private boolean requireApproval;

    private Side winningSide;

    private long xpAwarded;

    public Optional<Combatant> findCombatant(String combatantId) {
        return combatants.stream()
                .filter(c -> c.getId().equals(combatantId))
                .findFirst();
    }

    public Combatant requireCombatant(String combatantId) {
        return findCombatant(combatantId)
                .orElseThrow(() -> NotFoundException.of("Combatant", combatantId));
    }

    @JsonIgnore
    public Optional<Combatant> getCurrentActor() {
        if (currentTurn < 0 || currentTurn >= combatants.size()) {
            return Optional.empty();
        }
        return Optional.of(combatants.get(currentTurn));
    }

    public List<Combatant> eligibleOn(Side side) {
        return combatants.stream()
                .filter(c -> c.getSide() == side && c.isEligible())
                .toList();
    }

    public FightLogEntry log(String actorId, String action, String summary, boolean dmOverride) {
        return log(actorId, action, summary, dmOverride, false);
    }

    public FightLogEntry log(String actorId, String action, String summary, boolean dmOverride, boolean dmOnly) {
        FightLogEntry entry = FightLogEntry.builder()
                .sequence(history.size() + 1L)
                .round(round)
                .actorId(actorId)
                .action(action)
                .summary(summary)
                .dmOverride(dmOverride)
                .dmOnly(dmOnly)
                .recordedAt(Instant.now())
                .build();
        history.add(entry);
        return entry;
    }
}
