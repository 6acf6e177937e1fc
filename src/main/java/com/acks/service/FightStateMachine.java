package com.acks.service;

import com.acks.exception.IllegalActionException;
import com.acks.exception.ValidationException;
import com.acks.model.ActionType;
import com.acks.model.CombatAction;
import com.acks.model.Combatant;
import com.acks.model.Fight;
import com.acks.model.FightRef;
import com.acks.model.FightState;
import com.acks.model.PreRoundDeclaration;
import com.acks.model.Room;
import com.acks.model.Side;
import com.acks.model.TurnPhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of the fight embedded in a room: forming, initiative, rounds and resolution.
 * Operates on the room or fight it is handed and never persists anything itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FightStateMachine {

    private static final String SYSTEM_ACTOR = "system";

    private final CombatResolutionEngine combatResolutionEngine;
    private final ExperienceCalculator experienceCalculator;

    /**
     * EMPTY to FORMING. A room holding a resolved fight must be cleared first.
     */
    public Fight attach(Room room, FightRef ref, List<Combatant> combatants, long treasureValue,
                        String partyId, boolean requireApproval) {
        if (room.getFight() != null) {
            throw new IllegalActionException("Room " + room.getId() + " already holds a "
                    + room.getFight().getState() + " fight; clear it first");
        }
        if (combatants == null || combatants.isEmpty()) {
            throw new ValidationException("An encounter needs at least one combatant");
        }
        if (treasureValue < 0) {
            throw new ValidationException("Treasure value cannot be negative");
        }
        Fight fight = Fight.builder()
                .id(ref.asId())
                .treasureValue(treasureValue)
                .partyId(partyId)
                .requireApproval(requireApproval)
                .build();
        addAll(fight, combatants);
        room.setFight(fight);
        fight.log(SYSTEM_ACTOR, "ATTACH", "Encounter attached with " + combatants.size() + " combatant(s)", true);
        log.info("Fight {} forming with {} combatants", fight.getId(), combatants.size());
        return fight;
    }

    public void addCombatants(Fight fight, List<Combatant> combatants) {
        requireState(fight, FightState.FORMING, "add combatants");
        if (combatants == null || combatants.isEmpty()) {
            throw new ValidationException("No combatants to add");
        }
        addAll(fight, combatants);
        fight.log(SYSTEM_ACTOR, "ADD_COMBATANTS", combatants.size() + " combatant(s) joined", true);
    }

    /**
     * FORMING back to EMPTY: the fight is dropped from the room.
     */
    public void cancel(Room room) {
        Fight fight = requireFight(room);
        requireState(fight, FightState.FORMING, "cancel");
        room.setFight(null);
        log.info("Fight {} cancelled before it started", fight.getId());
    }

    /**
     * FORMING to ACTIVE_INITIATIVE. Every combatant still in the fight needs a d6 in {@code rolls}.
     */
    public void start(Fight fight, Map<String, Integer> initiativeRolls) {
        requireState(fight, FightState.FORMING, "start");
        if (fight.eligibleOn(Side.PARTY).isEmpty() || fight.eligibleOn(Side.FOES).isEmpty()) {
            throw new ValidationException("A fight needs combatants on both sides to start");
        }
        combatResolutionEngine.rollInitiative(fight, initiativeRolls == null ? Map.of() : initiativeRolls);
        fight.setState(FightState.ACTIVE_INITIATIVE);
        fight.setCurrentTurn(-1);
        StringBuilder order = new StringBuilder("Initiative order:");
        for (Combatant c : fight.getCombatants()) {
            order.append(' ').append(c.getName()).append('(').append(c.getInitiative()).append(')');
        }
        fight.log(SYSTEM_ACTOR, "START", order.toString(), true);
        log.info("Fight {} started", fight.getId());
    }

    /**
     * ACTIVE_INITIATIVE to ACTIVE_ROUND: round 1, first eligible combatant to act.
     */
    public void beginRound(Fight fight) {
        requireState(fight, FightState.ACTIVE_INITIATIVE, "begin the first round");
        fight.setState(FightState.ACTIVE_ROUND);
        fight.setRound(1);
        fight.setCurrentTurn(-1);
        advanceTurn(fight);
        fight.log(SYSTEM_ACTOR, "BEGIN_ROUND", "Round 1 begins", true);
        checkTermination(fight);
    }

    /**
     * Bookkeeping once an action has resolved: end the fight if a side is out, otherwise move
     * the turn on when the action used it up or the current actor dropped out. A movement
     * either ends the turn or opens its attack half.
     */
    public void afterAction(Fight fight, CombatAction action) {
        if (checkTermination(fight) || fight.getState() != FightState.ACTIVE_ROUND) {
            return;
        }
        Optional<Combatant> current = fight.getCurrentActor();
        if (current.isEmpty()) {
            advanceTurn(fight);
            return;
        }
        Combatant actor = current.get();
        ActionType type = action.getType();
        if (actor.getId().equals(action.getActorId())) {
            if (type == ActionType.MOVE) {
                if (action.getMovement() != null && action.getMovement().isEndsTurn()) {
                    advanceTurn(fight);
                    return;
                }
                fight.setTurnPhase(TurnPhase.ATTACK);
            } else if (type.isConsumesTurn()) {
                fight.setTurnPhase(TurnPhase.ATTACK);
                boolean attack = type == ActionType.ATTACK || type == ActionType.SPECIAL_MANEUVER;
                if (attack) {
                    actor.setAttacksMade(actor.getAttacksMade() + 1);
                }
                if (!attack || actor.getAttacksMade() >= actor.getAttacksPerRound()) {
                    advanceTurn(fight);
                    return;
                }
            }
        }
        if (!actor.isEligible()) {
            advanceTurn(fight);
        }
    }

    /**
     * Bookkeeping after a DM edit outside the turn order: end the fight if a side is out, and
     * move the turn on if the current actor can no longer act.
     */
    public void settle(Fight fight) {
        if (checkTermination(fight) || fight.getState() != FightState.ACTIVE_ROUND) {
            return;
        }
        if (fight.getCurrentActor().map(c -> !c.isEligible()).orElse(true)) {
            advanceTurn(fight);
        }
    }

    /**
     * Move to the next combatant still in the fight, starting a new round on wrap-around.
     * The outgoing combatant's declaration is spent. Leaves no current turn when nobody is
     * eligible.
     */
    public void advanceTurn(Fight fight) {
        requireState(fight, FightState.ACTIVE_ROUND, "advance the turn");
        fight.getCurrentActor().ifPresent(c -> {
            c.setAttacksMade(0);
            c.setDeclaration(PreRoundDeclaration.NONE);
            c.setDeclaredSpell(null);
        });
        fight.setTurnPhase(TurnPhase.MOVEMENT);
        List<Combatant> combatants = fight.getCombatants();
        int index = fight.getCurrentTurn();
        for (int i = 0; i < combatants.size(); i++) {
            index++;
            if (index >= combatants.size()) {
                index = 0;
                fight.setRound(fight.getRound() + 1);
            }
            if (combatants.get(index).isEligible()) {
                fight.setCurrentTurn(index);
                return;
            }
        }
        fight.setCurrentTurn(-1);
    }

    /**
     * Resolve the fight when one side has nobody left standing.
     *
     * @return true if the fight is now resolved
     */
    public boolean checkTermination(Fight fight) {
        if (!fight.getState().isActive()) {
            return fight.getState() == FightState.RESOLVED;
        }
        boolean partyStanding = !fight.eligibleOn(Side.PARTY).isEmpty();
        boolean foesStanding = !fight.eligibleOn(Side.FOES).isEmpty();
        if (partyStanding && foesStanding) {
            return false;
        }
        Side winner = partyStanding ? Side.PARTY : foesStanding ? Side.FOES : null;
        resolve(fight, winner, false);
        return true;
    }

    /**
     * DM-forced end of an active fight.
     */
    public void forceResolve(Fight fight, Side winner) {
        if (!fight.getState().isActive()) {
            throw new IllegalActionException("Only an active fight can be resolved, this one is " + fight.getState());
        }
        resolve(fight, winner, true);
    }

    /**
     * RESOLVED to EMPTY, so the room can take a new encounter.
     */
    public void clear(Room room) {
        Fight fight = requireFight(room);
        requireState(fight, FightState.RESOLVED, "clear");
        room.setFight(null);
        log.info("Fight {} cleared from room {}", fight.getId(), room.getId());
    }

    private void resolve(Fight fight, Side winner, boolean forced) {
        fight.setState(FightState.RESOLVED);
        fight.setCurrentTurn(-1);
        fight.setWinningSide(winner);
        fight.setXpAwarded(experienceCalculator.fightXp(fight));
        String outcome = winner == null ? "Nobody is left standing" : winner + " wins";
        fight.log(SYSTEM_ACTOR, forced ? "FORCE_RESOLVE" : "RESOLVED",
                outcome + "; " + fight.getXpAwarded() + " XP earned", forced);
        log.info("Fight {} resolved after round {}: {}, {} XP", fight.getId(), fight.getRound(),
                outcome, fight.getXpAwarded());
    }

    private static void addAll(Fight fight, List<Combatant> combatants) {
        Set<String> ids = new HashSet<>();
        fight.getCombatants().forEach(c -> ids.add(c.getId()));
        for (Combatant combatant : combatants) {
            FightRef.requireValidId("combatant", combatant.getId());
            if (!ids.add(combatant.getId())) {
                throw new ValidationException("Duplicate combatant id: " + combatant.getId());
            }
            if (combatant.getSide() == null) {
                throw new ValidationException("Combatant " + combatant.getId() + " has no side");
            }
            if (combatant.getAttacksPerRound() < 1) {
                throw new ValidationException("Combatant " + combatant.getId() + " needs at least one attack per round");
            }
            combatant.damageDice();
        }
        fight.getCombatants().addAll(combatants);
    }

    private static Fight requireFight(Room room) {
        if (room.getFight() == null) {
            throw new IllegalActionException("Room " + room.getId() + " has no fight");
        }
        return room.getFight();
    }

    private static void requireState(Fight fight, FightState expected, String what) {
        if (fight.getState() != expected) {
            throw new IllegalActionException("Cannot " + what + " while the fight is " + fight.getState());
        }
    }
}
