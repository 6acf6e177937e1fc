package com.acks.service;

import com.acks.dto.AttachEncounterRequest;
import com.acks.dto.CombatantSpec;
import com.acks.dto.DmOverrideRequest;
import com.acks.dto.MortalWoundResult;
import com.acks.dto.ResolutionResult;
import com.acks.exception.CampaignException;
import com.acks.exception.IllegalActionException;
import com.acks.exception.NotFoundException;
import com.acks.exception.PersistenceFailureException;
import com.acks.exception.ValidationException;
import com.acks.model.ActionType;
import com.acks.model.AttackType;
import com.acks.model.CharacterCondition;
import com.acks.model.CharacterSheet;
import com.acks.model.CombatAction;
import com.acks.model.Combatant;
import com.acks.model.CombatantKind;
import com.acks.model.DamageDice;
import com.acks.model.Fight;
import com.acks.model.FightLogEntry;
import com.acks.model.FightRef;
import com.acks.model.FightState;
import com.acks.model.HitDie;
import com.acks.model.MortalWoundModifiers;
import com.acks.model.Party;
import com.acks.model.PendingAction;
import com.acks.model.Room;
import com.acks.model.SavingThrows;
import com.acks.model.TurnPhase;
import com.acks.model.Side;
import com.acks.model.ViewerRole;
import com.acks.service.RoomGraphStore.RoomCheckout;
import com.acks.websocket.StateBroadcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Entry point for everything that changes a fight.
 *
 * <p>Each call is one transaction on the fight's room, run under that room's lock: check out a
 * working copy, validate and resolve against it, write changed characters and party XP through,
 * commit the room, then broadcast. A failure at any step before the commit leaves the live room
 * untouched; a failure during the commit undoes the character and party writes already made.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FightService {

    private final RoomGraphStore roomGraphStore;
    private final FightStateMachine fightStateMachine;
    private final CombatResolutionEngine combatResolutionEngine;
    private final DiceService diceService;
    private final CharacterSheetStore characterSheetStore;
    private final PartyLedgerService partyLedgerService;
    private final StateBroadcaster stateBroadcaster;

    private final ConcurrentHashMap<String, ReentrantLock> roomLocks = new ConcurrentHashMap<>();

    /**
     * Attach a new encounter to a room.
     *
     * @return the new fight's id
     */
    public String attachEncounter(String mapId, String roomId, AttachEncounterRequest request) {
        FightRef ref = FightRef.newFight(mapId, roomId);
        if (request.getPartyId() != null) {
            partyLedgerService.getParty(request.getPartyId());
        }
        transact(ref, room -> {
            List<Combatant> combatants = buildCombatants(request.getCombatants(), Set.of());
            fightStateMachine.attach(room, ref, combatants, request.getTreasureValue(),
                    request.getPartyId(), request.isRequireApproval());
            combatants.stream()
                    .filter(Combatant::isCharacter)
                    .forEach(c -> room.getDiscoveredBy().add(c.getCharacterId()));
            return ResolutionResult.builder()
                    .action("ATTACH")
                    .dmOverride(true)
                    .summary("Encounter attached with " + combatants.size() + " combatant(s)")
                    .build();
        });
        return ref.asId();
    }

    /**
     * A copy of the fight as it is now.
     */
    public Fight getFight(String fightId) {
        FightRef ref = FightRef.parse(fightId);
        return requireFight(roomGraphStore.getRoom(ref.mapId(), ref.roomId()), ref);
    }

    /**
     * Submit a combat action. It must be legal right now: the fight is in a round, it is the
     * actor's turn and the actor is still in the fight. Players may only act for combatants
     * they control, and any dice or modifier a player sends are discarded in favour of the
     * server's. Only the DM may {@code force} an action, which skips every legality check.
     */
    public ResolutionResult submitAction(String fightId, ViewerRole role, CombatAction action, boolean force) {
        if (force) {
            return dmOverride(fightId, role, DmOverrideRequest.builder()
                    .kind(DmOverrideRequest.Kind.FORCE_ACTION)
                    .action(action)
                    .build());
        }
        FightRef ref = FightRef.parse(fightId);
        return transact(ref, room -> {
            Fight fight = requireFight(room, ref);
            validateAction(fight, role, action);
            CombatAction requested = role.isDm() ? action : withoutRolls(action);
            if (fight.isRequireApproval() && !role.isDm() && action.getType() != ActionType.DECLARE) {
                return queueForApproval(fight, role, requested);
            }
            return resolve(fight, diceService.fillMissingRolls(fight, requested), false);
        });
    }

    /**
     * Apply a DM instruction. Turn order and eligibility are not checked; the fight's lifecycle
     * still is, so e.g. a resolved fight cannot be started again.
     */
    public ResolutionResult dmOverride(String fightId, ViewerRole role, DmOverrideRequest request) {
        if (!role.isDm()) {
            throw new IllegalActionException("Only the DM can override a fight");
        }
        if (request == null || request.getKind() == null) {
            throw new ValidationException("Override kind is required");
        }
        FightRef ref = FightRef.parse(fightId);
        return transact(ref, room -> applyOverride(room, requireFight(room, ref), request));
    }

    private ResolutionResult applyOverride(Room room, Fight fight, DmOverrideRequest request) {
        DmOverrideRequest.Kind kind = request.getKind();
        switch (kind) {
            case FORCE_ACTION -> {
                if (request.getAction() == null) {
                    throw new ValidationException("A forced action needs an action");
                }
                return resolve(fight, diceService.fillMissingRolls(fight, request.getAction()), true);
            }
            case APPROVE_PENDING -> {
                return approvePending(fight, request);
            }
            case ADD_COMBATANTS -> {
                Set<String> existing = new HashSet<>();
                fight.getCombatants().forEach(c -> existing.add(c.getId()));
                List<Combatant> added = buildCombatants(request.getCombatants(), existing);
                fightStateMachine.addCombatants(fight, added);
                added.stream()
                        .filter(Combatant::isCharacter)
                        .forEach(c -> room.getDiscoveredBy().add(c.getCharacterId()));
            }
            case START -> fightStateMachine.start(fight, diceService.fillInitiative(fight, request.getInitiativeRolls()));
            case BEGIN_ROUND -> fightStateMachine.beginRound(fight);
            case ADVANCE_TURN -> {
                fightStateMachine.advanceTurn(fight);
                fight.log("dm", kind.name(), "DM advanced the turn", true);
            }
            case SET_HIT_POINTS -> setHitPoints(fight, request);
            case SET_STATUS -> setStatus(fight, request);
            case FORCE_RESOLVE -> fightStateMachine.forceResolve(fight, request.getWinningSide());
            case DISMISS_PENDING -> {
                PendingAction pending = takePending(fight, request.getPendingActionId());
                fight.log("dm", kind.name(), "DM dismissed a " + pending.getAction().getType()
                        + " request from " + pending.getSubmittedBy(), true);
            }
            case CANCEL -> fightStateMachine.cancel(room);
            case CLEAR -> fightStateMachine.clear(room);
        }
        Optional<FightLogEntry> last = lastEntry(room.getFight());
        return ResolutionResult.builder()
                .action(kind.name())
                .actorId(request.getCombatantId())
                .dmOverride(true)
                .summary(room.getFight() == null
                        ? "Fight removed from room"
                        : last.map(FightLogEntry::getSummary).orElse(""))
                .dmOnly(last.map(FightLogEntry::isDmOnly).orElse(false))
                .build();
    }

    private ResolutionResult resolve(Fight fight, CombatAction action, boolean dmOverride) {
        ResolutionResult result = combatResolutionEngine.resolve(fight, action, dmOverride);
        fightStateMachine.afterAction(fight, action);
        return result;
    }

    private void validateAction(Fight fight, ViewerRole role, CombatAction action) {
        if (action == null || action.getType() == null) {
            throw new ValidationException("Action type is required");
        }
        if (!role.isDm() && !action.getType().isPlayerPermitted()) {
            throw new IllegalActionException("Players cannot request " + action.getType());
        }
        Combatant actor = fight.findCombatant(action.getActorId())
                .orElseThrow(() -> new IllegalActionException("Unknown combatant: " + action.getActorId()));
        if (!role.controls(actor)) {
            throw new IllegalActionException("You do not control " + actor.getName());
        }
        if (action.getType() == ActionType.MORALE_CHECK) {
            if (!fight.getState().isActive()) {
                throw new IllegalActionException("Morale is only checked in an active fight");
            }
            return;
        }
        validateTiming(fight, actor, action.getType());
        boolean alreadyQueued = fight.getPendingActions().stream()
                .anyMatch(p -> actor.getId().equals(p.getAction().getActorId()));
        if (alreadyQueued) {
            throw new IllegalActionException(actor.getName() + " already has an action awaiting approval");
        }
    }

    /**
     * Declarations are made ahead of the declarer's turn; a move only opens a turn; everything
     * else happens on the actor's turn.
     */
    private static void validateTiming(Fight fight, Combatant actor, ActionType type) {
        if (type == ActionType.DECLARE) {
            if (!actor.isEligible()) {
                throw new IllegalActionException(actor.getName() + " is out of the fight");
            }
            boolean theirTurn = fight.getCurrentActor().map(c -> c.getId().equals(actor.getId())).orElse(false);
            boolean beforeTheirTurn = fight.getState() == FightState.ACTIVE_INITIATIVE
                    || (fight.getState() == FightState.ACTIVE_ROUND && !theirTurn);
            if (!beforeTheirTurn) {
                throw new IllegalActionException(actor.getName() + " can only declare before their turn");
            }
            return;
        }
        validateTurn(fight, actor);
        if (type == ActionType.MOVE && fight.getTurnPhase() != TurnPhase.MOVEMENT) {
            throw new IllegalActionException(actor.getName() + " has already moved this turn");
        }
    }

    private static void validateTurn(Fight fight, Combatant actor) {
        if (fight.getState() != FightState.ACTIVE_ROUND) {
            throw new IllegalActionException("No round is in progress");
        }
        if (!actor.isEligible()) {
            throw new IllegalActionException(actor.getName() + " is out of the fight");
        }
        boolean theirTurn = fight.getCurrentActor().map(c -> c.getId().equals(actor.getId())).orElse(false);
        if (!theirTurn) {
            throw new IllegalActionException("It is not " + actor.getName() + "'s turn");
        }
    }

    private ResolutionResult queueForApproval(Fight fight, ViewerRole role, CombatAction action) {
        PendingAction pending = PendingAction.builder()
                .id(UUID.randomUUID().toString().substring(0, 8))
                .submittedBy(role.username())
                .action(action)
                .submittedAt(Instant.now())
                .build();
        fight.getPendingActions().add(pending);
        log.info("Fight {}: {} queued {} for approval", fight.getId(), role.username(), action.getType());
        return ResolutionResult.builder()
                .action(action.getType().name())
                .actorId(action.getActorId())
                .queued(true)
                .pendingActionId(pending.getId())
                .summary(action.getType() + " awaiting DM approval")
                .build();
    }

    /**
     * Resolve a queued request as the player asked it, with any rolls the DM supplies taking
     * precedence. The request must still be legal.
     */
    private ResolutionResult approvePending(Fight fight, DmOverrideRequest request) {
        PendingAction pending = takePending(fight, request.getPendingActionId());
        CombatAction action = withRolls(pending.getAction(), request.getAction());
        validateTiming(fight, fight.requireCombatant(action.getActorId()), action.getType());
        return resolve(fight, diceService.fillMissingRolls(fight, action), false);
    }

    private static CombatAction withRolls(CombatAction requested, CombatAction overrides) {
        if (overrides == null) {
            return requested;
        }
        CombatAction.CombatActionBuilder merged = requested.toBuilder();
        Optional.ofNullable(overrides.getAttackRoll()).ifPresent(merged::attackRoll);
        Optional.ofNullable(overrides.getDamageRoll()).ifPresent(merged::damageRoll);
        Optional.ofNullable(overrides.getMortalWoundRoll()).ifPresent(merged::mortalWoundRoll);
        Optional.ofNullable(overrides.getSaveRoll()).ifPresent(merged::saveRoll);
        Optional.ofNullable(overrides.getMoraleRoll()).ifPresent(merged::moraleRoll);
        if (overrides.getModifier() != 0) {
            merged.modifier(overrides.getModifier());
        }
        return merged.build();
    }

    /** Only the DM chooses dice; a player's request is rolled by the server. */
    private static CombatAction withoutRolls(CombatAction action) {
        return action.toBuilder()
                .attackRoll(null)
                .damageRoll(null)
                .mortalWoundRoll(null)
                .saveRoll(null)
                .moraleRoll(null)
                .modifier(0)
                .build();
    }

    private static PendingAction takePending(Fight fight, String pendingId) {
        PendingAction pending = fight.getPendingActions().stream()
                .filter(p -> p.getId().equals(pendingId))
                .findFirst()
                .orElseThrow(() -> NotFoundException.of("Pending action", String.valueOf(pendingId)));
        fight.getPendingActions().remove(pending);
        return pending;
    }

    private void setHitPoints(Fight fight, DmOverrideRequest request) {
        if (request.getHitPoints() == null) {
            throw new ValidationException("Hit points are required");
        }
        Combatant combatant = fight.requireCombatant(request.getCombatantId());
        combatant.setHitPoints(request.getHitPoints());
        String summary = "DM set " + combatant.getName() + "'s hit points to " + request.getHitPoints();
        if (combatant.needsMortalWoundCheck()) {
            Integer roll = request.getMortalWoundRoll() != null ? request.getMortalWoundRoll() : diceService.roll(20);
            MortalWoundModifiers modifiers = request.getMortalWoundModifiers() != null
                    ? request.getMortalWoundModifiers()
                    : MortalWoundModifiers.NONE;
            MortalWoundResult wound = combatResolutionEngine.resolveMortalWound(combatant, roll, modifiers);
            summary += "; " + wound.getDescription();
        }
        fight.log("dm", DmOverrideRequest.Kind.SET_HIT_POINTS.name(), summary, true, !combatant.isPartyMember());
        fightStateMachine.settle(fight);
    }

    private void setStatus(Fight fight, DmOverrideRequest request) {
        if (request.getStatus() == null) {
            throw new ValidationException("Status is required");
        }
        Combatant combatant = fight.requireCombatant(request.getCombatantId());
        switch (request.getStatus()) {
            case ACTIVE -> {
                combatant.setFled(false);
                combatant.setSurrendered(false);
                combatant.setMortallyWounded(false);
                combatant.setDead(false);
                combatant.setWoundCondition(null);
            }
            case FLED -> combatant.setFled(true);
            case SURRENDERED -> combatant.setSurrendered(true);
            case MORTALLY_WOUNDED -> combatant.setMortallyWounded(true);
            case DEAD -> combatant.setDead(true);
        }
        fight.log("dm", DmOverrideRequest.Kind.SET_STATUS.name(),
                "DM set " + combatant.getName() + " to " + request.getStatus(), true);
        fightStateMachine.settle(fight);
    }

    /**
     * Run {@code work} on a working copy of the fight's room and commit it.
     */
    private ResolutionResult transact(FightRef ref, Function<Room, ResolutionResult> work) {
        ReentrantLock lock = roomLocks.computeIfAbsent(ref.roomKey(), key -> new ReentrantLock());
        lock.lock();
        try {
            RoomCheckout checkout = roomGraphStore.checkout(ref.mapId(), ref.roomId());
            ResolutionResult result = work.apply(checkout.working());

            Fight before = checkout.base().getFight();
            Fight after = checkout.working().getFight();
            Deque<Runnable> undo = new ArrayDeque<>();
            Party credited;
            try {
                writeThroughCharacters(before, after, undo);
                credited = creditParty(before, after, undo);
                result.setRevision(roomGraphStore.commitRoom(checkout));
            } catch (RuntimeException e) {
                log.error("Commit of fight {} failed, undoing {} write(s)", ref, undo.size(), e);
                compensate(undo);
                if (e instanceof CampaignException) {
                    throw e;
                }
                throw new PersistenceFailureException("Could not commit fight " + ref, e);
            }

            describe(result, ref, after);
            stateBroadcaster.broadcastRoomChange(ref.mapId(), ref.roomId(), result);
            if (credited != null) {
                stateBroadcaster.broadcastPartyUpdate(credited);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy hit point and condition changes of character combatants to their sheets.
     */
    private void writeThroughCharacters(Fight before, Fight after, Deque<Runnable> undo) {
        if (before == null || after == null) {
            return;
        }
        for (Combatant now : after.getCombatants()) {
            if (!now.isCharacter()) {
                continue;
            }
            Optional<Combatant> was = before.findCombatant(now.getId());
            if (was.isEmpty()) {
                continue;
            }
            if (was.get().getHitPoints() != now.getHitPoints()) {
                apply(now.getCharacterId(), CharacterMutation.hitPoints(now.getHitPoints()), undo);
            }
            CharacterCondition condition = conditionOf(now);
            if (conditionOf(was.get()) != condition) {
                apply(now.getCharacterId(), CharacterMutation.condition(condition), undo);
            }
        }
    }

    private void apply(String characterId, CharacterMutation mutation, Deque<Runnable> undo) {
        CharacterSheet before = characterSheetStore.updateCharacter(characterId, mutation);
        CharacterMutation inverse = mutation.inverseFor(before);
        undo.push(() -> characterSheetStore.updateCharacter(characterId, inverse));
    }

    /**
     * Credit the party with the fight's XP on the transition to RESOLVED.
     */
    private Party creditParty(Fight before, Fight after, Deque<Runnable> undo) {
        if (after == null || after.getState() != FightState.RESOLVED
                || (before != null && before.getState() == FightState.RESOLVED)) {
            return null;
        }
        if (after.getPartyId() == null) {
            log.warn("Fight {} resolved for {} XP but has no party to credit", after.getId(), after.getXpAwarded());
            return null;
        }
        if (after.getXpAwarded() <= 0) {
            return null;
        }
        Party party = partyLedgerService.trackPendingXP(after.getPartyId(), after.getXpAwarded());
        undo.push(() -> partyLedgerService.revertPendingXP(after.getPartyId(), after.getXpAwarded()));
        return party;
    }

    private static void compensate(Deque<Runnable> undo) {
        while (!undo.isEmpty()) {
            try {
                undo.pop().run();
            } catch (RuntimeException e) {
                log.error("Compensation step failed; stored state may need manual correction", e);
            }
        }
    }

    private static CharacterCondition conditionOf(Combatant combatant) {
        if (combatant.isDead()) {
            return CharacterCondition.DEAD;
        }
        if (combatant.isMortallyWounded()) {
            return CharacterCondition.MORTALLY_WOUNDED;
        }
        return CharacterCondition.HEALTHY;
    }

    private static void describe(ResolutionResult result, FightRef ref, Fight fight) {
        result.setFightId(ref.asId());
        if (fight == null) {
            result.setFightState(FightState.EMPTY);
            return;
        }
        result.setFightState(fight.getState());
        result.setRound(fight.getRound());
        result.setCurrentActorId(fight.getCurrentActor().map(Combatant::getId).orElse(null));
        result.setWinningSide(fight.getWinningSide());
        result.setXpAwarded(fight.getXpAwarded());
    }

    private static Optional<FightLogEntry> lastEntry(Fight fight) {
        if (fight == null || fight.getHistory().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fight.getHistory().get(fight.getHistory().size() - 1));
    }

    private static Fight requireFight(Room room, FightRef ref) {
        Fight fight = room.getFight();
        if (fight == null || !ref.asId().equals(fight.getId())) {
            throw NotFoundException.of("Fight", ref.asId());
        }
        return fight;
    }

    /**
     * Turn encounter lines into combatants. Characters are read from their sheets; NPC lines
     * are instantiated {@code count} times with numbered names.
     */
    List<Combatant> buildCombatants(List<CombatantSpec> specs, Set<String> takenIds) {
        if (specs == null || specs.isEmpty()) {
            throw new ValidationException("No combatants given");
        }
        Set<String> ids = new HashSet<>(takenIds);
        List<Combatant> combatants = new ArrayList<>();
        for (CombatantSpec spec : specs) {
            if (spec.getKind() == null) {
                throw new ValidationException("Combatant kind is required");
            }
            if (spec.getKind() == CombatantKind.CHARACTER) {
                combatants.add(fromCharacter(spec, ids));
            } else {
                combatants.addAll(fromTemplate(spec, ids));
            }
        }
        return combatants;
    }

    private Combatant fromCharacter(CombatantSpec spec, Set<String> ids) {
        if (spec.getCharacterId() == null) {
            throw new ValidationException("Character combatants need a character id");
        }
        CharacterSheet sheet = characterSheetStore.getCharacter(spec.getCharacterId());
        if (sheet.getCondition() == CharacterCondition.DEAD) {
            throw new ValidationException(sheet.getName() + " is dead");
        }
        String id = uniqueId("pc-" + sheet.getId(), ids);
        return Combatant.builder()
                .id(id)
                .name(sheet.getName())
                .kind(CombatantKind.CHARACTER)
                .characterId(sheet.getId())
                .side(spec.getSide() != null ? spec.getSide() : Side.PARTY)
                .hitPoints(sheet.getCurrentHitPoints())
                .maxHitPoints(sheet.getMaxHitPoints())
                .armorClass(sheet.getArmorClass())
                .attackThrow(sheet.getAttackThrow())
                .damage(spec.getDamage() != null ? DamageDice.parse(spec.getDamage()).toNotation()
                        : DamageDice.UNARMED.toNotation())
                .attackType(spec.getAttackType() != null ? spec.getAttackType() : AttackType.MELEE)
                .attacksPerRound(Math.max(1, spec.getAttacksPerRound()))
                .initiativeModifier(CharacterSheet.attributeModifier(sheet.getDexterity()) + spec.getInitiativeModifier())
                .morale(spec.getMorale())
                .hitDie(sheet.getHitDie() != null ? sheet.getHitDie() : HitDie.D8)
                .constitutionModifier(sheet.getConstitutionModifier())
                .savingThrows(sheet.getSavingThrows() != null ? sheet.getSavingThrows().copy() : new SavingThrows())
                .mortallyWounded(sheet.getCondition() == CharacterCondition.MORTALLY_WOUNDED)
                .build();
    }

    private static List<Combatant> fromTemplate(CombatantSpec spec, Set<String> ids) {
        if (spec.getTemplateId() == null) {
            throw new ValidationException("NPC combatants need a template id");
        }
        FightRef.requireValidId("template", spec.getTemplateId());
        if (spec.getHitPoints() < 1) {
            throw new ValidationException("NPC " + spec.getTemplateId() + " needs at least 1 hit point");
        }
        if (spec.getCount() < 1) {
            throw new ValidationException("NPC count must be at least 1");
        }
        String baseName = spec.getName() != null ? spec.getName() : spec.getTemplateId();
        List<Combatant> combatants = new ArrayList<>();
        for (int i = 1; i <= spec.getCount(); i++) {
            Combatant.CombatantBuilder builder = Combatant.builder()
                    .id(uniqueId(spec.getTemplateId() + "-" + i, ids))
                    .name(spec.getCount() > 1 ? baseName + " " + i : baseName)
                    .kind(CombatantKind.NPC)
                    .templateId(spec.getTemplateId())
                    .side(spec.getSide() != null ? spec.getSide() : Side.FOES)
                    .hitPoints(spec.getHitPoints())
                    .maxHitPoints(spec.getHitPoints())
                    .armorClass(spec.getArmorClass())
                    .attackThrow(spec.getAttackThrow())
                    .attacksPerRound(Math.max(1, spec.getAttacksPerRound()))
                    .initiativeModifier(spec.getInitiativeModifier())
                    .morale(spec.getMorale())
                    .xpValue(spec.getXpValue())
                    .savingThrows(spec.getSavingThrows() != null ? spec.getSavingThrows().copy() : new SavingThrows());
            if (spec.getDamage() != null) {
                builder.damage(DamageDice.parse(spec.getDamage()).toNotation());
            }
            if (spec.getAttackType() != null) {
                builder.attackType(spec.getAttackType());
            }
            if (spec.getHitDie() != null) {
                builder.hitDie(spec.getHitDie());
            }
            combatants.add(builder.build());
        }
        return combatants;
    }

    private static String uniqueId(String candidate, Set<String> ids) {
        String id = candidate;
        int suffix = 2;
        while (!ids.add(id)) {
            id = candidate + "-" + suffix++;
        }
        return id;
    }
}
