package com.acks.websocket;

import com.acks.dto.CombatantView;
import com.acks.dto.AttackResult;
import com.acks.dto.FightView;
import com.acks.dto.MortalWoundResult;
import com.acks.dto.ResolutionResult;
import com.acks.dto.RoomView;
import com.acks.dto.SavingThrowResult;
import com.acks.model.Combatant;
import com.acks.model.Fight;
import com.acks.model.PendingAction;
import com.acks.model.Room;
import com.acks.model.RoomConnection;
import com.acks.model.ViewerRole;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared projection; subclasses decide what is hidden.
 */
abstract class AbstractMapView implements MapViewFilter {

    protected final ViewerRole role;

    protected AbstractMapView(ViewerRole role) {
        this.role = role;
    }

    protected abstract boolean showsDmDetail();

    protected abstract boolean showsStats(Combatant combatant);

    protected abstract boolean showsPending(Fight fight, PendingAction pending);

    @Override
    public RoomView projectRoom(Room room) {
        List<RoomView.ConnectionView> connections = new ArrayList<>();
        for (RoomConnection connection : room.getConnections().values()) {
            connections.add(RoomView.ConnectionView.builder()
                    .targetRoomId(connection.getTargetRoomId())
                    .description(connection.getDescription())
                    .oneWay(connection.isOneWay())
                    .passable(connection.isPassable())
                    .locked(connection.isLocked())
                    .trap(showsDmDetail() && connection.getTrap() != null
                            ? connection.getTrap().getDescription()
                            : null)
                    .build());
        }
        return RoomView.builder()
                .id(room.getId())
                .name(room.getName())
                .description(showsDmDetail() ? room.getDescription() : null)
                .connections(connections)
                .discoveredBy(showsDmDetail() ? new ArrayList<>(room.getDiscoveredBy()) : null)
                .fightState(room.getFightState())
                .fight(room.getFight() == null ? null : projectFight(room.getFight()))
                .build();
    }

    @Override
    public FightView projectFight(Fight fight) {
        return FightView.builder()
                .id(fight.getId())
                .state(fight.getState())
                .round(fight.getRound())
                .currentActorId(fight.getCurrentActor().map(Combatant::getId).orElse(null))
                .turnPhase(fight.getTurnPhase())
                .requireApproval(fight.isRequireApproval())
                .combatants(fight.getCombatants().stream().map(this::projectCombatant).toList())
                .pendingActions(fight.getPendingActions().stream()
                        .filter(p -> showsPending(fight, p))
                        .toList())
                .history(fight.getHistory().stream()
                        .filter(entry -> showsDmDetail() || !entry.isDmOnly())
                        .toList())
                .partyId(fight.getPartyId())
                .treasureValue(showsDmDetail() ? fight.getTreasureValue() : null)
                .winningSide(fight.getWinningSide())
                .xpAwarded(fight.getXpAwarded())
                .build();
    }

    @Override
    public ResolutionResult projectResult(ResolutionResult result, Fight fight) {
        if (result == null || showsDmDetail()) {
            return result;
        }
        ResolutionResult.ResolutionResultBuilder projected = result.toBuilder();
        if (result.isDmOnly()) {
            projected.summary(null);
        }
        AttackResult attack = result.getAttack();
        if (attack != null && !showsStatsOf(fight, attack.getTargetId())) {
            projected.attack(attack.toBuilder()
                    .total(null)
                    .targetHitPoints(null)
                    .mortalWound(hideTotal(attack.getMortalWound()))
                    .build());
        }
        SavingThrowResult save = result.getSavingThrow();
        if (save != null && !showsStatsOf(fight, save.getCombatantId())) {
            projected.savingThrow(save.toBuilder().total(null).build());
        }
        MortalWoundResult wound = result.getMortalWound();
        if (wound != null && !showsStatsOf(fight, wound.getCombatantId())) {
            projected.mortalWound(hideTotal(wound));
        }
        projected.morale(result.getMorale().stream()
                .map(m -> m.toBuilder().total(null).build())
                .toList());
        return projected.build();
    }

    private boolean showsStatsOf(Fight fight, String combatantId) {
        if (fight == null || combatantId == null) {
            return false;
        }
        return fight.findCombatant(combatantId).map(this::showsStats).orElse(false);
    }

    private static MortalWoundResult hideTotal(MortalWoundResult wound) {
        return wound == null ? null : wound.toBuilder().total(null).build();
    }

    CombatantView projectCombatant(Combatant c) {
        boolean stats = showsStats(c);
        return CombatantView.builder()
                .id(c.getId())
                .name(c.getName())
                .kind(c.getKind())
                .characterId(c.getCharacterId())
                .side(c.getSide())
                .initiative(c.getInitiative())
                .hitPoints(stats ? c.getHitPoints() : null)
                .maxHitPoints(stats ? c.getMaxHitPoints() : null)
                .armorClass(stats ? c.getArmorClass() : null)
                .morale(showsDmDetail() ? c.getMorale() : null)
                .fled(c.isFled())
                .surrendered(c.isSurrendered())
                .mortallyWounded(c.isMortallyWounded())
                .dead(c.isDead())
                .woundCondition(c.getWoundCondition())
                .declaration(stats ? c.getDeclaration() : null)
                .declaredSpell(stats ? c.getDeclaredSpell() : null)
                .controlled(role.controls(c))
                .build();
    }
}
