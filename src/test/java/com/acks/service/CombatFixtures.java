package com.acks.service;

import com.acks.model.ActionType;
import com.acks.model.CombatAction;
import com.acks.model.Combatant;
import com.acks.model.CombatantKind;
import com.acks.model.Fight;
import com.acks.model.FightRef;
import com.acks.model.FightState;
import com.acks.model.HitDie;
import com.acks.model.Room;
import com.acks.model.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Combatants and fights shared by the combat tests.
 */
final class CombatFixtures {

    static final String MAP_ID = "warren";
    static final String ROOM_ID = "r1";

    private CombatFixtures() {
    }

    static Combatant goblin(String id) {
        return Combatant.builder()
                .id(id)
                .name("Goblin")
                .kind(CombatantKind.NPC)
                .templateId("goblin")
                .side(Side.FOES)
                .hitPoints(7)
                .maxHitPoints(7)
                .armorClass(6)
                .attackThrow(10)
                .damage("1d6")
                .morale(-1)
                .xpValue(5)
                .hitDie(HitDie.D8)
                .build();
    }

    static Combatant fighter() {
        return Combatant.builder()
                .id("pc-brannoc")
                .name("Brannoc")
                .kind(CombatantKind.CHARACTER)
                .characterId("brannoc")
                .side(Side.PARTY)
                .hitPoints(12)
                .maxHitPoints(12)
                .armorClass(4)
                .attackThrow(10)
                .damage("1d8")
                .hitDie(HitDie.D8)
                .build();
    }

    /** A fight in its first round with Brannoc to act, then the goblin. */
    static Fight activeFight(Combatant... combatants) {
        Fight fight = Fight.builder()
                .id(new FightRef(MAP_ID, ROOM_ID, "f1").asId())
                .partyId("heroes")
                .combatants(new ArrayList<>(List.of(combatants)))
                .build();
        fight.setState(FightState.ACTIVE_ROUND);
        fight.setRound(1);
        fight.setCurrentTurn(0);
        return fight;
    }

    static Room room(Fight fight) {
        Room room = Room.builder().id(ROOM_ID).name("Guard Post").description("Two goblins dice by a torch").build();
        room.setFight(fight);
        return room;
    }

    static CombatAction attack(String actorId, String targetId, int attackRoll, int damageRoll) {
        return CombatAction.builder()
                .type(ActionType.ATTACK)
                .actorId(actorId)
                .targetId(targetId)
                .attackRoll(attackRoll)
                .damageRoll(damageRoll)
                .mortalWoundRoll(10)
                .build();
    }
}
