package com.acks.websocket;

import com.acks.dto.AttackResult;
import com.acks.dto.CombatantView;
import com.acks.dto.FightView;
import com.acks.dto.MapView;
import com.acks.dto.MoraleResult;
import com.acks.dto.ResolutionResult;
import com.acks.dto.RoomView;
import com.acks.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for what a player's view hides.
 */
class PlayerMapViewTest {

    private DungeonMap map;
    private Fight fight;

    @BeforeEach
    void setUp() {
        Combatant brannoc = Combatant.builder()
                .id("pc-brannoc").name("Brannoc").kind(CombatantKind.CHARACTER).characterId("brannoc")
                .side(Side.PARTY).hitPoints(9).maxHitPoints(12).armorClass(4).build();
        Combatant goblin = Combatant.builder()
                .id("goblin-1").name("Goblin").kind(CombatantKind.NPC).templateId("goblin")
                .side(Side.FOES).hitPoints(3).maxHitPoints(7).armorClass(6).morale(-1).build();
        fight = Fight.builder()
                .id("warren:r2:f1")
                .state(FightState.ACTIVE_ROUND)
                .round(1)
                .currentTurn(0)
                .treasureValue(40)
                .combatants(new ArrayList<>(List.of(brannoc, goblin)))
                .build();
        fight.getPendingActions().add(new PendingAction("p1", "alice", new CombatAction(), Instant.now()));
        fight.getPendingActions().add(new PendingAction("p2", "bob", new CombatAction(), Instant.now()));

        Room guardPost = Room.builder().id("r2").name("Guard Post").description("Two goblins dice by a torch").fight(fight).build();
        guardPost.getDiscoveredBy().add("brannoc");
        guardPost.connectTo("r3", "A heavy oak door");
        guardPost.getConnections().get("r3").setTrap(new RoomTrap("Scything blade", true));
        Room hall = Room.builder().id("r3").name("Chieftain's Hall").build();

        map = DungeonMap.builder().id("warren").name("Goblin Warren").revision(3).build();
        map.putRoom(guardPost);
        map.putRoom(hall);
    }

    @Test
    @DisplayName("players should only get rooms their characters discovered")
    void shouldOnlyShowDiscoveredRooms() {
        MapView view = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc"))).project(map);

        assertEquals(List.of("r2"), view.getRooms().stream().map(RoomView::getId).toList());
        assertEquals(3, view.getRevision());
    }

    @Test
    @DisplayName("a player with no characters there should see nothing")
    void strangerShouldSeeNothing() {
        MapView view = MapViewFilter.forRole(new ViewerRole.Player("carol", Set.of())).project(map);

        assertTrue(view.getRooms().isEmpty());
    }

    @Test
    @DisplayName("DM notes, traps and treasure should be hidden from players")
    void shouldHideDmDetail() {
        RoomView room = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc"))).project(map).getRooms().get(0);

        assertNull(room.getDescription());
        assertNull(room.getDiscoveredBy());
        assertNull(room.getConnections().get(0).getTrap());
        assertEquals("A heavy oak door", room.getConnections().get(0).getDescription());
        assertNull(room.getFight().getTreasureValue());
    }

    @Test
    @DisplayName("players should see their side's stats but not the monsters'")
    void shouldHideFoeStats() {
        FightView view = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc"))).projectFight(fight);

        CombatantView brannoc = view.getCombatants().get(0);
        CombatantView goblin = view.getCombatants().get(1);
        assertEquals(9, brannoc.getHitPoints());
        assertTrue(brannoc.isControlled());
        assertNull(goblin.getHitPoints());
        assertNull(goblin.getArmorClass());
        assertNull(goblin.getMorale());
        assertFalse(goblin.isControlled());
        assertEquals("pc-brannoc", view.getCurrentActorId());
    }

    @Test
    @DisplayName("players should only see their own pending requests")
    void shouldOnlyShowOwnPending() {
        FightView view = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc"))).projectFight(fight);

        assertEquals(List.of("p1"), view.getPendingActions().stream().map(PendingAction::getId).toList());
    }

    @Test
    @DisplayName("players should see their own declarations and the turn phase, not the monsters' plans")
    void shouldHideFoeDeclarations() {
        fight.getCombatants().get(0).setDeclaration(PreRoundDeclaration.CAST_SPELL);
        fight.getCombatants().get(0).setDeclaredSpell("Sleep");
        fight.getCombatants().get(1).setDeclaration(PreRoundDeclaration.FULL_RETREAT);
        fight.setTurnPhase(TurnPhase.ATTACK);

        FightView view = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc"))).projectFight(fight);

        assertEquals(TurnPhase.ATTACK, view.getTurnPhase());
        assertEquals("Sleep", view.getCombatants().get(0).getDeclaredSpell());
        assertNull(view.getCombatants().get(1).getDeclaration());
    }

    @Test
    @DisplayName("DM-only history entries should be hidden from players")
    void shouldHideDmOnlyHistory() {
        fight.log("pc-brannoc", "ATTACK", "Brannoc hit Goblin for 4 damage", false);
        fight.log("dm", "SET_HIT_POINTS", "DM set Goblin's hit points to 3", true, true);
        fight.log("dm", "ADVANCE_TURN", "DM advanced the turn", true);

        FightView forAlice = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc"))).projectFight(fight);
        FightView forDm = MapViewFilter.forRole(new ViewerRole.DungeonMaster("DM")).projectFight(fight);

        assertEquals(List.of("Brannoc hit Goblin for 4 damage", "DM advanced the turn"),
                forAlice.getHistory().stream().map(FightLogEntry::getSummary).toList());
        assertEquals(3, forDm.getHistory().size());
    }

    @Test
    @DisplayName("an attack on a monster should reach players without its totals or hit points")
    void shouldHideFoeDetailInResults() {
        ResolutionResult result = ResolutionResult.builder()
                .fightId(fight.getId())
                .action("ATTACK")
                .actorId("pc-brannoc")
                .summary("Brannoc hit Goblin for 4 damage")
                .attack(AttackResult.builder()
                        .attackerId("pc-brannoc").targetId("goblin-1")
                        .attackRoll(16).total(22).hit(true).damage(4).targetHitPoints(3)
                        .build())
                .build();

        ResolutionResult forAlice = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc")))
                .projectResult(result, fight);
        ResolutionResult forDm = MapViewFilter.forRole(new ViewerRole.DungeonMaster("DM")).projectResult(result, fight);

        assertNull(forAlice.getAttack().getTargetHitPoints());
        assertNull(forAlice.getAttack().getTotal());
        assertEquals(4, forAlice.getAttack().getDamage());
        assertEquals(16, forAlice.getAttack().getAttackRoll());
        assertEquals("Brannoc hit Goblin for 4 damage", forAlice.getSummary());
        assertEquals(3, forDm.getAttack().getTargetHitPoints());
        assertEquals(22, result.getAttack().getTotal(), "the original result is not changed");
    }

    @Test
    @DisplayName("an attack on a party member should keep its hit points for players")
    void shouldKeepPartyDetailInResults() {
        ResolutionResult result = ResolutionResult.builder()
                .attack(AttackResult.builder()
                        .attackerId("goblin-1").targetId("pc-brannoc")
                        .attackRoll(15).total(21).hit(true).damage(3).targetHitPoints(9)
                        .build())
                .build();

        ResolutionResult forAlice = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc")))
                .projectResult(result, fight);

        assertEquals(9, forAlice.getAttack().getTargetHitPoints());
        assertEquals(21, forAlice.getAttack().getTotal());
    }

    @Test
    @DisplayName("a DM-only summary and morale totals should be withheld from players")
    void shouldWithholdDmOnlySummary() {
        ResolutionResult result = ResolutionResult.builder()
                .action("SET_HIT_POINTS")
                .summary("DM set Goblin's hit points to 3")
                .dmOnly(true)
                .morale(List.of(MoraleResult.builder().combatantId("goblin-1").roll(4).total(3)
                        .outcome(MoraleResult.Outcome.FLEES).build()))
                .build();

        ResolutionResult forAlice = MapViewFilter.forRole(new ViewerRole.Player("alice", Set.of("brannoc")))
                .projectResult(result, null);

        assertNull(forAlice.getSummary());
        assertNull(forAlice.getMorale().get(0).getTotal());
        assertEquals(MoraleResult.Outcome.FLEES, forAlice.getMorale().get(0).getOutcome());
    }

    @Test
    @DisplayName("the DM should see everything")
    void dmShouldSeeEverything() {
        MapView view = MapViewFilter.forRole(new ViewerRole.DungeonMaster("DM")).project(map);

        assertEquals(2, view.getRooms().size());
        RoomView guardPost = view.getRooms().get(0);
        assertEquals("Two goblins dice by a torch", guardPost.getDescription());
        assertEquals("Scything blade", guardPost.getConnections().get(0).getTrap());
        assertEquals(40L, guardPost.getFight().getTreasureValue());
        assertEquals(2, guardPost.getFight().getPendingActions().size());
        assertEquals(-1, guardPost.getFight().getCombatants().get(1).getMorale());
    }
}
