package com.acks.service;

import com.acks.model.ActionType;
import com.acks.model.CombatAction;
import com.acks.model.DamageDice;
import com.acks.model.Fight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.random.RandomGenerator;

import static com.acks.service.CombatFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DiceService.
 */
@ExtendWith(MockitoExtension.class)
class DiceServiceTest {

    @Mock
    private RandomGenerator random;

    private DiceService diceService;

    @BeforeEach
    void setUp() {
        diceService = new DiceService(random);
    }

    @Test
    @DisplayName("a natural 20 should roll again and add")
    void d20ShouldExplode() {
        when(random.nextInt(20)).thenReturn(19, 19, 4);

        assertEquals(45, diceService.explodingD20());
    }

    @Test
    @DisplayName("a run of natural 20s should stop at the largest accepted attack roll")
    void d20ExplosionShouldBeBounded() {
        when(random.nextInt(20)).thenReturn(19);

        assertEquals(CombatResolutionEngine.MAX_ROLL, diceService.explodingD20());
    }

    @Test
    @DisplayName("damage dice should sum every die")
    void shouldSumDamageDice() {
        when(random.nextInt(6)).thenReturn(0, 5, 2);

        assertEquals(1 + 6 + 3, diceService.roll(DamageDice.parse("3d6")));
    }

    @Test
    @DisplayName("rolls the caller supplied should be kept, missing ones drawn")
    void shouldOnlyFillMissingRolls() {
        Fight fight = activeFight(fighter(), goblin("goblin-1"));
        CombatAction action = CombatAction.builder()
                .type(ActionType.ATTACK).actorId("pc-brannoc").targetId("goblin-1")
                .attackRoll(14)
                .build();
        when(random.nextInt(8)).thenReturn(6);
        when(random.nextInt(20)).thenReturn(11);

        CombatAction filled = diceService.fillMissingRolls(fight, action);

        assertEquals(14, filled.getAttackRoll());
        assertEquals(7, filled.getDamageRoll(), "Brannoc's 1d8");
        assertEquals(12, filled.getMortalWoundRoll());
        assertNull(action.getDamageRoll(), "the request itself is not changed");
    }

    @Test
    @DisplayName("a weapon named in the action should set the damage dice")
    void weaponOverrideShouldSetDice() {
        Fight fight = activeFight(fighter(), goblin("goblin-1"));
        CombatAction action = CombatAction.builder()
                .type(ActionType.ATTACK).actorId("pc-brannoc").targetId("goblin-1")
                .attackRoll(14).mortalWoundRoll(10)
                .weaponName("Dagger").weaponDamage("1d4")
                .build();
        when(random.nextInt(4)).thenReturn(3);

        assertEquals(4, diceService.fillMissingRolls(fight, action).getDamageRoll());
    }

    @Test
    @DisplayName("initiative should only be rolled for combatants without a supplied roll")
    void shouldFillInitiative() {
        Fight fight = activeFight(fighter(), goblin("goblin-1"));
        when(random.nextInt(6)).thenReturn(1);

        Map<String, Integer> rolls = diceService.fillInitiative(fight, Map.of("pc-brannoc", 6));

        assertEquals(Map.of("pc-brannoc", 6, "goblin-1", 2), rolls);
        verify(random, times(1)).nextInt(6);
    }
}
