package com.vikings.service;

import com.vikings.config.AIProperties;
import com.vikings.config.MapLoader;
import com.vikings.model.Army;
import com.vikings.model.BattleVerdict;
import com.vikings.model.Region;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SkirmishBattleService with fixed dice.
 */
class SkirmishBattleServiceTest {

    private WorldService world;
    private ArmyRosterService roster;
    private Army ivar;

    @BeforeEach
    void setUp() {
        MapLoader loader = new MapLoader(new ObjectMapper());
        loader.loadMaps();
        world = new WorldService(loader, "jutland");
        world.init();
        roster = new ArmyRosterService(loader, new AIProperties(), "jutland");
        roster.init();
        ivar = roster.findArmy("norse-1").orElseThrow();
    }

    /** Random that always rolls the same value. */
    private static Random fixed(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }

    private SkirmishBattleService battles(double roll) {
        return new SkirmishBattleService(world, roster, fixed(roll));
    }

    @Nested
    @DisplayName("shouldTriggerBattle()")
    class TriggerTests {

        @Test
        @DisplayName("own region should never trigger a battle")
        void shouldNotFightAtHome() {
            assertFalse(battles(0.5).shouldTriggerBattle(ivar, 0));
        }

        @Test
        @DisplayName("rival region should always trigger a battle")
        void shouldFightRival() {
            assertTrue(battles(0.5).shouldTriggerBattle(ivar, 8));
        }

        @Test
        @DisplayName("neutral region should trigger only when defended")
        void shouldFightDefendedNeutralOnly() {
            assertTrue(battles(0.5).shouldTriggerBattle(ivar, 2));
            assertFalse(battles(0.5).shouldTriggerBattle(ivar, 3));
        }
    }

    @Nested
    @DisplayName("startBattle()")
    class BattleTests {

        @Test
        @DisplayName("stronger attacker should win and clear the garrison")
        void shouldWin() throws Exception {
            // attack 40 * 1.0 against defense 8 * 1.0
            BattleVerdict verdict = battles(0.5).startBattle(ivar, 2).get();

            assertEquals(BattleVerdict.VICTORY, verdict);
            assertEquals(0, world.getRegion(2).getGarrison());
            assertEquals(36, ivar.getStrength());
        }

        @Test
        @DisplayName("stronghold bonus should make the defender prevail")
        void shouldLoseAgainstStronghold() throws Exception {
            Region hamburg = world.getRegion(10);
            hamburg.setGarrison(30);

            // attack 40 against defense 30 * 1.5
            BattleVerdict verdict = battles(0.5).startBattle(ivar, 10).get();

            assertEquals(BattleVerdict.DEFEAT, verdict);
            assertEquals(20, hamburg.getGarrison());
            assertEquals(20, ivar.getStrength());
        }

        @Test
        @DisplayName("equal rolls should be a draw and change nothing")
        void shouldDraw() throws Exception {
            Region hedeby = world.getRegion(2);
            hedeby.setGarrison(40);

            BattleVerdict verdict = battles(0.5).startBattle(ivar, 2).get();

            assertEquals(BattleVerdict.DRAW, verdict);
            assertEquals(40, hedeby.getGarrison());
            assertEquals(40, ivar.getStrength());
        }

        @Test
        @DisplayName("unknown army should be rejected")
        void shouldRejectUnknownArmy() {
            Army ghost = Army.builder().id("ghost").playerId("norse").build();

            assertThrows(IllegalArgumentException.class, () -> battles(0.5).startBattle(ghost, 2));
        }
    }
}
