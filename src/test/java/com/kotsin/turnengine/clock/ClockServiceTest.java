package com.kotsin.turnengine.clock;

import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.exception.UnknownEntityException;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.GameClock;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.PlayerCharacter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClockService
 *
 * Tests cover:
 * - Clamping of add/set/clear
 * - Harm clock cap and re-labelling
 * - Derived dying and addiction lock queries
 */
@DisplayName("ClockService")
class ClockServiceTest {

    private ClockService clockService;
    private GameState state;

    @BeforeEach
    void setUp() {
        clockService = new ClockService(new GameRulesConfig());
        state = new GameState();
        state.getCharacters().put("a", PlayerCharacter.builder().id("a").build());
        state.getCharacters().put("b", PlayerCharacter.builder().id("b").build());
        state.getCrews().put("crew", Crew.builder().id("crew").memberIds(new ArrayList<>(List.of("a", "b"))).build());
    }

    private GameClock harm(String id, String owner) {
        return clockService.createClock(state, id, owner, ClockType.HARM, "Wounded", 0, null, null, 1L);
    }

    // ========== CREATION ==========

    @Test
    @DisplayName("Create: zero-filled with type defaults")
    void testCreate_Defaults() {
        GameClock harm = harm("h1", "a");
        GameClock addiction = clockService.createClock(state, "x1", "a", ClockType.ADDICTION, "Addiction", 0, null, null, 1L);

        assertEquals(0, harm.getSegments());
        assertEquals(6, harm.getMaxSegments());
        assertEquals(8, addiction.getMaxSegments());
        assertSame(harm, state.getClocks().get("h1"));
    }

    @Test
    @DisplayName("Create: progress clocks only in allowed sizes")
    void testCreate_ProgressSizes() {
        GameClock clock = clockService.createClock(state, "p1", "crew", ClockType.PROGRESS, "Heist", 12, null, null, 1L);
        assertEquals(12, clock.getMaxSegments());

        assertThrows(IllegalArgumentException.class,
            () -> clockService.createClock(state, "p2", "crew", ClockType.PROGRESS, "Heist", 5, null, null, 1L));
    }

    @Test
    @DisplayName("Create: one addiction clock per character")
    void testCreate_SingleAddictionClock() {
        clockService.createClock(state, "x1", "a", ClockType.ADDICTION, "Addiction", 0, null, null, 1L);

        assertThrows(IllegalStateException.class,
            () -> clockService.createClock(state, "x2", "a", ClockType.ADDICTION, "Addiction", 0, null, null, 1L));
    }

    @Test
    @DisplayName("Create: fourth harm clock re-labels the emptiest one")
    void testCreate_HarmCap() {
        harm("h1", "a");
        harm("h2", "a");
        harm("h3", "a");
        clockService.addSegments(state, "h1", 3, 2L);
        clockService.addSegments(state, "h3", 2, 2L);

        GameClock result = clockService.createClock(state, "h4", "a", ClockType.HARM, "Broken Arm", 0, null, null, 3L);

        assertEquals("h2", result.getId());
        assertEquals("Broken Arm", result.getSubtype());
        assertEquals(0, result.getSegments());
        assertFalse(state.getClocks().containsKey("h4"));
        assertEquals(3, state.clocksOwnedBy("a", ClockType.HARM).size());
    }

    @Test
    @DisplayName("Create: re-labelling keeps segments")
    void testCreate_HarmCapKeepsSegments() {
        harm("h1", "a");
        harm("h2", "a");
        harm("h3", "a");
        clockService.addSegments(state, "h1", 2, 2L);
        clockService.addSegments(state, "h2", 3, 2L);
        clockService.addSegments(state, "h3", 4, 2L);

        GameClock result = clockService.createClock(state, "h4", "a", ClockType.HARM, "Shaken", 0, null, null, 3L);

        assertEquals("h1", result.getId());
        assertEquals(2, result.getSegments());
    }

    // ========== SEGMENTS ==========

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 6, 7, 100, Integer.MAX_VALUE})
    @DisplayName("Add: never exceeds max")
    void testAddSegments_Clamped(int amount) {
        harm("h1", "a");
        GameClock clock = clockService.addSegments(state, "h1", amount, 2L);

        assertTrue(clock.getSegments() >= 0 && clock.getSegments() <= clock.getMaxSegments());
        assertEquals(Math.min(6, amount), clock.getSegments());
    }

    @Test
    @DisplayName("Add: excess is discarded, not carried")
    void testAddSegments_ExcessDiscarded() {
        harm("h1", "a");
        clockService.addSegments(state, "h1", 5, 2L);
        clockService.addSegments(state, "h1", 4, 3L);
        clockService.clearSegments(state, "h1", 1, 4L);

        assertEquals(5, state.getClocks().get("h1").getSegments());
    }

    @Test
    @DisplayName("Set and clear: clamped to [0, max]")
    void testSetAndClear_Clamped() {
        harm("h1", "a");

        assertEquals(6, clockService.setSegments(state, "h1", 42, 2L).getSegments());
        assertEquals(0, clockService.setSegments(state, "h1", -3, 2L).getSegments());
        clockService.setSegments(state, "h1", 2, 2L);
        assertEquals(0, clockService.clearSegments(state, "h1", 5, 3L).getSegments());
    }

    @Test
    @DisplayName("Add: negative amount rejected, unknown clock rejected")
    void testAddSegments_Invalid() {
        harm("h1", "a");
        assertThrows(IllegalArgumentException.class, () -> clockService.addSegments(state, "h1", -1, 2L));
        assertThrows(UnknownEntityException.class, () -> clockService.addSegments(state, "nope", 1, 2L));
    }

    // ========== QUERIES ==========

    @Test
    @DisplayName("Dying: derived from any full harm clock")
    void testIsDying() {
        harm("h1", "a");
        harm("h2", "a");
        assertFalse(clockService.isDying(state, "a"));

        clockService.addSegments(state, "h2", 6, 2L);
        assertTrue(clockService.isDying(state, "a"));

        clockService.clearSegments(state, "h2", 1, 3L);
        assertFalse(clockService.isDying(state, "a"));
    }

    @Test
    @DisplayName("Addiction: 5/8 to 8/8 is full and locks the whole crew")
    void testAddictionFull_LocksCrew() {
        clockService.createClock(state, "x1", "b", ClockType.ADDICTION, "Addiction", 0, null, null, 1L);
        clockService.setSegments(state, "x1", 5, 2L);
        assertFalse(clockService.isAddictionClockFull(state, "b"));
        assertFalse(clockService.isStimsLockedForCrew(state, state.getCrews().get("crew")));

        clockService.addSegments(state, "x1", 3, 3L);

        assertTrue(clockService.isAddictionClockFull(state, "b"));
        assertFalse(clockService.isAddictionClockFull(state, "a"));
        assertTrue(clockService.isStimsLockedForCrew(state, state.getCrews().get("crew")));
    }
}
