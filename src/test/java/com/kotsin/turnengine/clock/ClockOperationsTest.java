package com.kotsin.turnengine.clock;

import com.kotsin.turnengine.dice.DiceRoller;
import com.kotsin.turnengine.exception.RuleViolationException;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.GameClock;
import com.kotsin.turnengine.model.PlayerCharacter;
import com.kotsin.turnengine.model.Trait;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.notification.NotificationPublisher;
import com.kotsin.turnengine.support.TestEngine;
import com.kotsin.turnengine.validation.ReasonCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.kotsin.turnengine.support.TestEngine.GM;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for ClockOperations
 *
 * Tests cover:
 * - Creation at the harm clock cap
 * - Reduction and recovery reporting
 * - Converting settled harm into a scar
 */
@DisplayName("ClockOperations")
class ClockOperationsTest {

    private TestEngine engine;
    private String characterId;

    @BeforeEach
    void setUp() {
        engine = new TestEngine(mock(DiceRoller.class), mock(NotificationPublisher.class));
        characterId = engine.crewWithMember("Nova", TestEngine.approaches(1, 1, 1, 1))[1];
    }

    @Test
    @DisplayName("Reduce: effect decides how many segments are cleared")
    void testReduceWithEffect() {
        String harm = engine.clocks.createClock(characterId, ClockType.HARM, "Burn", 0, null, null, GM);
        engine.clocks.setSegments(harm, 5, GM);

        assertEquals(3, engine.clocks.reduceWithEffect(harm, Effect.STANDARD, GM).getSegments());
        assertEquals(0, engine.clocks.reduceWithEffect(harm, Effect.SPECTACULAR, GM).getSegments());
    }

    @Test
    @DisplayName("Segments: additions stop at the maximum")
    void testAddSegments_Full() {
        String harm = engine.clocks.createClock(characterId, ClockType.HARM, "Burn", 0, null, null, GM);

        GameClock clock = engine.clocks.addSegments(harm, 9, GM);

        assertEquals(6, clock.getSegments());
        assertTrue(engine.clocks.isFull(harm));
    }

    @Test
    @DisplayName("Delete: a deleted clock is gone, deleting again is harmless")
    void testDeleteClock() {
        String harm = engine.clocks.createClock(characterId, ClockType.HARM, "Burn", 0, null, null, GM);

        engine.clocks.deleteClock(harm, GM);
        engine.clocks.deleteClock(harm, GM);

        assertFalse(engine.store.getState().getClocks().containsKey(harm));
    }

    @Test
    @DisplayName("Create: at the harm cap the returned id is the re-labelled clock")
    void testCreateClock_HarmCapReturnsExistingId() {
        String a = engine.clocks.createClock(characterId, ClockType.HARM, "Cut", 0, null, null, GM);
        String b = engine.clocks.createClock(characterId, ClockType.HARM, "Burn", 0, null, null, GM);
        String c = engine.clocks.createClock(characterId, ClockType.HARM, "Shock", 0, null, null, GM);
        engine.clocks.setSegments(a, 2, GM);
        engine.clocks.setSegments(c, 4, GM);

        String fourth = engine.clocks.createClock(characterId, ClockType.HARM, "Concussion", 0, null, null, GM);

        assertEquals(b, fourth);
        assertEquals("Concussion", engine.store.getState().requireClock(fourth).getSubtype());
        assertEquals(3, engine.store.getState().clocksOwnedBy(characterId, ClockType.HARM).size());
    }

    @Test
    @DisplayName("Recover: reports segments actually cleared and whether the clock emptied")
    void testRecover() {
        String harm = engine.clocks.createClock(characterId, ClockType.HARM, "Burn", 0, null, null, GM);
        engine.clocks.setSegments(harm, 3, GM);

        ClockRecovery partial = engine.clocks.recover(harm, 2, GM);
        assertEquals(2, partial.getSegmentsCleared());
        assertEquals(1, partial.getNewSegments());
        assertFalse(partial.isClockCleared());

        ClockRecovery rest = engine.clocks.recover(harm, 5, GM);
        assertEquals(1, rest.getSegmentsCleared());
        assertEquals(0, rest.getNewSegments());
        assertTrue(rest.isClockCleared());
    }

    @Test
    @DisplayName("Scar: a full harm clock becomes a scar trait and is deleted")
    void testConvertToScar_Full() {
        String harm = engine.clocks.createClock(characterId, ClockType.HARM, "Burn", 0, null, null, GM);
        engine.clocks.setSegments(harm, 6, GM);

        String traitId = engine.clocks.convertToScar(characterId, harm, "Burn-scarred hands", GM);

        PlayerCharacter character = engine.store.getState().requireCharacter(characterId);
        Trait scar = character.findTrait(traitId).orElseThrow();
        assertEquals("Burn-scarred hands", scar.getName());
        assertEquals(TraitCategory.SCAR, scar.getCategory());
        assertFalse(engine.store.getState().getClocks().containsKey(harm));
    }

    @Test
    @DisplayName("Scar: an empty harm clock converts, named after its subtype by default")
    void testConvertToScar_EmptyUsesSubtype() {
        String harm = engine.clocks.createClock(characterId, ClockType.HARM, "Broken rib", 0, null, null, GM);

        String traitId = engine.clocks.convertToScar(characterId, harm, null, GM);

        assertEquals("Broken rib",
            engine.store.getState().requireCharacter(characterId).findTrait(traitId).orElseThrow().getName());
    }

    @Test
    @DisplayName("Scar: refused while the harm clock is partly filled")
    void testConvertToScar_InProgress() {
        String harm = engine.clocks.createClock(characterId, ClockType.HARM, "Burn", 0, null, null, GM);
        engine.clocks.setSegments(harm, 3, GM);
        int traitsBefore = engine.store.getState().requireCharacter(characterId).getTraits().size();

        RuleViolationException e = assertThrows(RuleViolationException.class,
            () -> engine.clocks.convertToScar(characterId, harm, "Scar", GM));

        assertEquals(ReasonCode.HARM_CLOCK_IN_PROGRESS, e.getReason());
        assertTrue(engine.store.getState().getClocks().containsKey(harm));
        assertEquals(traitsBefore, engine.store.getState().requireCharacter(characterId).getTraits().size());
    }

    @Test
    @DisplayName("Scar: only harm clocks owned by the character convert")
    void testConvertToScar_NotHarm() {
        String addiction = engine.clocks.createClock(characterId, ClockType.ADDICTION, null, 0, null, null, GM);

        RuleViolationException e = assertThrows(RuleViolationException.class,
            () -> engine.clocks.convertToScar(characterId, addiction, "Scar", GM));

        assertEquals(ReasonCode.NOT_A_HARM_CLOCK, e.getReason());
    }
}
