package com.kotsin.turnengine.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.turnengine.clock.ClockService;
import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.exception.TurnStateException;
import com.kotsin.turnengine.exception.UnknownEntityException;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.Approach;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.turn.StateTransition;
import com.kotsin.turnengine.model.turn.TurnState;
import com.kotsin.turnengine.momentum.MomentumEconomy;
import com.kotsin.turnengine.resolution.TraitTransactionResolver;
import com.kotsin.turnengine.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CommandApplier
 *
 * Tests cover:
 * - Entity creation and cascading deletes
 * - Tolerance of deletes for missing entities
 * - Guards on turn commands
 * - Unknown command types
 */
@DisplayName("CommandApplier")
class CommandApplierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CommandApplier applier;
    private GameState state;
    private long timestamp;

    @BeforeEach
    void setUp() {
        GameRulesConfig rules = new GameRulesConfig();
        applier = new CommandApplier(new ClockService(rules), new MomentumEconomy(rules),
            new TraitTransactionResolver(), objectMapper);
        state = new GameState();
        timestamp = 1_000L;

        apply(Commands.createCrew("crew-1", "Ghosts", 5));
        apply(Commands.createCharacter("char-1", "Nova", TestEngine.approaches(2, 1, 1, 0)));
        apply(Commands.addCrewMember("crew-1", "char-1"));
    }

    private void apply(Command command) {
        applier.apply(state, CommandHistoryEntry.builder()
            .commandId("cmd-" + timestamp)
            .type(command.getType())
            .payload(command.getPayload())
            .timestamp(timestamp++)
            .userId("gm")
            .version(1)
            .build());
    }

    @Test
    @DisplayName("Create: timestamps come from the history entry")
    void testCreate_UsesEntryTimestamp() {
        assertEquals(1_000L, state.requireCrew("crew-1").getCreatedAt());
        assertEquals(1_001L, state.requireCharacter("char-1").getCreatedAt());
        assertEquals(2, state.requireCharacter("char-1").rating(Approach.FORCE));
    }

    @Test
    @DisplayName("Create: approach ratings outside 0..4 are rejected")
    void testCreateCharacter_RatingOutOfRange() {
        assertThrows(IllegalArgumentException.class,
            () -> apply(Commands.createCharacter("char-2", "Titan", TestEngine.approaches(5, 0, 0, 0))));
        assertFalse(state.getCharacters().containsKey("char-2"));
    }

    @Test
    @DisplayName("Delete: character removal cascades to clocks, membership and turn")
    void testDeleteCharacter_Cascade() {
        apply(Commands.createClock("clock-1", "char-1", ClockType.HARM, "Cut", 6, null, null));
        apply(Commands.beginTurn("char-1", Position.RISKY, Effect.STANDARD));

        apply(Commands.deleteCharacter("char-1"));

        assertTrue(state.getClocks().isEmpty());
        assertTrue(state.getTurns().isEmpty());
        assertTrue(state.requireCrew("crew-1").getMemberIds().isEmpty());
    }

    @Test
    @DisplayName("Delete: crew removal takes its clocks along")
    void testDeleteCrew_Cascade() {
        apply(Commands.createClock("clock-1", "crew-1", ClockType.PROGRESS, "Alarm", 4, "threat", null));

        apply(Commands.deleteCrew("crew-1"));

        assertTrue(state.getCrews().isEmpty());
        assertTrue(state.getClocks().isEmpty());
        assertTrue(state.getCharacters().containsKey("char-1"));
    }

    @Test
    @DisplayName("Delete: deleting something that is already gone is a no-op")
    void testDelete_MissingEntities() {
        assertDoesNotThrow(() -> apply(Commands.deleteCharacter("ghost")));
        assertDoesNotThrow(() -> apply(Commands.deleteCrew("ghost")));
        assertDoesNotThrow(() -> apply(Commands.deleteClock("ghost")));
        assertEquals(1, state.getCharacters().size());
    }

    @Test
    @DisplayName("Turns: one turn per character")
    void testBeginTurn_Twice() {
        apply(Commands.beginTurn("char-1", Position.RISKY, Effect.STANDARD));

        assertThrows(TurnStateException.class,
            () -> apply(Commands.beginTurn("char-1", Position.RISKY, Effect.STANDARD)));
        assertEquals(TurnState.DECISION_PHASE, state.requireTurn("char-1").getState());
    }

    @Test
    @DisplayName("Turns: unknown character has no turn")
    void testBeginTurn_UnknownCharacter() {
        assertThrows(UnknownEntityException.class,
            () -> apply(Commands.beginTurn("nobody", Position.RISKY, Effect.STANDARD)));
    }

    @Test
    @DisplayName("Turns: transitions are recorded with reason and timestamp")
    void testTransition_History() {
        apply(Commands.beginTurn("char-1", Position.RISKY, Effect.STANDARD));
        apply(Commands.transition("char-1", TurnState.ROLLING, "roll committed"));

        List<StateTransition> history = state.requireTurn("char-1").getStateHistory();
        assertEquals(2, history.size());
        assertEquals(TurnState.DECISION_PHASE, history.get(1).getFromState());
        assertEquals(TurnState.ROLLING, history.get(1).getToState());
        assertEquals("roll committed", history.get(1).getReason());
    }

    @Test
    @DisplayName("Turns: idle transition discards the turn")
    void testTransition_IdleRemovesTurn() {
        apply(Commands.beginTurn("char-1", Position.RISKY, Effect.STANDARD));
        apply(Commands.transition("char-1", TurnState.IDLE_WAITING, "cancelled"));

        assertTrue(state.getTurns().isEmpty());
    }

    @Test
    @DisplayName("Unknown: unrecognised command types are rejected")
    void testApply_UnknownType() {
        CommandHistoryEntry entry = CommandHistoryEntry.builder()
            .commandId("cmd-x")
            .type("turns/teleport")
            .payload(objectMapper.createObjectNode().put("characterId", "char-1"))
            .timestamp(timestamp)
            .version(1)
            .build();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> applier.apply(state, entry));
        assertTrue(ex.getMessage().contains("turns/teleport"));
    }
}
