package com.kotsin.turnengine.store;

import com.kotsin.turnengine.command.CommandHistoryEntry;
import com.kotsin.turnengine.command.CommandTypes;
import com.kotsin.turnengine.command.Commands;
import com.kotsin.turnengine.dice.DiceRoller;
import com.kotsin.turnengine.exception.InsufficientMomentumException;
import com.kotsin.turnengine.exception.TurnStateException;
import com.kotsin.turnengine.model.Approach;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.model.turn.ConsequenceType;
import com.kotsin.turnengine.model.turn.TurnState;
import com.kotsin.turnengine.notification.NotificationPublisher;
import com.kotsin.turnengine.support.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static com.kotsin.turnengine.support.TestEngine.GM;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GameStateStore
 *
 * Tests cover:
 * - All-or-nothing batches
 * - History entry shape and ordering
 * - Replay determinism
 * - Pruning
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("GameStateStore")
class GameStateStoreTest {

    @Mock
    private DiceRoller diceRoller;

    @Mock
    private NotificationPublisher publisher;

    private TestEngine engine;
    private String crewId;
    private String characterId;

    @BeforeEach
    void setUp() {
        engine = new TestEngine(diceRoller, publisher);
        String[] ids = engine.crewWithMember("Nova", TestEngine.approaches(2, 1, 1, 0));
        crewId = ids[0];
        characterId = ids[1];
    }

    // ========== ATOMICITY ==========

    @Test
    @DisplayName("Batch: a failing command rolls back the whole batch")
    void testDispatch_AllOrNothing() {
        int historyBefore = engine.store.getHistory().size();

        assertThrows(InsufficientMomentumException.class, () -> engine.store.dispatch(List.of(
            Commands.addMomentum(crewId, 1),
            Commands.spendMomentum(crewId, 99)), GM));

        assertEquals(5, engine.store.getState().requireCrew(crewId).getCurrentMomentum());
        assertEquals(historyBefore, engine.store.getHistory().size());
    }

    @Test
    @DisplayName("Batch: an illegal transition is rejected without side effects")
    void testDispatch_IllegalTransition() {
        engine.turns.beginTurn(characterId, GM);

        assertThrows(TurnStateException.class, () -> engine.store.dispatch(List.of(
            Commands.addMomentum(crewId, 3),
            Commands.transition(characterId, TurnState.TURN_COMPLETE, "skip ahead")), GM));

        assertEquals(5, engine.store.getState().requireCrew(crewId).getCurrentMomentum());
        assertEquals(TurnState.DECISION_PHASE, engine.store.getState().requireTurn(characterId).getState());
    }

    @Test
    @DisplayName("State: callers receive a detached copy")
    void testGetState_Detached() {
        GameState copy = engine.store.getState();
        copy.requireCrew(crewId).setCurrentMomentum(0);
        copy.getCharacters().clear();

        assertEquals(5, engine.store.getState().requireCrew(crewId).getCurrentMomentum());
        assertTrue(engine.store.getState().getCharacters().containsKey(characterId));
    }

    // ========== HISTORY ==========

    @Test
    @DisplayName("History: one entry per command with id, user, version and shared batch timestamp")
    void testHistory_EntryShape() {
        engine.store.dispatch(List.of(Commands.addMomentum(crewId, 1), Commands.addMomentum(crewId, 1)), "player-1");

        List<CommandHistoryEntry> history = engine.store.getHistory();
        CommandHistoryEntry first = history.get(history.size() - 2);
        CommandHistoryEntry second = history.get(history.size() - 1);

        assertEquals(CommandTypes.CREW_ADD_MOMENTUM, first.getType());
        assertEquals("player-1", first.getUserId());
        assertEquals(1, first.getVersion());
        assertEquals(first.getTimestamp(), second.getTimestamp());
        assertNotEquals(first.getCommandId(), second.getCommandId());
        assertEquals(history.size(), history.stream().map(CommandHistoryEntry::getCommandId)
            .collect(Collectors.toCollection(HashSet::new)).size());
    }

    @Test
    @DisplayName("History: timestamps strictly increase between batches even on a frozen clock")
    void testHistory_MonotonicTimestamps() {
        engine.store.dispatch(Commands.addMomentum(crewId, 1), GM);
        engine.store.dispatch(Commands.addMomentum(crewId, 1), GM);

        List<CommandHistoryEntry> history = engine.store.getHistory();
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i).getTimestamp() >= history.get(i - 1).getTimestamp());
        }
        assertTrue(history.get(history.size() - 1).getTimestamp() > history.get(history.size() - 2).getTimestamp());
    }

    // ========== REPLAY ==========

    @Test
    @DisplayName("Replay: rebuilding from an empty state reproduces the live state")
    void testReplay_Deterministic() {
        when(diceRoller.roll(2)).thenReturn(List.of(5, 2), List.of(6, 3));
        when(diceRoller.rollDie()).thenReturn(3);
        when(diceRoller.roll(3)).thenReturn(List.of(6, 6, 1));

        engine.roster.addTrait(characterId, "Fixer", TraitCategory.ROLE, GM);
        engine.turns.beginTurn(characterId, GM);
        engine.turns.selectApproach(characterId, Approach.FORCE, GM);
        engine.turns.commitRoll(characterId, GM);
        engine.stims.useStims(characterId, GM);
        engine.turns.completeSuccess(characterId, GM);
        engine.turns.endTurn(characterId, GM);

        engine.clock.advance(10_000);
        engine.turns.beginTurn(characterId, GM);
        engine.turns.selectSynergy(characterId, Approach.FORCE, Approach.GUILE, GM);
        engine.turns.commitRoll(characterId, GM);

        GameState live = engine.store.getState();
        GameState replayed = engine.store.replay(engine.store.getHistory());

        assertEquals(live, replayed);
    }

    // ========== PRUNING ==========

    @Test
    @DisplayName("Prune: second prune is a no-op")
    void testPruneHistory_Idempotent() {
        assertTrue(engine.store.pruneHistory() > 0);
        GameState afterFirst = engine.store.getState();

        assertEquals(0, engine.store.pruneHistory());
        assertTrue(engine.store.getHistory().isEmpty());
        assertEquals(afterFirst, engine.store.getState());
    }

    @Test
    @DisplayName("Prune orphaned: drops commands for deleted entities, keeps deletions")
    void testPruneOrphaned() {
        String other = engine.roster.createCharacter("Ghost", TestEngine.approaches(1, 1, 1, 1), GM);
        engine.roster.addTrait(other, "Doomed", TraitCategory.SCAR, GM);
        engine.clocks.createClock(other, ClockType.HARM, "Wounded", 0, null, null, GM);
        engine.roster.deleteCharacter(other, GM);

        int removed = engine.store.pruneOrphanedHistory();

        assertEquals(3, removed);
        List<String> types = engine.store.getHistory().stream().map(CommandHistoryEntry::getType).collect(Collectors.toList());
        assertTrue(types.contains(CommandTypes.CHARACTER_DELETE));
        assertTrue(types.contains(CommandTypes.CREW_CREATE));
        assertEquals(0, engine.store.pruneOrphanedHistory());
        assertEquals(engine.store.getState(), engine.store.replay(engine.store.getHistory()));
    }

    @Test
    @DisplayName("Prune orphaned: an untouched history loses nothing")
    void testPruneOrphaned_NothingToDrop() {
        int before = engine.store.getHistory().size();
        assertEquals(0, engine.store.pruneOrphanedHistory());
        assertEquals(before, engine.store.getHistory().size());
    }

    @Test
    @DisplayName("Replay: consequence commit replays to the same clocks and momentum")
    void testReplay_Consequence() {
        when(diceRoller.roll(2)).thenReturn(List.of(3, 1));

        engine.turns.beginTurn(characterId, GM);
        engine.turns.selectApproach(characterId, Approach.FORCE, GM);
        engine.turns.commitRoll(characterId, GM);
        engine.turns.selectConsequenceType(characterId, ConsequenceType.HARM, GM);
        engine.turns.createHarmClock(characterId, "Bleeding", GM);
        engine.turns.acceptConsequence(characterId, GM);

        assertEquals(engine.store.getState(), engine.store.replay(engine.store.getHistory()));
    }
}
