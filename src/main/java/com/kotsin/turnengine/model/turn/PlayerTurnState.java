package com.kotsin.turnengine.model.turn;

import com.kotsin.turnengine.dice.RollOutcome;
import com.kotsin.turnengine.exception.TurnStateException;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.Approach;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * PlayerTurnState - one character's turn in flight.
 *
 * Position and effect are the GM-set base values. Improvements are kept as flags
 * so the effective values can always be recomputed; they are never written back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerTurnState {

    private String characterId;
    private TurnState state;

    // Action
    @Builder.Default
    private RollMode rollMode = RollMode.STANDARD;
    private Approach primaryApproach;
    private Approach secondaryApproach;

    @Builder.Default
    private Position position = Position.RISKY;
    @Builder.Default
    private Effect effect = Effect.STANDARD;

    // Improvements
    private boolean pushed;
    private PushType pushType;
    private boolean flashbackApplied;
    private TraitTransaction traitTransaction;
    @Builder.Default
    private List<String> equipmentIds = new ArrayList<>();
    private boolean stimsUsed;

    private boolean gmApproved;

    // Roll
    private int dicePool;
    @Builder.Default
    private List<Integer> lastRoll = new ArrayList<>();
    private RollOutcome outcome;

    private ConsequenceTransaction consequence;

    private long stateEnteredAt;

    @Builder.Default
    private List<StateTransition> stateHistory = new ArrayList<>();

    public void transitionTo(TurnState newState, long timestamp, String reason) {
        if (!state.canTransitionTo(newState)) {
            throw new TurnStateException(characterId, state, newState);
        }
        StateTransition transition = StateTransition.builder()
            .fromState(this.state)
            .toState(newState)
            .timestamp(timestamp)
            .reason(reason)
            .build();
        this.stateHistory.add(transition);
        this.state = newState;
        this.stateEnteredAt = timestamp;
    }

    /**
     * Throws unless the turn is currently in one of {@code allowed}.
     */
    public void requireState(String operation, TurnState... allowed) {
        for (TurnState candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new TurnStateException("Cannot " + operation + " for " + characterId + " in state " + state);
    }
}
