package com.kotsin.turnengine.model.turn;

import java.util.Set;

/**
 * States of one character's turn.
 *
 * DECISION_PHASE → ROLLING → SUCCESS_COMPLETE | GM_RESOLVING_CONSEQUENCE → APPLYING_EFFECTS
 * → TURN_COMPLETE → IDLE_WAITING, with the stims branch
 * GM_RESOLVING_CONSEQUENCE → STIMS_ROLLING → ROLLING | STIMS_LOCKED.
 */
public enum TurnState {
    IDLE_WAITING,
    DECISION_PHASE,
    ROLLING,
    SUCCESS_COMPLETE,
    GM_RESOLVING_CONSEQUENCE,
    APPLYING_EFFECTS,
    TURN_COMPLETE,
    STIMS_ROLLING,
    STIMS_LOCKED;

    public boolean canTransitionTo(TurnState next) {
        Set<TurnState> allowed = switch (this) {
            case IDLE_WAITING -> Set.of(DECISION_PHASE);
            case DECISION_PHASE -> Set.of(ROLLING, IDLE_WAITING);
            case ROLLING -> Set.of(SUCCESS_COMPLETE, GM_RESOLVING_CONSEQUENCE, IDLE_WAITING);
            case SUCCESS_COMPLETE -> Set.of(APPLYING_EFFECTS, TURN_COMPLETE, IDLE_WAITING);
            case GM_RESOLVING_CONSEQUENCE -> Set.of(APPLYING_EFFECTS, STIMS_ROLLING, STIMS_LOCKED, IDLE_WAITING);
            case STIMS_ROLLING -> Set.of(ROLLING, IDLE_WAITING);
            // The consequence that prompted the stims is still owed
            case STIMS_LOCKED -> Set.of(APPLYING_EFFECTS, IDLE_WAITING);
            case APPLYING_EFFECTS -> Set.of(TURN_COMPLETE);
            case TURN_COMPLETE -> Set.of(IDLE_WAITING);
        };
        return allowed.contains(next);
    }

    /**
     * Whether the turn can still be abandoned without side effects.
     */
    public boolean isCancellable() {
        return this != APPLYING_EFFECTS && this != TURN_COMPLETE && this != IDLE_WAITING;
    }

    public boolean awaitsConsequence() {
        return this == GM_RESOLVING_CONSEQUENCE || this == STIMS_LOCKED;
    }
}
