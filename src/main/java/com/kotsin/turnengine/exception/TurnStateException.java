package com.kotsin.turnengine.exception;

import com.kotsin.turnengine.model.turn.TurnState;

/**
 * Thrown when an operation is attempted from a turn state that does not permit it.
 */
public class TurnStateException extends RuntimeException {

    public TurnStateException(String message) {
        super(message);
    }

    public TurnStateException(String characterId, TurnState from, TurnState to) {
        super("Cannot transition turn of " + characterId + " from " + from + " to " + to);
    }
}
