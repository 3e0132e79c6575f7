package com.kotsin.turnengine.dice;

public enum RollOutcome {
    CRITICAL,
    SUCCESS,
    PARTIAL,
    FAILURE;

    public boolean isSuccessful() {
        return this == CRITICAL || this == SUCCESS;
    }
}
