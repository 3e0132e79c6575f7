package com.kotsin.turnengine.model.turn;

public enum ConsequenceType {
    HARM,
    CREW_CLOCK,
    SUCCESS_CLOCK
}
