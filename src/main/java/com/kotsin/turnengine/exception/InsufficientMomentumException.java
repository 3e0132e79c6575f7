package com.kotsin.turnengine.exception;

import lombok.Getter;

@Getter
public class InsufficientMomentumException extends RuntimeException {

    private final String crewId;
    private final int requested;
    private final int available;

    public InsufficientMomentumException(String crewId, int requested, int available) {
        super("Crew " + crewId + " cannot spend " + requested + " momentum, only " + available + " available");
        this.crewId = crewId;
        this.requested = requested;
        this.available = available;
    }
}
