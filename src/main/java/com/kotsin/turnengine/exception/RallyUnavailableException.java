package com.kotsin.turnengine.exception;

public class RallyUnavailableException extends RuntimeException {

    public RallyUnavailableException(String message) {
        super(message);
    }
}
