package com.kotsin.turnengine.exception;

/**
 * A required external id is missing, e.g. a crew clock requested for a character without a crew.
 */
public class EngineConfigurationException extends RuntimeException {

    public EngineConfigurationException(String message) {
        super(message);
    }
}
