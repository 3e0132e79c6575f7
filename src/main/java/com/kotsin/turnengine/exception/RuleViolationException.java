package com.kotsin.turnengine.exception;

import lombok.Getter;

/**
 * Raised by a mutating operation whose precondition check was skipped or failed.
 * Carries the same reason code the matching validation would have returned.
 */
@Getter
public class RuleViolationException extends RuntimeException {

    private final String reason;

    public RuleViolationException(String reason, String message) {
        super(message);
        this.reason = reason;
    }
}
