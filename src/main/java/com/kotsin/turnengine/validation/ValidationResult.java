package com.kotsin.turnengine.validation;

import com.kotsin.turnengine.exception.RuleViolationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a precondition check. Failures carry a stable reason code from {@link ReasonCode};
 * rendering that code for a player is the host's job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    private boolean valid;
    private String reason;

    // ========== Static Factory Methods ==========

    public static ValidationResult ok() {
        return ValidationResult.builder()
                .valid(true)
                .build();
    }

    public static ValidationResult fail(String reason) {
        return ValidationResult.builder()
                .valid(false)
                .reason(reason)
                .build();
    }

    /**
     * Escalate a failed check into an exception for callers that go straight to mutation.
     */
    public void orThrow(String context) {
        if (!valid) {
            throw new RuleViolationException(reason, context + ": " + reason);
        }
    }

    @Override
    public String toString() {
        return valid ? "VALID" : "INVALID: " + reason;
    }
}
