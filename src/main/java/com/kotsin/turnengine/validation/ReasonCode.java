package com.kotsin.turnengine.validation;

/**
 * Stable reason identifiers returned by validation checks.
 */
public final class ReasonCode {

    private ReasonCode() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== TURN ==========

    public static final String NO_ACTIVE_TURN = "no-active-turn";
    public static final String INVALID_STATE = "invalid-state";
    public static final String NO_ACTION_SELECTED = "no-action-selected";
    public static final String SYNERGY_NEEDS_TWO_APPROACHES = "synergy-needs-two-approaches";
    public static final String INSUFFICIENT_MOMENTUM = "insufficient-momentum";
    public static final String GM_APPROVAL_REQUIRED = "gm-approval-required";
    public static final String UNKNOWN_EQUIPMENT = "unknown-equipment";
    public static final String EQUIPMENT_CONSUMED = "equipment-consumed";

    // ========== CONSEQUENCE ==========

    public static final String NO_CONSEQUENCE = "no-consequence";
    public static final String MISSING_HARM_TARGET = "missing-harm-target";
    public static final String MISSING_HARM_CLOCK = "missing-harm-clock";
    public static final String MISSING_CREW_CLOCK = "missing-crew-clock";
    public static final String MISSING_SUCCESS_CLOCK = "missing-success-clock";
    public static final String INVALID_CONSEQUENCE_CLOCK = "invalid-consequence-clock";
    public static final String DEFENSIVE_SUCCESS_UNAVAILABLE = "defensive-success-unavailable";

    // ========== CREW / MOMENTUM ==========

    public static final String NO_CREW = "no-crew";
    public static final String RALLY_USED = "rally-used";
    public static final String MOMENTUM_TOO_HIGH = "momentum-too-high";
    public static final String NO_AVAILABLE_TRAITS = "no-available-traits";
    public static final String TRAIT_NOT_DISABLED = "trait-not-disabled";

    // ========== TRAITS ==========

    public static final String NO_TRAIT_SELECTED = "no-trait-selected";
    public static final String TRAIT_NOT_FOUND = "trait-not-found";
    public static final String TRAIT_DISABLED = "trait-disabled";
    public static final String MISSING_TRAIT_NAME = "missing-trait-name";
    public static final String CONSOLIDATE_NEEDS_THREE = "consolidate-needs-three-traits";

    // ========== CLOCKS ==========

    public static final String NOT_A_HARM_CLOCK = "not-a-harm-clock";
    public static final String HARM_CLOCK_IN_PROGRESS = "harm-clock-in-progress";

    // ========== STIMS ==========

    public static final String STIMS_ALREADY_USED = "already-used";
    public static final String TEAM_ADDICTION_LOCKED = "team-addiction-locked";
}
