package com.kotsin.turnengine.config;

/**
 * Fixed rule constants that are not exposed as configuration.
 */
public final class GameConstants {

    private GameConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== DICE CONSTANTS ==========

    public static final int DIE_FACES = 6;
    public static final int CRITICAL_SIX_COUNT = 2;
    public static final int PARTIAL_MIN_FACE = 4;
    public static final int DESPERATE_ROLL_DICE = 2;

    // Legacy zero-pool approximations, used when exact derivation is disabled
    public static final double LEGACY_DESPERATE_SUCCESS = 0.0278;
    public static final double LEGACY_DESPERATE_PARTIAL = 0.3056;
    public static final double LEGACY_DESPERATE_FAILURE = 0.6667;

    // ========== APPROACH CONSTANTS ==========

    public static final int MIN_APPROACH_RATING = 0;
    public static final int MAX_APPROACH_RATING = 4;

    // ========== IMPROVEMENT COSTS ==========

    public static final int PUSH_COST = 1;
    public static final int FLASHBACK_COST = 1;
    public static final int TRAIT_TRANSACTION_COST = 1;
    public static final int EQUIPMENT_FIRST_LOCK_COST = 1;
    public static final int PUSH_DICE_BONUS = 1;
    public static final int FLASHBACK_DICE_BONUS = 1;

    // ========== TRAIT CONSTANTS ==========

    public static final int CONSOLIDATE_TRAIT_COUNT = 3;
    public static final String ADDICT_TRAIT_NAME = "Addict";
    public static final String ADDICT_TRAIT_DESCRIPTION =
        "You are addicted to combat stims. Stims are locked for your entire crew.";
    public static final String ADDICTION_CLOCK_SUBTYPE = "Addiction";

    // ========== HISTORY CONSTANTS ==========

    public static final int COMMAND_VERSION = 1;
    public static final int SNAPSHOT_VERSION = 1;
}
