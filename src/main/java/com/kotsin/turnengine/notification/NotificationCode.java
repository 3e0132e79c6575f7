package com.kotsin.turnengine.notification;

public final class NotificationCode {

    private NotificationCode() {
        throw new UnsupportedOperationException("Constants class");
    }

    public static final String ROLL_RESOLVED = "roll-resolved";
    public static final String CONSEQUENCE_APPLIED = "consequence-applied";
    public static final String SUCCESS_CLOCK_ADVANCED = "success-clock-advanced";
    public static final String CHARACTER_DYING = "character-dying";
    public static final String STIMS_USED = "stims-used";
    public static final String STIMS_LOCKED = "stims-locked";
    public static final String RALLY_USED = "rally-used";
    public static final String LEANED_INTO_TRAIT = "leaned-into-trait";
    public static final String CREW_RESET = "crew-reset";
    public static final String TURN_CANCELLED = "turn-cancelled";
}
