package com.kotsin.turnengine.ladder;

/**
 * Risk level of an action, declared worst to best.
 *
 * <p>{@code severity} is both the clock segments a consequence inflicts and the
 * momentum the crew banks for taking it.</p>
 */
public enum Position {
    IMPOSSIBLE(6, 6),
    DESPERATE(4, 5),
    RISKY(2, 3),
    CONTROLLED(1, 1);

    private final int severity;
    private final int progressBase;

    Position(int severity, int progressBase) {
        this.severity = severity;
        this.progressBase = progressBase;
    }

    public int getConsequenceSegments() {
        return severity;
    }

    public int getMomentumGain() {
        return severity;
    }

    /**
     * Segments a success clock advances before the effect modifier is applied.
     */
    public int getProgressBase() {
        return progressBase;
    }

    public Position improve() {
        return Ladder.shift(this, 1);
    }

    public Position improve(int steps) {
        return Ladder.shift(this, steps);
    }

    public Position worsen() {
        return Ladder.shift(this, -1);
    }

    public Position worsen(int steps) {
        return Ladder.shift(this, -steps);
    }

    public boolean isBest() {
        return Ladder.isTop(this);
    }
}
