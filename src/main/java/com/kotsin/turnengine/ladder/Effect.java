package com.kotsin.turnengine.ladder;

/**
 * Magnitude of benefit on success, declared worst to best.
 */
public enum Effect {
    LIMITED(-1, 1),
    STANDARD(0, 2),
    GREAT(1, 4),
    SPECTACULAR(2, 6);

    private final int progressModifier;
    private final int reductionSegments;

    Effect(int progressModifier, int reductionSegments) {
        this.progressModifier = progressModifier;
        this.reductionSegments = reductionSegments;
    }

    public int getProgressModifier() {
        return progressModifier;
    }

    /**
     * Segments removed when this effect is spent clearing harm or threat.
     */
    public int getReductionSegments() {
        return reductionSegments;
    }

    public Effect improve() {
        return Ladder.shift(this, 1);
    }

    public Effect improve(int steps) {
        return Ladder.shift(this, steps);
    }

    public Effect worsen() {
        return Ladder.shift(this, -1);
    }

    public Effect worsen(int steps) {
        return Ladder.shift(this, -steps);
    }

    public boolean isWorst() {
        return Ladder.isBottom(this);
    }
}
