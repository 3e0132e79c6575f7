package com.kotsin.turnengine.dice;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chance of each outcome for a pool size, as fractions in [0, 1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeProbabilities {

    private int dicePool;
    private double critical;
    private double success;
    private double partial;
    private double failure;

    public double total() {
        return critical + success + partial + failure;
    }

    // ========== Percentages rounded to one decimal ==========

    public double criticalPercent() {
        return toPercent(critical);
    }

    public double successPercent() {
        return toPercent(success);
    }

    public double partialPercent() {
        return toPercent(partial);
    }

    public double failurePercent() {
        return toPercent(failure);
    }

    private static double toPercent(double fraction) {
        return Math.round(fraction * 1000.0) / 10.0;
    }
}
