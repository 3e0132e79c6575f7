package com.kotsin.turnengine.clock;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of clearing segments from a clock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClockRecovery {

    private String clockId;
    private int segmentsCleared;
    private int newSegments;
    private boolean clockCleared;
}
