package com.kotsin.turnengine.turn;

import com.kotsin.turnengine.dice.RollResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StimsResult {

    private String addictionClockId;
    private int addictionRoll;
    private int addictionSegments;
    private int addictionMaxSegments;

    /** Addiction clock filled; no reroll happened */
    private boolean locked;

    /** The replacement roll, {@code null} when locked */
    private RollResult reroll;
}
