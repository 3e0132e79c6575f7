package com.kotsin.turnengine.dice;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RollResult {

    private int dicePool;

    /** Faces kept, highest first. A zero pool keeps a single die. */
    @Builder.Default
    private List<Integer> dice = new ArrayList<>();

    private RollOutcome outcome;

    /** True when the pool was empty and 2d6-keep-lowest was used */
    private boolean desperate;
}
