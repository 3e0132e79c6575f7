package com.kotsin.turnengine.dice;

import java.util.List;

/**
 * Source of randomness. Implementations return faces in descending order.
 */
public interface DiceRoller {

    /**
     * Roll {@code count} six-sided dice.
     */
    List<Integer> roll(int count);

    /**
     * Roll two six-sided dice and keep the lower one.
     */
    int rollKeepLowest();

    default int rollDie() {
        return roll(1).get(0);
    }
}
