package com.kotsin.turnengine.dice;

import com.kotsin.turnengine.config.GameConstants;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

public class RandomDiceRoller implements DiceRoller {

    private final Random random;

    public RandomDiceRoller() {
        this(new SecureRandom());
    }

    public RandomDiceRoller(Random random) {
        this.random = random;
    }

    @Override
    public List<Integer> roll(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Cannot roll a negative number of dice: " + count);
        }
        List<Integer> faces = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            faces.add(random.nextInt(GameConstants.DIE_FACES) + 1);
        }
        faces.sort(Comparator.reverseOrder());
        return faces;
    }

    @Override
    public int rollKeepLowest() {
        List<Integer> pair = roll(GameConstants.DESPERATE_ROLL_DICE);
        return pair.get(pair.size() - 1);
    }
}
