package com.kotsin.turnengine.dice;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RandomDiceRoller")
class RandomDiceRollerTest {

    private final RandomDiceRoller roller = new RandomDiceRoller(new Random(42));

    @RepeatedTest(20)
    @DisplayName("Faces are within 1..6 and sorted highest first")
    void testRoll_SortedAndInRange() {
        List<Integer> faces = roller.roll(5);

        assertEquals(5, faces.size());
        for (int i = 0; i < faces.size(); i++) {
            assertTrue(faces.get(i) >= 1 && faces.get(i) <= 6);
            if (i > 0) {
                assertTrue(faces.get(i - 1) >= faces.get(i));
            }
        }
    }

    @RepeatedTest(20)
    @DisplayName("Keep-lowest returns a single face")
    void testRollKeepLowest() {
        int face = roller.rollKeepLowest();
        assertTrue(face >= 1 && face <= 6);
    }

    @Test
    @DisplayName("Negative count rejected")
    void testRoll_Negative() {
        assertThrows(IllegalArgumentException.class, () -> roller.roll(-1));
        assertTrue(roller.roll(0).isEmpty());
    }
}
