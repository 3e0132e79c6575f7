package com.kotsin.turnengine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GameConstants - Validation Tests")
class GameConstantsTest {

    @Test
    @DisplayName("Should not be instantiable (utility class pattern)")
    void testUtilityClass() {
        assertThrows(InvocationTargetException.class, () -> {
            Constructor<GameConstants> constructor = GameConstants.class.getDeclaredConstructor();
            constructor.setAccessible(true);
            constructor.newInstance();
        });
    }

    @Test
    @DisplayName("Legacy desperate probabilities add up to 100%")
    void testLegacyDesperateTotal() {
        double total = GameConstants.LEGACY_DESPERATE_SUCCESS
            + GameConstants.LEGACY_DESPERATE_PARTIAL
            + GameConstants.LEGACY_DESPERATE_FAILURE;
        assertEquals(1.0, total, 0.001);
    }

    @Test
    @DisplayName("Outcome thresholds fit a six-sided die")
    void testDieThresholds() {
        assertEquals(6, GameConstants.DIE_FACES);
        assertTrue(GameConstants.PARTIAL_MIN_FACE < GameConstants.DIE_FACES);
        assertTrue(GameConstants.CRITICAL_SIX_COUNT >= 2);
    }
}
