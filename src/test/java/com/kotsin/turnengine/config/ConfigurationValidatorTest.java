package com.kotsin.turnengine.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigurationValidator
 *
 * Tests cover:
 * - Defaults are valid
 * - Each rule table error is reported
 * - Startup fails fast on invalid configuration
 */
@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

    private GameRulesConfig rules;
    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        rules = new GameRulesConfig();
        validator = new ConfigurationValidator(rules);
    }

    @Test
    @DisplayName("Defaults: no errors")
    void testValidate_Defaults() {
        assertTrue(validator.validate().isEmpty());
        assertDoesNotThrow(validator::validateConfiguration);
    }

    @Test
    @DisplayName("Momentum: start above max is rejected")
    void testValidate_StartAboveMax() {
        rules.getMomentum().setStart(11);

        List<String> errors = validator.validate();

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("game.momentum.start"));
    }

    @Test
    @DisplayName("Clocks: zero-sized clocks and empty progress sizes are rejected")
    void testValidate_Clocks() {
        rules.getClocks().setHarmSegments(0);
        rules.getClocks().setAddictionSegments(-1);
        rules.getClocks().setProgressSizes(List.of());

        assertEquals(3, validator.validate().size());
    }

    @Test
    @DisplayName("Startup: invalid configuration fails fast")
    void testValidateConfiguration_Throws() {
        rules.getClocks().setMaxHarmClocks(0);

        IllegalStateException ex = assertThrows(IllegalStateException.class, validator::validateConfiguration);
        assertTrue(ex.getMessage().startsWith("Invalid configuration"));
    }
}
