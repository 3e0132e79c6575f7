package com.kotsin.turnengine.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the rule tables on startup and fails fast when they are inconsistent.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final GameRulesConfig rules;

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        log.info("Validating game rules configuration...");

        List<String> errors = validate();

        if (!errors.isEmpty()) {
            log.error("Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Invalid configuration: " + String.join(", ", errors));
        }

        log.info("Game rules validated: momentum {}/{}, harm clocks {} x {} segments",
            rules.getMomentum().getStart(), rules.getMomentum().getMax(),
            rules.getClocks().getMaxHarmClocks(), rules.getClocks().getHarmSegments());
    }

    List<String> validate() {
        List<String> errors = new ArrayList<>();

        GameRulesConfig.Momentum momentum = rules.getMomentum();
        if (momentum.getMax() <= 0) {
            errors.add("game.momentum.max must be positive");
        }
        if (momentum.getStart() < 0 || momentum.getStart() > momentum.getMax()) {
            errors.add("game.momentum.start must be within [0, game.momentum.max]");
        }
        if (momentum.getRallyThreshold() < 0 || momentum.getRallyThreshold() > momentum.getMax()) {
            errors.add("game.momentum.rally-threshold must be within [0, game.momentum.max]");
        }
        if (momentum.getLeanIntoTraitGain() < 0) {
            errors.add("game.momentum.lean-into-trait-gain must not be negative");
        }

        GameRulesConfig.Clocks clocks = rules.getClocks();
        if (clocks.getHarmSegments() <= 0) {
            errors.add("game.clocks.harm-segments must be positive");
        }
        if (clocks.getAddictionSegments() <= 0) {
            errors.add("game.clocks.addiction-segments must be positive");
        }
        if (clocks.getMaxHarmClocks() < 1) {
            errors.add("game.clocks.max-harm-clocks must be at least 1");
        }
        if (clocks.getProgressSizes() == null || clocks.getProgressSizes().isEmpty()) {
            errors.add("game.clocks.progress-sizes must not be empty");
        } else if (clocks.getProgressSizes().stream().anyMatch(size -> size == null || size <= 0)) {
            errors.add("game.clocks.progress-sizes must only contain positive sizes");
        }

        return errors;
    }
}
