package com.kotsin.turnengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule tables bound from the {@code game.*} namespace.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "game")
public class GameRulesConfig {

    private Momentum momentum = new Momentum();
    private Clocks clocks = new Clocks();
    private Dice dice = new Dice();
    private Turn turn = new Turn();

    @Data
    public static class Momentum {
        /** Momentum a crew starts with and returns to on reset */
        private int start = 5;
        /** Upper bound of the crew pool */
        private int max = 10;
        /** Rally is only possible at or below this value */
        private int rallyThreshold = 3;
        private int leanIntoTraitGain = 2;
    }

    @Data
    public static class Clocks {
        private int harmSegments = 6;
        private int addictionSegments = 8;
        /** Harm clocks a character can carry before the emptiest one is re-labelled */
        private int maxHarmClocks = 3;
        private List<Integer> progressSizes = new ArrayList<>(List.of(4, 6, 8, 12));
    }

    @Data
    public static class Dice {
        /**
         * Derive zero-pool probabilities from the 2d6-keep-lowest mechanic.
         * When false the legacy approximations are reported.
         */
        private boolean exactDesperateProbabilities = true;
    }

    @Data
    public static class Turn {
        private boolean requireGmApproval = false;
    }
}
