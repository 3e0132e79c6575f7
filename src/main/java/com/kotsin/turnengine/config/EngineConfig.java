package com.kotsin.turnengine.config;

import com.kotsin.turnengine.dice.DiceRoller;
import com.kotsin.turnengine.dice.RandomDiceRoller;
import com.kotsin.turnengine.store.IdGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

/**
 * Collaborators the engine depends on but does not own: time, randomness and id generation.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public DiceRoller diceRoller() {
        return new RandomDiceRoller();
    }

    @Bean
    public IdGenerator idGenerator() {
        return () -> UUID.randomUUID().toString();
    }
}
