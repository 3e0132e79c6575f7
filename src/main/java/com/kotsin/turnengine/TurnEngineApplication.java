package com.kotsin.turnengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application hosting the turn-resolution rules engine.
 */
@SpringBootApplication
public class TurnEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TurnEngineApplication.class, args);
    }
}
