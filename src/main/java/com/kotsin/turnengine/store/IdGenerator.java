package com.kotsin.turnengine.store;

/**
 * Produces ids for commands and the entities they create.
 */
@FunctionalInterface
public interface IdGenerator {
    String nextId();
}
