package com.kotsin.turnengine.model;

/**
 * Named rating a character draws dice from.
 */
public enum Approach {
    FORCE,
    GUILE,
    FOCUS,
    SPIRIT
}
