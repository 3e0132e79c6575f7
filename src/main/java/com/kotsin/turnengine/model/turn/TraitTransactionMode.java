package com.kotsin.turnengine.model.turn;

public enum TraitTransactionMode {
    /** Use a trait the character already has */
    EXISTING,
    /** Create a flashback trait */
    NEW,
    /** Fold three traits into one grouped trait */
    CONSOLIDATE
}
