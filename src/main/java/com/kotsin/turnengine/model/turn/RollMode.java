package com.kotsin.turnengine.model.turn;

public enum RollMode {
    /** One approach */
    STANDARD,
    /** Two approaches summed */
    SYNERGY
}
