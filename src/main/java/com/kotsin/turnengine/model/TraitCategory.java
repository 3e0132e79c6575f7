package com.kotsin.turnengine.model;

public enum TraitCategory {
    ROLE,
    BACKGROUND,
    SCAR,
    FLASHBACK,
    GROUPED
}
