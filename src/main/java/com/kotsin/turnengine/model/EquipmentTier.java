package com.kotsin.turnengine.model;

public enum EquipmentTier {
    COMMON(false),
    UNCOMMON(false),
    RARE(true),
    EPIC(true);

    // Rare gear costs momentum the first time it is locked into a roll
    private final boolean firstLockCost;

    EquipmentTier(boolean firstLockCost) {
        this.firstLockCost = firstLockCost;
    }

    public boolean hasFirstLockCost() {
        return firstLockCost;
    }
}
