package com.kotsin.turnengine.model;

public enum EquipmentCategory {
    ACTIVE,
    PASSIVE,
    CONSUMABLE
}
