package com.kotsin.turnengine.model.turn;

public enum PushType {
    EXTRA_DIE,
    IMPROVED_EFFECT
}
