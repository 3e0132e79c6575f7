package com.kotsin.turnengine.model;

public enum ClockType {
    HARM,
    ADDICTION,
    PROGRESS
}
