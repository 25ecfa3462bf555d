package com.repo.velocity.forecast;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
}
