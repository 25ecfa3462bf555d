package com.repo.velocity.core;

public enum IncidentStatus {
    OPEN,
    RESOLVED
}
