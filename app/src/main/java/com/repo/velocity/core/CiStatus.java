package com.repo.velocity.core;

/**
 * Outcome of the CI run attached to a pull request.
 */
public enum CiStatus {
    SUCCESS,
    FAILURE,
    PENDING;

    public static CiStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return switch (value.trim().toLowerCase()) {
            case "success", "passed" -> SUCCESS;
            case "failure", "failed", "error" -> FAILURE;
            default -> PENDING;
        };
    }
}
