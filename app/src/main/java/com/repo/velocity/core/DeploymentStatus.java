package com.repo.velocity.core;

public enum DeploymentStatus {
    SUCCESS,
    FAILED,
    ROLLED_BACK;

    public boolean isFailure() {
        return this != SUCCESS;
    }

    /**
     * Lenient parse used at the ingestion boundary; returns null for unknown values.
     */
    public static DeploymentStatus parse(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase()) {
            case "success", "succeeded", "ok" -> SUCCESS;
            case "failed", "failure", "error" -> FAILED;
            case "rolled_back", "rollback", "reverted" -> ROLLED_BACK;
            default -> null;
        };
    }
}
