package com.repo.velocity.rules;

/**
 * Named contributors to a risk score.
 */
public enum RiskFactor {
    HIGH_CHURN("high_churn"),
    MANY_FILES("many_files"),
    HIGH_DELETION_RATIO("high_deletion_ratio"),
    MASSIVE_COMMIT("massive_commit"),
    LOW_REVIEW("low_review"),
    CI_FAILURE("ci_failure");

    private final String code;

    RiskFactor(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
