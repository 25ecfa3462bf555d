package com.repo.velocity.rules;

import com.repo.velocity.core.AnalyticsConfig;

/**
 * Bucket for a risk score. {@link #NONE} marks unflagged items (score 0),
 * which are left out of every bucket.
 */
public enum RiskTier {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    public static RiskTier forScore(int score, AnalyticsConfig config) {
        if (score >= config.getHighTierMinScore()) {
            return HIGH;
        }
        if (score >= config.getMediumTierMinScore()) {
            return MEDIUM;
        }
        if (score > 0) {
            return LOW;
        }
        return NONE;
    }
}
