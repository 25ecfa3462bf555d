package com.repo.velocity.insights;

/**
 * A notable condition in the batch, phrased for a narrative or bot layer.
 */
public record Finding(
        Kind kind,
        /** Stable machine-readable code, e.g. {@code long_lead_time} */
        String code,
        /** Author name, or {@link #TEAM} for team-wide findings */
        String subject,
        String message,
        double value,
        double threshold) {

    public static final String TEAM = "team";

    public enum Kind {
        /** Unusual individual or activity pattern */
        ANOMALY,
        /** Team-level delivery risk */
        RISK
    }
}
