package com.repo.velocity.forecast;

/**
 * Sign of the fitted slope.
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    static final double EPSILON = 1e-9;

    public static TrendDirection ofSlope(double slope) {
        if (slope > EPSILON) {
            return INCREASING;
        }
        if (slope < -EPSILON) {
            return DECREASING;
        }
        return STABLE;
    }
}
