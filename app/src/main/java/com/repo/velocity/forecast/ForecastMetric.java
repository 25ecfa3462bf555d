package com.repo.velocity.forecast;

import com.repo.velocity.core.AnalyticsConfig;

/**
 * Metric being forecast. Range multipliers are fixed per metric; confidence
 * thresholds and fallback values come from the configuration.
 */
public enum ForecastMetric {
    CHURN("churn", 0.7, 1.4) {
        @Override
        double highConfidenceStdDev(AnalyticsConfig config) {
            return config.getChurnHighConfidenceStdDev();
        }

        @Override
        double mediumConfidenceStdDev(AnalyticsConfig config) {
            return config.getChurnMediumConfidenceStdDev();
        }

        @Override
        double fallback(AnalyticsConfig config) {
            return config.getChurnFallback();
        }
    },
    CYCLE_TIME("cycle_time", 0.85, 1.25) {
        @Override
        double highConfidenceStdDev(AnalyticsConfig config) {
            return config.getCycleTimeHighConfidenceStdDev();
        }

        @Override
        double mediumConfidenceStdDev(AnalyticsConfig config) {
            return config.getCycleTimeMediumConfidenceStdDev();
        }

        @Override
        double fallback(AnalyticsConfig config) {
            return config.getCycleTimeFallbackHours();
        }
    };

    private final String code;
    private final double optimisticFactor;
    private final double pessimisticFactor;

    ForecastMetric(String code, double optimisticFactor, double pessimisticFactor) {
        this.code = code;
        this.optimisticFactor = optimisticFactor;
        this.pessimisticFactor = pessimisticFactor;
    }

    public String code() {
        return code;
    }

    public double optimisticFactor() {
        return optimisticFactor;
    }

    public double pessimisticFactor() {
        return pessimisticFactor;
    }

    ForecastRange rangeAround(double forecast) {
        return new ForecastRange(forecast * optimisticFactor, forecast * pessimisticFactor);
    }

    abstract double highConfidenceStdDev(AnalyticsConfig config);

    abstract double mediumConfidenceStdDev(AnalyticsConfig config);

    abstract double fallback(AnalyticsConfig config);
}
