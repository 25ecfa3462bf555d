package com.repo.velocity.forecast;

/**
 * Next-period projection of one weekly metric.
 */
public record ForecastResult(
        ForecastMetric metric,
        /** Projected value for the next week, never negative */
        double predictedValue,
        Confidence confidence,
        TrendDirection trendDirection,
        ForecastRange range,
        /** Fitted change per week */
        double slope,
        /** Sample standard deviation of the fit residuals */
        double residualStdDev,
        int dataPoints,
        /** Why a fallback was used; null for a fitted forecast */
        String reason) {

    public boolean isFallback() {
        return reason != null;
    }

    public static ForecastResult fallback(ForecastMetric metric, double value, int dataPoints, String reason) {
        return new ForecastResult(metric, value, Confidence.LOW, TrendDirection.STABLE,
                metric.rangeAround(value), 0.0, 0.0, dataPoints, reason);
    }
}
