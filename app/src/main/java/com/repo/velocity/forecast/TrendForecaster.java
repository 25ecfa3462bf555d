package com.repo.velocity.forecast;

import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.core.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects the next week of a weekly series with an ordinary least-squares
 * line fitted against the week index.
 *
 * <p>The fit is closed-form, so identical input always yields identical output.
 * Series with fewer than two usable points get the metric's fallback value at
 * low confidence instead of an exception.
 */
public class TrendForecaster {

    public static final String STAGE = "forecast";

    private static final Logger log = LoggerFactory.getLogger(TrendForecaster.class);

    private final AnalyticsConfig config;

    public TrendForecaster(AnalyticsConfig config) {
        this.config = config;
    }

    /**
     * @param weeklyValues observations in time order, oldest first; null and
     *                     non-finite entries are ignored
     * @param metric       what the series measures
     */
    public ForecastResult forecast(List<Double> weeklyValues, ForecastMetric metric) {
        List<Double> values = usable(weeklyValues);

        if (values.size() < 2) {
            String reason = "need at least 2 weekly data points, got " + values.size();
            log.debug("{} forecast falls back: {}", metric.code(), reason);
            return fallback(metric, values.size(), reason);
        }

        int n = values.size();
        double xMean = (n - 1) / 2.0;
        double yMean = Statistics.mean(values);

        double sxy = 0;
        double sxx = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            sxy += dx * (values.get(i) - yMean);
            sxx += dx * dx;
        }
        double slope = sxy / sxx;
        double intercept = yMean - slope * xMean;

        List<Double> residuals = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            residuals.add(values.get(i) - (intercept + slope * i));
        }
        double residualStdDev = Statistics.sampleStdDev(residuals);

        double predicted = Math.max(0.0, values.get(n - 1) + slope);
        Confidence confidence = confidence(metric, residualStdDev, n);

        log.debug("{} forecast: slope={} predicted={} residualStdDev={} confidence={}",
                metric.code(), slope, predicted, residualStdDev, confidence);

        return new ForecastResult(
                metric,
                predicted,
                confidence,
                TrendDirection.ofSlope(slope),
                metric.rangeAround(predicted),
                slope,
                residualStdDev,
                n,
                null);
    }

    // Two points always fit exactly, so a zero residual says nothing about stability
    private Confidence confidence(ForecastMetric metric, double residualStdDev, int dataPoints) {
        Confidence confidence;
        if (residualStdDev < metric.highConfidenceStdDev(config)) {
            confidence = Confidence.HIGH;
        } else if (residualStdDev < metric.mediumConfidenceStdDev(config)) {
            confidence = Confidence.MEDIUM;
        } else {
            confidence = Confidence.LOW;
        }
        if (dataPoints == 2 && confidence == Confidence.HIGH) {
            return Confidence.MEDIUM;
        }
        return confidence;
    }

    private static List<Double> usable(List<Double> weeklyValues) {
        List<Double> values = new ArrayList<>();
        if (weeklyValues == null) {
            return values;
        }
        for (Double value : weeklyValues) {
            if (value != null && Double.isFinite(value)) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Low-confidence result at the metric's configured fallback value.
     */
    public ForecastResult fallback(ForecastMetric metric, int dataPoints, String reason) {
        return ForecastResult.fallback(metric, metric.fallback(config), dataPoints, reason);
    }
}
