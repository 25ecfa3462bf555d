package com.repo.velocity.forecast;

import com.repo.velocity.core.AnalyticsConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrendForecasterTest {

    private final TrendForecaster forecaster = new TrendForecaster(AnalyticsConfig.defaults());

    @Test
    void testLinearChurnSeries() {
        ForecastResult result = forecaster.forecast(List.of(100.0, 120.0, 140.0, 160.0), ForecastMetric.CHURN);

        assertEquals(20.0, result.slope(), 1e-9);
        assertEquals(180.0, result.predictedValue(), 1e-9);
        assertEquals(TrendDirection.INCREASING, result.trendDirection());
        assertEquals(Confidence.HIGH, result.confidence());
        assertEquals(126.0, result.range().optimistic(), 1e-9);
        assertEquals(252.0, result.range().pessimistic(), 1e-9);
        assertEquals(4, result.dataPoints());
        assertFalse(result.isFallback());
    }

    @Test
    void testForecastIsClampedAtZero() {
        ForecastResult result = forecaster.forecast(List.of(300.0, 200.0, 100.0, 0.0), ForecastMetric.CHURN);

        assertEquals(-100.0, result.slope(), 1e-9);
        assertEquals(0.0, result.predictedValue());
        assertEquals(TrendDirection.DECREASING, result.trendDirection());
    }

    @Test
    void testFlatSeriesIsStable() {
        ForecastResult result = forecaster.forecast(List.of(50.0, 50.0, 50.0), ForecastMetric.CYCLE_TIME);
        assertEquals(TrendDirection.STABLE, result.trendDirection());
        assertEquals(50.0, result.predictedValue(), 1e-9);
    }

    @Test
    void testTwoPointsCapConfidenceAtMedium() {
        ForecastResult result = forecaster.forecast(List.of(10.0, 30.0), ForecastMetric.CHURN);
        assertEquals(50.0, result.predictedValue(), 1e-9);
        assertEquals(0.0, result.residualStdDev(), 1e-9);
        assertEquals(Confidence.MEDIUM, result.confidence());
    }

    @Test
    void testConfidenceFollowsResidualSpread() {
        ForecastResult medium = forecaster.forecast(List.of(0.0, 400.0, 0.0, 400.0, 0.0, 400.0), ForecastMetric.CHURN);
        assertEquals(Confidence.MEDIUM, medium.confidence());

        ForecastResult low = forecaster.forecast(List.of(0.0, 2000.0, 0.0, 2000.0, 0.0, 2000.0), ForecastMetric.CHURN);
        assertEquals(Confidence.LOW, low.confidence());
    }

    @Test
    void testFallbackForShortSeries() {
        ForecastResult empty = forecaster.forecast(List.of(), ForecastMetric.CHURN);
        assertEquals(1000.0, empty.predictedValue());
        assertEquals(Confidence.LOW, empty.confidence());
        assertEquals(TrendDirection.STABLE, empty.trendDirection());
        assertNotNull(empty.reason());
        assertTrue(empty.isFallback());

        ForecastResult single = forecaster.forecast(List.of(5.0), ForecastMetric.CYCLE_TIME);
        assertEquals(24.0, single.predictedValue());
        assertEquals(1, single.dataPoints());
        assertEquals(20.4, single.range().optimistic(), 1e-9);
        assertEquals(30.0, single.range().pessimistic(), 1e-9);

        ForecastResult none = forecaster.forecast(null, ForecastMetric.CHURN);
        assertTrue(none.isFallback());
    }

    @Test
    void testUnusableValuesAreIgnored() {
        ForecastResult result = forecaster.forecast(Arrays.asList(100.0, null, Double.NaN, 120.0), ForecastMetric.CHURN);
        assertEquals(2, result.dataPoints());
        assertEquals(140.0, result.predictedValue(), 1e-9);
    }

    @Test
    void testDeterministic() {
        List<Double> series = List.of(13.7, 9.1, 22.4, 18.9, 30.2, 27.5);
        ForecastResult first = forecaster.forecast(series, ForecastMetric.CYCLE_TIME);
        ForecastResult second = forecaster.forecast(series, ForecastMetric.CYCLE_TIME);
        assertEquals(first, second);
        assertEquals(Double.doubleToLongBits(first.predictedValue()), Double.doubleToLongBits(second.predictedValue()));
    }

    @Test
    void testRangeMultipliers() {
        assertEquals(0.7, ForecastMetric.CHURN.optimisticFactor());
        assertEquals(1.4, ForecastMetric.CHURN.pessimisticFactor());
        assertEquals(0.85, ForecastMetric.CYCLE_TIME.optimisticFactor());
        assertEquals(1.25, ForecastMetric.CYCLE_TIME.pessimisticFactor());
    }
}
