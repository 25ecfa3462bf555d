package com.repo.velocity.core;

import java.util.Arrays;
import java.util.List;

/**
 * Descriptive statistics over small numeric samples.
 * All methods are total: empty input yields 0 rather than NaN.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double sum(List<? extends Number> values) {
        double total = 0;
        for (Number v : values) {
            total += v.doubleValue();
        }
        return total;
    }

    public static double mean(List<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        return sum(values) / values.size();
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double sampleStdDev(List<? extends Number> values) {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0;
        for (Number v : values) {
            double d = v.doubleValue() - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (n - 1));
    }

    public static double median(List<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double[] sorted = sortedCopy(values);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }

    /**
     * Quantile by linear interpolation between closest ranks, position {@code (n - 1) * p}.
     *
     * @param values sample, need not be sorted
     * @param p      probability in [0, 1]
     */
    public static double quantile(List<? extends Number> values, double p) {
        if (values.isEmpty()) {
            return 0.0;
        }
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("quantile probability must be in [0, 1]: " + p);
        }
        double[] sorted = sortedCopy(values);
        double position = (sorted.length - 1) * p;
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Division with the denominator floored to 1, so a zero count never raises or yields NaN.
     */
    public static double guardedRatio(double numerator, double denominator) {
        return numerator / Math.max(denominator, 1.0);
    }

    private static double[] sortedCopy(List<? extends Number> values) {
        double[] copy = new double[values.size()];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = values.get(i).doubleValue();
        }
        Arrays.sort(copy);
        return copy;
    }
}
