package com.repo.velocity.rules;

import com.repo.velocity.core.AnalysisWarning;

import java.util.List;

/**
 * Quartiles, fences and the commits outside them.
 */
public record OutlierReport(
        double q1,
        double q3,
        double lowerFence,
        double upperFence,
        List<ChurnOutlier> outliers,
        List<AnalysisWarning> warnings) {

    public OutlierReport {
        outliers = List.copyOf(outliers);
        warnings = List.copyOf(warnings);
    }

    public double iqr() {
        return q3 - q1;
    }

    public static OutlierReport empty(List<AnalysisWarning> warnings) {
        return new OutlierReport(0.0, 0.0, 0.0, 0.0, List.of(), warnings);
    }
}
