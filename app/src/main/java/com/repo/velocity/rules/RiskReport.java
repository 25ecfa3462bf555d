package com.repo.velocity.rules;

import com.repo.velocity.core.AnalysisWarning;

import java.util.List;

/**
 * Output of the risk stage: every assessment plus the three tier buckets and churn outliers.
 */
public record RiskReport(
        List<RiskAssessment> assessments,
        List<RiskAssessment> high,
        List<RiskAssessment> medium,
        List<RiskAssessment> low,
        OutlierReport outliers,
        List<AnalysisWarning> warnings) {

    public RiskReport {
        assessments = List.copyOf(assessments);
        high = List.copyOf(high);
        medium = List.copyOf(medium);
        low = List.copyOf(low);
        warnings = List.copyOf(warnings);
    }

    public int flaggedCount() {
        return high.size() + medium.size() + low.size();
    }

    public static RiskReport empty() {
        return new RiskReport(List.of(), List.of(), List.of(), List.of(), OutlierReport.empty(List.of()), List.of());
    }
}
