package com.repo.velocity.pipeline;

import com.repo.velocity.churn.AuthorChurnStats;
import com.repo.velocity.churn.ChurnSummary;
import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.dora.DoraMetrics;
import com.repo.velocity.forecast.ForecastMetric;
import com.repo.velocity.forecast.ForecastResult;
import com.repo.velocity.forecast.WeeklySeries;
import com.repo.velocity.insights.Finding;
import com.repo.velocity.rules.RiskAssessment;
import com.repo.velocity.rules.RiskReport;

import java.util.List;
import java.util.Optional;

/**
 * Everything one pipeline run produced. Immutable; safe to hand to any number of readers.
 */
public record AnalysisReport(
        int windowDays,
        ChurnSummary churn,
        RiskReport risk,
        DoraMetrics dora,
        WeeklySeries weeklyChurn,
        WeeklySeries weeklyCycleTime,
        List<ForecastResult> forecasts,
        List<Finding> findings,

        /** Degraded conditions from every stage, in stage order */
        List<AnalysisWarning> warnings) {

    public AnalysisReport {
        forecasts = List.copyOf(forecasts);
        findings = List.copyOf(findings);
        warnings = List.copyOf(warnings);
    }

    public List<AuthorChurnStats> authorStats() {
        return List.copyOf(churn.authors().values());
    }

    public List<RiskAssessment> riskAssessments() {
        return risk.assessments();
    }

    public Optional<ForecastResult> forecast(ForecastMetric metric) {
        return forecasts.stream().filter(f -> f.metric() == metric).findFirst();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
