package com.repo.velocity.pipeline;

import com.repo.velocity.churn.ChurnAggregator;
import com.repo.velocity.churn.ChurnSummary;
import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.DeploymentRecord;
import com.repo.velocity.core.IncidentRecord;
import com.repo.velocity.core.PullRequestRecord;
import com.repo.velocity.dora.DoraCalculator;
import com.repo.velocity.dora.DoraMetrics;
import com.repo.velocity.forecast.ForecastMetric;
import com.repo.velocity.forecast.ForecastResult;
import com.repo.velocity.forecast.TrendForecaster;
import com.repo.velocity.forecast.WeeklySeries;
import com.repo.velocity.forecast.WeeklySeriesBuilder;
import com.repo.velocity.insights.Finding;
import com.repo.velocity.insights.FindingsAnalyzer;
import com.repo.velocity.rules.RiskClassifier;
import com.repo.velocity.rules.RiskReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs churn, risk, DORA, forecast and findings over one batch of records.
 *
 * <p>Each stage gets only the inputs it needs. A stage that throws is replaced
 * by its empty result and a stage-failure warning, so {@link #runAnalytics}
 * always returns a complete report. The pipeline holds nothing but the
 * configuration and can be shared between threads.
 */
public class AnalyticsPipeline {

    public static final String STAGE = "pipeline";

    private static final Logger log = LoggerFactory.getLogger(AnalyticsPipeline.class);

    private final ChurnAggregator churnAggregator;
    private final RiskClassifier riskClassifier;
    private final DoraCalculator doraCalculator;
    private final WeeklySeriesBuilder seriesBuilder;
    private final TrendForecaster forecaster;
    private final FindingsAnalyzer findingsAnalyzer;

    public AnalyticsPipeline(AnalyticsConfig config) {
        this(new ChurnAggregator(), new RiskClassifier(config), new DoraCalculator(config),
                new WeeklySeriesBuilder(), new TrendForecaster(config), new FindingsAnalyzer(config));
    }

    AnalyticsPipeline(ChurnAggregator churnAggregator, RiskClassifier riskClassifier,
            DoraCalculator doraCalculator, WeeklySeriesBuilder seriesBuilder,
            TrendForecaster forecaster, FindingsAnalyzer findingsAnalyzer) {
        this.churnAggregator = churnAggregator;
        this.riskClassifier = riskClassifier;
        this.doraCalculator = doraCalculator;
        this.seriesBuilder = seriesBuilder;
        this.forecaster = forecaster;
        this.findingsAnalyzer = findingsAnalyzer;
    }

    /**
     * Analyze one batch. Never throws; every degraded condition ends up in
     * {@link AnalysisReport#warnings()}.
     *
     * @param windowDays observation window used for deployment frequency
     */
    public AnalysisReport runAnalytics(List<CommitRecord> commits, List<PullRequestRecord> pullRequests,
            List<DeploymentRecord> deployments, List<IncidentRecord> incidents, int windowDays) {
        List<AnalysisWarning> warnings = new ArrayList<>();

        List<CommitRecord> cleanCommits = clean(commits, "commits", warnings);
        List<PullRequestRecord> cleanPrs = clean(pullRequests, "pull requests", warnings);
        List<DeploymentRecord> cleanDeployments = clean(deployments, "deployments", warnings);
        List<IncidentRecord> cleanIncidents = clean(incidents, "incidents", warnings);

        log.info("Analyzing {} commits, {} pull requests, {} deployments, {} incidents over {} days",
                cleanCommits.size(), cleanPrs.size(), cleanDeployments.size(), cleanIncidents.size(), windowDays);

        ChurnSummary churn = runStage(ChurnAggregator.STAGE,
                () -> churnAggregator.aggregate(cleanCommits, cleanPrs),
                ChurnSummary::empty, warnings);
        warnings.addAll(churn.warnings());

        RiskReport risk = runStage(RiskClassifier.STAGE,
                () -> riskClassifier.classify(cleanCommits, cleanPrs, churn.avgChurn(), churn.churnStdDev()),
                RiskReport::empty, warnings);
        warnings.addAll(risk.warnings());

        DoraMetrics dora = runStage(DoraCalculator.STAGE,
                () -> doraCalculator.calculate(cleanCommits, cleanPrs, cleanDeployments, cleanIncidents, windowDays),
                DoraMetrics::empty, warnings);
        warnings.addAll(dora.warnings());

        WeeklySeries weeklyChurn = runStage(TrendForecaster.STAGE,
                () -> seriesBuilder.weeklyChurn(cleanCommits),
                () -> new WeeklySeries(ForecastMetric.CHURN, List.of()), warnings);
        WeeklySeries weeklyCycleTime = runStage(TrendForecaster.STAGE,
                () -> seriesBuilder.weeklyCycleTime(cleanPrs),
                () -> new WeeklySeries(ForecastMetric.CYCLE_TIME, List.of()), warnings);

        List<ForecastResult> forecasts = new ArrayList<>();
        forecasts.add(forecast(weeklyChurn, warnings));
        forecasts.add(forecast(weeklyCycleTime, warnings));

        List<Finding> findings = runStage(FindingsAnalyzer.STAGE,
                () -> findingsAnalyzer.analyze(churn, dora, forecasts),
                List::of, warnings);

        AnalysisReport report = new AnalysisReport(windowDays, churn, risk, dora,
                weeklyChurn, weeklyCycleTime, forecasts, findings, warnings);
        log.info("Analysis complete: {} flagged items, overall DORA band {}, {} findings, {} warnings",
                risk.flaggedCount(), dora.overallBand(), findings.size(), warnings.size());
        return report;
    }

    private ForecastResult forecast(WeeklySeries series, List<AnalysisWarning> warnings) {
        ForecastMetric metric = series.metric();
        ForecastResult result = runStage(TrendForecaster.STAGE,
                () -> forecaster.forecast(series.values(), metric),
                () -> forecaster.fallback(metric, series.size(), "forecast stage failed"),
                warnings);
        if (result.isFallback()) {
            warnings.add(AnalysisWarning.insufficientData(TrendForecaster.STAGE,
                    metric.code() + " forecast uses fallback: " + result.reason()));
        }
        return result;
    }

    private <T> T runStage(String stage, Supplier<T> body, Supplier<T> fallback, List<AnalysisWarning> warnings) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.warn("Stage '{}' failed, substituting empty result", stage, e);
            warnings.add(AnalysisWarning.stageFailure(stage, e.getClass().getSimpleName() + ": " + e.getMessage()));
            return fallback.get();
        }
    }

    private <T> List<T> clean(List<T> records, String label, List<AnalysisWarning> warnings) {
        if (records == null) {
            warnings.add(AnalysisWarning.insufficientData(STAGE, "no " + label + " supplied; treated as empty"));
            return List.of();
        }
        List<T> kept = new ArrayList<>(records.size());
        int dropped = 0;
        for (T record : records) {
            if (record == null) {
                dropped++;
            } else {
                kept.add(record);
            }
        }
        if (dropped > 0) {
            warnings.add(AnalysisWarning.malformed(STAGE, "dropped " + dropped + " null entries from " + label));
        }
        return kept;
    }
}
