package com.repo.velocity.insights;

import com.repo.velocity.churn.AuthorChurnStats;
import com.repo.velocity.churn.ChurnSummary;
import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.dora.DoraMetrics;
import com.repo.velocity.forecast.ForecastMetric;
import com.repo.velocity.forecast.ForecastResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the numeric stage outputs into anomaly and risk findings.
 * All thresholds come from {@link AnalyticsConfig}.
 */
public class FindingsAnalyzer {

    public static final String STAGE = "findings";

    private static final Logger log = LoggerFactory.getLogger(FindingsAnalyzer.class);

    private final AnalyticsConfig config;

    public FindingsAnalyzer(AnalyticsConfig config) {
        this.config = config;
    }

    /**
     * Anomalies first, then team risks. Author findings follow the summary's ranking order.
     */
    public List<Finding> analyze(ChurnSummary churn, DoraMetrics dora, List<ForecastResult> forecasts) {
        List<Finding> findings = new ArrayList<>(anomalies(churn));
        findings.addAll(risks(churn, dora, forecasts));
        log.debug("Derived {} findings", findings.size());
        return findings;
    }

    public List<Finding> anomalies(ChurnSummary churn) {
        List<Finding> findings = new ArrayList<>();
        List<AuthorChurnStats> authors = new ArrayList<>(churn.authors().values());
        if (authors.isEmpty()) {
            return findings;
        }

        double meanRatio = authors.stream().mapToDouble(AuthorChurnStats::churnRatio).average().orElse(0.0);
        double ratioLimit = meanRatio * config.getAuthorChurnRatioMultiplier();

        for (AuthorChurnStats author : authors) {
            if (meanRatio > 0 && author.churnRatio() > ratioLimit) {
                findings.add(new Finding(Finding.Kind.ANOMALY, "author_high_churn_ratio", author.author(),
                        format("%s deletes %.2f lines per added line, over %.1fx the team mean of %.2f",
                                author.author(), author.churnRatio(),
                                config.getAuthorChurnRatioMultiplier(), meanRatio),
                        author.churnRatio(), ratioLimit));
            }
            if (author.churn() > config.getAuthorLargeVolumeLines()) {
                findings.add(new Finding(Finding.Kind.ANOMALY, "author_large_volume", author.author(),
                        format("%s changed %d lines", author.author(), author.churn()),
                        author.churn(), config.getAuthorLargeVolumeLines()));
            }
            if (author.filesPerCommit() > config.getAuthorFilesPerCommit()) {
                findings.add(new Finding(Finding.Kind.ANOMALY, "author_high_file_churn", author.author(),
                        format("%s touches %.1f files per commit", author.author(), author.filesPerCommit()),
                        author.filesPerCommit(), config.getAuthorFilesPerCommit()));
            }
        }

        long singleCommitAuthors = authors.stream().filter(a -> a.commitCount() == 1).count();
        double share = (double) singleCommitAuthors / authors.size();
        if (share > config.getMinimalActivityShare()) {
            findings.add(new Finding(Finding.Kind.ANOMALY, "minimal_activity", Finding.TEAM,
                    format("%d of %d authors made a single commit", singleCommitAuthors, authors.size()),
                    share, config.getMinimalActivityShare()));
        }
        return findings;
    }

    public List<Finding> risks(ChurnSummary churn, DoraMetrics dora, List<ForecastResult> forecasts) {
        List<Finding> findings = new ArrayList<>();

        if (dora.changeFailureRate() > config.getRiskFailureRate()) {
            findings.add(new Finding(Finding.Kind.RISK, "high_change_failure_rate", Finding.TEAM,
                    format("%.0f%% of deployments failed", dora.changeFailureRate() * 100),
                    dora.changeFailureRate(), config.getRiskFailureRate()));
        }
        if (dora.leadTimeHours() > config.getRiskLeadTimeHours()) {
            findings.add(new Finding(Finding.Kind.RISK, "long_lead_time", Finding.TEAM,
                    format("changes take %.1f hours to reach production", dora.leadTimeHours()),
                    dora.leadTimeHours(), config.getRiskLeadTimeHours()));
        }
        if (dora.deploymentCount() > 0 && dora.deploymentFrequencyPerDay() < config.getRiskDeploymentsPerDay()) {
            findings.add(new Finding(Finding.Kind.RISK, "low_deployment_frequency", Finding.TEAM,
                    format("%.2f deployments per day", dora.deploymentFrequencyPerDay()),
                    dora.deploymentFrequencyPerDay(), config.getRiskDeploymentsPerDay()));
        }

        // A lone author always owns all churn, so concentration needs at least two
        long totalChurn = churn.totalChurn();
        if (churn.authors().size() > 1 && totalChurn > 0) {
            for (AuthorChurnStats author : churn.authors().values()) {
                double share = (double) author.churn() / totalChurn;
                if (share > config.getRiskConcentrationShare()) {
                    findings.add(new Finding(Finding.Kind.RISK, "code_concentration", author.author(),
                            format("%s authored %.0f%% of all changed lines", author.author(), share * 100),
                            share, config.getRiskConcentrationShare()));
                }
            }
        }

        for (ForecastResult forecast : forecasts) {
            if (forecast.isFallback()) {
                continue;
            }
            if (forecast.metric() == ForecastMetric.CYCLE_TIME
                    && forecast.predictedValue() > config.getRiskCycleTimeForecastHours()) {
                findings.add(new Finding(Finding.Kind.RISK, "high_cycle_time_forecast", Finding.TEAM,
                        format("pull requests are projected to take %.1f hours next week", forecast.predictedValue()),
                        forecast.predictedValue(), config.getRiskCycleTimeForecastHours()));
            }
            if (forecast.metric() == ForecastMetric.CHURN
                    && forecast.predictedValue() > config.getRiskChurnForecastLines()) {
                findings.add(new Finding(Finding.Kind.RISK, "high_churn_forecast", Finding.TEAM,
                        format("%.0f lines of churn projected next week", forecast.predictedValue()),
                        forecast.predictedValue(), config.getRiskChurnForecastLines()));
            }
        }
        return findings;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
