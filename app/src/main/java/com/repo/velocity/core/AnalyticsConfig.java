package com.repo.velocity.core;

import com.repo.velocity.dora.BandCutoffs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Thresholds, weights and band cutoffs for a velocity analysis.
 * Loaded from velocity.yaml or built from defaults, then handed explicitly to
 * every stage. There are no setters: a loaded config can be shared between
 * concurrent runs.
 */
public class AnalyticsConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfig.class);

    /** Quartiles are meaningless below this many points */
    public static final int MIN_OUTLIER_POINTS = 4;

    public static final String FILE_NAME = "velocity.yaml";

    // Risk thresholds
    private int highChurnLines = 300;
    private int manyFilesCount = 8;
    private double highDeletionRatio = 0.7;
    private int massiveCommitLines = 1000;
    private int lowReviewMaxReviews = 1;

    // Risk weights
    private int weightHighChurn = 3;
    private int weightManyFiles = 2;
    private int weightHighDeletionRatio = 1;
    private int weightMassiveCommit = 2;
    private int weightLowReview = 1;
    private int weightCiFailure = 1;

    // Tier cutoffs
    private int highTierMinScore = 5;
    private int mediumTierMinScore = 2;

    // Outliers
    private double iqrMultiplier = 1.5;
    private int outlierMinPoints = MIN_OUTLIER_POINTS;

    // DORA
    private double incidentWindowHours = 24.0;
    private double leadTimeEliteHours = 24.0;
    private double leadTimeHighHours = 168.0;
    private double leadTimeMediumHours = 720.0;
    private double deploymentsPerDayElite = 1.0;
    private double deploymentsPerDayHigh = 1.0 / 7;
    private double deploymentsPerDayMedium = 1.0 / 30;
    private double failureRateElite = 0.15;
    private double failureRateHigh = 0.30;
    private double failureRateMedium = 0.45;
    private double mttrEliteHours = 1.0;
    private double mttrHighHours = 24.0;
    private double mttrMediumHours = 168.0;

    // Forecast
    private double churnHighConfidenceStdDev = 100.0;
    private double churnMediumConfidenceStdDev = 500.0;
    private double churnFallback = 1000.0;
    private double cycleTimeHighConfidenceStdDev = 5.0;
    private double cycleTimeMediumConfidenceStdDev = 10.0;
    private double cycleTimeFallbackHours = 24.0;

    // Findings
    private double authorChurnRatioMultiplier = 3.0;
    private int authorLargeVolumeLines = 1000;
    private double minimalActivityShare = 0.5;
    private double authorFilesPerCommit = 10.0;
    private double riskFailureRate = 0.15;
    private double riskLeadTimeHours = 168.0;
    private double riskDeploymentsPerDay = 0.2;
    private double riskConcentrationShare = 0.6;
    private double riskCycleTimeForecastHours = 48.0;
    private double riskChurnForecastLines = 5000.0;

    /**
     * Load velocity.yaml from a directory, or return defaults when it is absent.
     */
    public static AnalyticsConfig load(Path directory) {
        return loadFile(directory.resolve(FILE_NAME));
    }

    /**
     * Load a specific YAML file, or return defaults when it is absent or unreadable.
     */
    public static AnalyticsConfig loadFile(Path configFile) {
        AnalyticsConfig config = new AnalyticsConfig();

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Map<String, Object> data = new Yaml().load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                log.info("Loaded configuration from {}", configFile);
            } catch (IOException e) {
                log.warn("Could not read config file {}, using defaults: {}", configFile, e.getMessage());
            }
        }
        return config;
    }

    /**
     * Parse configuration from YAML text. Unknown keys are ignored, absent keys keep defaults.
     */
    public static AnalyticsConfig fromYaml(String yamlText) {
        AnalyticsConfig config = new AnalyticsConfig();
        Map<String, Object> data = new Yaml().load(yamlText);
        if (data != null) {
            config.parseYaml(data);
        }
        return config;
    }

    public static AnalyticsConfig defaults() {
        return new AnalyticsConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        Map<String, Object> thresholds = section(data, "thresholds");
        Map<String, Object> risk = section(thresholds, "risk");
        highChurnLines = getInt(risk, "high_churn", highChurnLines);
        manyFilesCount = getInt(risk, "many_files", manyFilesCount);
        highDeletionRatio = getDouble(risk, "deletion_ratio", highDeletionRatio);
        massiveCommitLines = getInt(risk, "massive_commit", massiveCommitLines);
        lowReviewMaxReviews = getInt(risk, "low_review", lowReviewMaxReviews);

        Map<String, Object> tiers = section(thresholds, "tiers");
        highTierMinScore = getInt(tiers, "high", highTierMinScore);
        mediumTierMinScore = getInt(tiers, "medium", mediumTierMinScore);

        Map<String, Object> outliers = section(thresholds, "outliers");
        iqrMultiplier = getDouble(outliers, "iqr_multiplier", iqrMultiplier);
        outlierMinPoints = getInt(outliers, "min_points", outlierMinPoints);
        if (outlierMinPoints < MIN_OUTLIER_POINTS) {
            log.warn("outliers.min_points {} is below {}, using {}",
                    outlierMinPoints, MIN_OUTLIER_POINTS, MIN_OUTLIER_POINTS);
            outlierMinPoints = MIN_OUTLIER_POINTS;
        }

        Map<String, Object> weights = section(data, "weights");
        weightHighChurn = getInt(weights, "high_churn", weightHighChurn);
        weightManyFiles = getInt(weights, "many_files", weightManyFiles);
        weightHighDeletionRatio = getInt(weights, "high_deletion_ratio", weightHighDeletionRatio);
        weightMassiveCommit = getInt(weights, "massive_commit", weightMassiveCommit);
        weightLowReview = getInt(weights, "low_review", weightLowReview);
        weightCiFailure = getInt(weights, "ci_failure", weightCiFailure);

        Map<String, Object> dora = section(data, "dora");
        incidentWindowHours = getDouble(dora, "incident_window_hours", incidentWindowHours);

        Map<String, Object> leadTime = section(dora, "lead_time_hours");
        leadTimeEliteHours = getDouble(leadTime, "elite", leadTimeEliteHours);
        leadTimeHighHours = getDouble(leadTime, "high", leadTimeHighHours);
        leadTimeMediumHours = getDouble(leadTime, "medium", leadTimeMediumHours);

        Map<String, Object> frequency = section(dora, "deployments_per_day");
        deploymentsPerDayElite = getDouble(frequency, "elite", deploymentsPerDayElite);
        deploymentsPerDayHigh = getDouble(frequency, "high", deploymentsPerDayHigh);
        deploymentsPerDayMedium = getDouble(frequency, "medium", deploymentsPerDayMedium);

        Map<String, Object> failureRate = section(dora, "change_failure_rate");
        failureRateElite = getDouble(failureRate, "elite", failureRateElite);
        failureRateHigh = getDouble(failureRate, "high", failureRateHigh);
        failureRateMedium = getDouble(failureRate, "medium", failureRateMedium);

        Map<String, Object> mttr = section(dora, "mttr_hours");
        mttrEliteHours = getDouble(mttr, "elite", mttrEliteHours);
        mttrHighHours = getDouble(mttr, "high", mttrHighHours);
        mttrMediumHours = getDouble(mttr, "medium", mttrMediumHours);

        Map<String, Object> forecast = section(data, "forecast");
        Map<String, Object> churn = section(forecast, "churn");
        churnHighConfidenceStdDev = getDouble(churn, "high_confidence_stddev", churnHighConfidenceStdDev);
        churnMediumConfidenceStdDev = getDouble(churn, "medium_confidence_stddev", churnMediumConfidenceStdDev);
        churnFallback = getDouble(churn, "fallback", churnFallback);
        Map<String, Object> cycleTime = section(forecast, "cycle_time");
        cycleTimeHighConfidenceStdDev = getDouble(cycleTime, "high_confidence_stddev",
                cycleTimeHighConfidenceStdDev);
        cycleTimeMediumConfidenceStdDev = getDouble(cycleTime, "medium_confidence_stddev",
                cycleTimeMediumConfidenceStdDev);
        cycleTimeFallbackHours = getDouble(cycleTime, "fallback", cycleTimeFallbackHours);

        Map<String, Object> findings = section(data, "findings");
        authorChurnRatioMultiplier = getDouble(findings, "author_churn_ratio_multiplier",
                authorChurnRatioMultiplier);
        authorLargeVolumeLines = getInt(findings, "author_large_volume", authorLargeVolumeLines);
        minimalActivityShare = getDouble(findings, "minimal_activity_share", minimalActivityShare);
        authorFilesPerCommit = getDouble(findings, "author_files_per_commit", authorFilesPerCommit);
        riskFailureRate = getDouble(findings, "change_failure_rate", riskFailureRate);
        riskLeadTimeHours = getDouble(findings, "lead_time_hours", riskLeadTimeHours);
        riskDeploymentsPerDay = getDouble(findings, "deployments_per_day", riskDeploymentsPerDay);
        riskConcentrationShare = getDouble(findings, "concentration_share", riskConcentrationShare);
        riskCycleTimeForecastHours = getDouble(findings, "cycle_time_forecast_hours", riskCycleTimeForecastHours);
        riskChurnForecastLines = getDouble(findings, "churn_forecast_lines", riskChurnForecastLines);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) {
            return (Map<String, Object>) val;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    // === Getters ===

    // Risk thresholds
    public int getHighChurnLines() {
        return highChurnLines;
    }

    public int getManyFilesCount() {
        return manyFilesCount;
    }

    public double getHighDeletionRatio() {
        return highDeletionRatio;
    }

    public int getMassiveCommitLines() {
        return massiveCommitLines;
    }

    public int getLowReviewMaxReviews() {
        return lowReviewMaxReviews;
    }

    // Risk weights
    public int getWeightHighChurn() {
        return weightHighChurn;
    }

    public int getWeightManyFiles() {
        return weightManyFiles;
    }

    public int getWeightHighDeletionRatio() {
        return weightHighDeletionRatio;
    }

    public int getWeightMassiveCommit() {
        return weightMassiveCommit;
    }

    public int getWeightLowReview() {
        return weightLowReview;
    }

    public int getWeightCiFailure() {
        return weightCiFailure;
    }

    public int getHighTierMinScore() {
        return highTierMinScore;
    }

    public int getMediumTierMinScore() {
        return mediumTierMinScore;
    }

    // Outliers
    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public int getOutlierMinPoints() {
        return outlierMinPoints;
    }

    // DORA
    public double getIncidentWindowHours() {
        return incidentWindowHours;
    }

    public BandCutoffs leadTimeCutoffs() {
        return BandCutoffs.lowerIsBetter(leadTimeEliteHours, leadTimeHighHours, leadTimeMediumHours);
    }

    public BandCutoffs deploymentFrequencyCutoffs() {
        return BandCutoffs.higherIsBetter(deploymentsPerDayElite, deploymentsPerDayHigh, deploymentsPerDayMedium);
    }

    public BandCutoffs changeFailureRateCutoffs() {
        return BandCutoffs.atMost(failureRateElite, failureRateHigh, failureRateMedium);
    }

    public BandCutoffs mttrCutoffs() {
        return BandCutoffs.lowerIsBetter(mttrEliteHours, mttrHighHours, mttrMediumHours);
    }

    // Forecast
    public double getChurnHighConfidenceStdDev() {
        return churnHighConfidenceStdDev;
    }

    public double getChurnMediumConfidenceStdDev() {
        return churnMediumConfidenceStdDev;
    }

    public double getChurnFallback() {
        return churnFallback;
    }

    public double getCycleTimeHighConfidenceStdDev() {
        return cycleTimeHighConfidenceStdDev;
    }

    public double getCycleTimeMediumConfidenceStdDev() {
        return cycleTimeMediumConfidenceStdDev;
    }

    public double getCycleTimeFallbackHours() {
        return cycleTimeFallbackHours;
    }

    // Findings
    public double getAuthorChurnRatioMultiplier() {
        return authorChurnRatioMultiplier;
    }

    public int getAuthorLargeVolumeLines() {
        return authorLargeVolumeLines;
    }

    public double getMinimalActivityShare() {
        return minimalActivityShare;
    }

    public double getAuthorFilesPerCommit() {
        return authorFilesPerCommit;
    }

    public double getRiskFailureRate() {
        return riskFailureRate;
    }

    public double getRiskLeadTimeHours() {
        return riskLeadTimeHours;
    }

    public double getRiskDeploymentsPerDay() {
        return riskDeploymentsPerDay;
    }

    public double getRiskConcentrationShare() {
        return riskConcentrationShare;
    }

    public double getRiskCycleTimeForecastHours() {
        return riskCycleTimeForecastHours;
    }

    public double getRiskChurnForecastLines() {
        return riskChurnForecastLines;
    }
}
