package com.repo.velocity.dora;

import com.repo.velocity.core.AnalysisWarning;

import java.util.List;

/**
 * The four DORA key metrics with their performance bands.
 */
public record DoraMetrics(
        /** Mean hours from the first commit of a deployment to the deployment */
        double leadTimeHours,

        /** Deployments per day over the observation window */
        double deploymentFrequencyPerDay,

        /** Failed deployments / all deployments, in [0, 1] */
        double changeFailureRate,

        /** Mean hours from detection to resolution of resolved incidents */
        double mttrHours,

        PerformanceBand leadTimeBand,
        PerformanceBand deploymentFrequencyBand,
        PerformanceBand changeFailureRateBand,
        PerformanceBand mttrBand,

        /** Worst of the four bands */
        PerformanceBand overallBand,

        int deploymentCount,
        int failedDeploymentCount,
        int resolvedIncidentCount,

        /** Mean created-to-merged hours of merged pull requests, 0 when none merged */
        double meanPrCycleTimeHours,

        List<AnalysisWarning> warnings) {

    public DoraMetrics {
        warnings = List.copyOf(warnings);
    }

    /**
     * Result for a batch without deployments or incidents: every value 0, every band low.
     */
    public static DoraMetrics empty() {
        return empty(List.of());
    }

    public static DoraMetrics empty(List<AnalysisWarning> warnings) {
        return new DoraMetrics(0.0, 0.0, 0.0, 0.0,
                PerformanceBand.LOW, PerformanceBand.LOW, PerformanceBand.LOW, PerformanceBand.LOW,
                PerformanceBand.LOW, 0, 0, 0, 0.0, warnings);
    }
}
