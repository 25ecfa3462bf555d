package com.repo.velocity.dora;

import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.DeploymentRecord;
import com.repo.velocity.core.Durations;
import com.repo.velocity.core.IncidentRecord;
import com.repo.velocity.core.PullRequestRecord;
import com.repo.velocity.core.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Computes lead time, deployment frequency, change failure rate and MTTR, and
 * bands each one against the configured cutoffs.
 *
 * <p>Commit-to-deployment and incident-to-deployment association are both
 * sorted two-pointer merges, so the whole calculation is O(n log n).
 */
public class DoraCalculator {

    public static final String STAGE = "dora";

    private static final Logger log = LoggerFactory.getLogger(DoraCalculator.class);

    private final AnalyticsConfig config;

    public DoraCalculator(AnalyticsConfig config) {
        this.config = config;
    }

    /**
     * @param commits      commits of the batch
     * @param pullRequests pull requests of the batch; only merged ones are used
     * @param deployments  production deployments
     * @param incidents    production incidents
     * @param windowDays   observation window; values below 1 are floored to 1
     */
    public DoraMetrics calculate(List<CommitRecord> commits, List<PullRequestRecord> pullRequests,
            List<DeploymentRecord> deployments, List<IncidentRecord> incidents, int windowDays) {
        List<AnalysisWarning> warnings = new ArrayList<>();

        List<CommitRecord> sortedCommits = present(commits, "commit", warnings);
        sortedCommits.sort(Comparator.comparing(CommitRecord::timestamp));
        List<DeploymentRecord> sortedDeployments = present(deployments, "deployment", warnings);
        sortedDeployments.sort(Comparator.comparing(DeploymentRecord::timestamp));
        List<IncidentRecord> sortedIncidents = present(incidents, "incident", warnings);
        sortedIncidents.sort(Comparator.comparing(IncidentRecord::detectedAt));
        List<PullRequestRecord> prs = present(pullRequests, "pull request", warnings);

        if (windowDays < 1) {
            warnings.add(AnalysisWarning.divisionGuard(STAGE,
                    "window of " + windowDays + " days floored to 1 day"));
        }

        int resolved = (int) sortedIncidents.stream().filter(IncidentRecord::isResolved).count();
        double prCycleTime = meanPrCycleTimeHours(prs);

        if (sortedDeployments.isEmpty()) {
            warnings.add(AnalysisWarning.insufficientData(STAGE,
                    "no deployments in window; all DORA metrics reported as 0"));
            log.debug("No deployments, DORA metrics default to low");
            return new DoraMetrics(0.0, 0.0, 0.0, 0.0,
                    PerformanceBand.LOW, PerformanceBand.LOW, PerformanceBand.LOW, PerformanceBand.LOW,
                    PerformanceBand.LOW, 0, 0, resolved, prCycleTime, warnings);
        }

        double mttrHours = meanRecoveryHours(sortedIncidents);
        PerformanceBand mttrBand = mttrBand(sortedIncidents, resolved, mttrHours);

        OptionalDouble leadTime = meanLeadTimeHours(sortedCommits, sortedDeployments);
        if (leadTime.isEmpty()) {
            warnings.add(AnalysisWarning.insufficientData(STAGE,
                    "no commit could be associated with any deployment; lead time reported as 0"));
        }
        double leadTimeHours = leadTime.orElse(0.0);
        PerformanceBand leadTimeBand = leadTime.isPresent()
                ? config.leadTimeCutoffs().band(leadTimeHours)
                : PerformanceBand.LOW;

        double frequency = Statistics.guardedRatio(sortedDeployments.size(), windowDays);
        PerformanceBand frequencyBand = config.deploymentFrequencyCutoffs().band(frequency);

        int failed = countFailedDeployments(sortedDeployments, sortedIncidents);
        double failureRate = (double) failed / sortedDeployments.size();
        PerformanceBand failureBand = config.changeFailureRateCutoffs().band(failureRate);

        PerformanceBand overall = PerformanceBand.worstOf(leadTimeBand, frequencyBand, failureBand, mttrBand);

        log.debug("DORA: lead={}h freq={}/day cfr={} mttr={}h overall={}",
                leadTimeHours, frequency, failureRate, mttrHours, overall);

        return new DoraMetrics(leadTimeHours, frequency, failureRate, mttrHours,
                leadTimeBand, frequencyBand, failureBand, mttrBand, overall,
                sortedDeployments.size(), failed, resolved, prCycleTime, warnings);
    }

    /**
     * Each deployment ships the commits made after the previous deployment and
     * at or before itself. Lead time of a deployment is measured from the
     * earliest of those commits. Deployments that shipped no commit are skipped.
     *
     * @param commits     sorted by timestamp
     * @param deployments sorted by timestamp
     */
    OptionalDouble meanLeadTimeHours(List<CommitRecord> commits, List<DeploymentRecord> deployments) {
        double total = 0;
        int associated = 0;
        int next = 0;

        for (DeploymentRecord deployment : deployments) {
            Instant shippedAt = deployment.timestamp();
            Instant firstCommit = null;
            while (next < commits.size() && !commits.get(next).timestamp().isAfter(shippedAt)) {
                if (firstCommit == null) {
                    firstCommit = commits.get(next).timestamp();
                }
                next++;
            }
            if (firstCommit != null) {
                total += Durations.hours(Duration.between(firstCommit, shippedAt));
                associated++;
            }
        }
        return associated == 0 ? OptionalDouble.empty() : OptionalDouble.of(total / associated);
    }

    /**
     * A deployment failed if its own status says so, or if an incident was
     * detected within the attribution window after it and before the next one.
     *
     * @param deployments sorted by timestamp
     * @param incidents   sorted by detection time
     */
    int countFailedDeployments(List<DeploymentRecord> deployments, List<IncidentRecord> incidents) {
        boolean[] failed = new boolean[deployments.size()];
        for (int i = 0; i < deployments.size(); i++) {
            failed[i] = deployments.get(i).isFailed();
        }

        Duration window = Duration.ofMillis(Math.round(config.getIncidentWindowHours() * 3_600_000));
        int latest = -1;
        for (IncidentRecord incident : incidents) {
            Instant detected = incident.detectedAt();
            while (latest + 1 < deployments.size()
                    && !deployments.get(latest + 1).timestamp().isAfter(detected)) {
                latest++;
            }
            if (latest >= 0) {
                Instant deployedAt = deployments.get(latest).timestamp();
                if (Duration.between(deployedAt, detected).compareTo(window) <= 0) {
                    failed[latest] = true;
                }
            }
        }

        int count = 0;
        for (boolean f : failed) {
            if (f) {
                count++;
            }
        }
        return count;
    }

    private double meanRecoveryHours(List<IncidentRecord> incidents) {
        List<Double> hours = new ArrayList<>();
        for (IncidentRecord incident : incidents) {
            incident.recoveryHours().ifPresent(hours::add);
        }
        return Statistics.mean(hours);
    }

    private double meanPrCycleTimeHours(List<PullRequestRecord> prs) {
        List<Double> hours = new ArrayList<>();
        for (PullRequestRecord pr : prs) {
            pr.leadTimeHours().ifPresent(hours::add);
        }
        return Statistics.mean(hours);
    }

    // No incidents at all means nothing needed recovering; open-only incidents mean nothing recovered yet
    private PerformanceBand mttrBand(List<IncidentRecord> incidents, int resolved, double mttrHours) {
        if (incidents.isEmpty()) {
            return PerformanceBand.ELITE;
        }
        if (resolved == 0) {
            return PerformanceBand.LOW;
        }
        return config.mttrCutoffs().band(mttrHours);
    }

    private <T> List<T> present(List<T> records, String label, List<AnalysisWarning> warnings) {
        List<T> kept = new ArrayList<>(records.size());
        for (T record : records) {
            if (record == null) {
                warnings.add(AnalysisWarning.malformed(STAGE, "skipped null " + label + " record"));
            } else {
                kept.add(record);
            }
        }
        return kept;
    }
}
