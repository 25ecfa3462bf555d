package com.repo.velocity.dora;

import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.DeploymentRecord;
import com.repo.velocity.core.DeploymentStatus;
import com.repo.velocity.core.IncidentRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.repo.velocity.core.Fixtures.commitAt;
import static com.repo.velocity.core.Fixtures.deployment;
import static com.repo.velocity.core.Fixtures.hoursAfter;
import static com.repo.velocity.core.Fixtures.incident;
import static com.repo.velocity.core.Fixtures.prMergedAt;
import static org.junit.jupiter.api.Assertions.*;

class DoraCalculatorTest {

    private final DoraCalculator calculator = new DoraCalculator(AnalyticsConfig.defaults());

    @Test
    void testNoDeploymentsNoIncidents() {
        DoraMetrics metrics = calculator.calculate(List.of(), List.of(), List.of(), List.of(), 30);

        assertEquals(0.0, metrics.leadTimeHours());
        assertEquals(0.0, metrics.deploymentFrequencyPerDay());
        assertEquals(0.0, metrics.changeFailureRate());
        assertEquals(0.0, metrics.mttrHours());
        assertEquals(PerformanceBand.LOW, metrics.overallBand());
        assertTrue(metrics.warnings().stream().anyMatch(w -> w.kind() == AnalysisWarning.Kind.INSUFFICIENT_DATA));
    }

    @Test
    void testNoDeploymentsIgnoresResolvedIncidents() {
        DoraMetrics metrics = calculator.calculate(List.of(), List.of(), List.of(),
                List.of(incident("i1", hoursAfter(0), hoursAfter(5))), 30);

        assertEquals(0.0, metrics.mttrHours());
        assertEquals(PerformanceBand.LOW, metrics.mttrBand());
        assertEquals(PerformanceBand.LOW, metrics.overallBand());
        assertEquals(1, metrics.resolvedIncidentCount());
    }

    @Test
    void testFullCalculation() {
        List<CommitRecord> commits = List.of(
                commitAt("c1", hoursAfter(0), 10, 0),
                commitAt("c2", hoursAfter(2), 10, 0),
                commitAt("c3", hoursAfter(12), 10, 0));
        List<DeploymentRecord> deployments = List.of(
                deployment("d1", hoursAfter(10), DeploymentStatus.SUCCESS),
                deployment("d2", hoursAfter(20), DeploymentStatus.FAILED));
        List<IncidentRecord> incidents = List.of(incident("i1", hoursAfter(21), hoursAfter(23)));

        DoraMetrics metrics = calculator.calculate(commits, List.of(), deployments, incidents, 7);

        // d1 ships c1,c2 (10h from c1); d2 ships c3 (8h)
        assertEquals(9.0, metrics.leadTimeHours(), 1e-9);
        assertEquals(PerformanceBand.ELITE, metrics.leadTimeBand());
        assertEquals(2.0 / 7, metrics.deploymentFrequencyPerDay(), 1e-12);
        assertEquals(PerformanceBand.HIGH, metrics.deploymentFrequencyBand());
        assertEquals(0.5, metrics.changeFailureRate());
        assertEquals(PerformanceBand.LOW, metrics.changeFailureRateBand());
        assertEquals(2.0, metrics.mttrHours(), 1e-9);
        assertEquals(PerformanceBand.HIGH, metrics.mttrBand());
        assertEquals(PerformanceBand.LOW, metrics.overallBand(), "Overall is the worst band");
        assertEquals(2, metrics.deploymentCount());
        assertEquals(1, metrics.failedDeploymentCount());
        assertEquals(1, metrics.resolvedIncidentCount());
    }

    @Test
    void testInputOrderDoesNotMatter() {
        List<CommitRecord> commits = List.of(
                commitAt("c3", hoursAfter(12), 10, 0),
                commitAt("c1", hoursAfter(0), 10, 0),
                commitAt("c2", hoursAfter(2), 10, 0));
        List<DeploymentRecord> deployments = List.of(
                deployment("d2", hoursAfter(20), DeploymentStatus.SUCCESS),
                deployment("d1", hoursAfter(10), DeploymentStatus.SUCCESS));

        DoraMetrics metrics = calculator.calculate(commits, List.of(), deployments, List.of(), 7);

        assertEquals(9.0, metrics.leadTimeHours(), 1e-9);
    }

    @Test
    void testIncidentAttributedWithinWindow() {
        List<DeploymentRecord> deployments = List.of(
                deployment("d1", hoursAfter(0), DeploymentStatus.SUCCESS),
                deployment("d2", hoursAfter(48), DeploymentStatus.SUCCESS));
        List<IncidentRecord> incidents = List.of(
                incident("early", hoursAfter(-5), hoursAfter(-4)),
                incident("i1", hoursAfter(5), hoursAfter(6)),
                incident("i2", hoursAfter(6), hoursAfter(7)),
                incident("late", hoursAfter(100), null));

        assertEquals(1, calculator.countFailedDeployments(deployments, incidents),
                "Only d1 has an incident inside its 24h window, counted once");
    }

    @Test
    void testIncidentAtWindowEdge() {
        List<DeploymentRecord> deployments = List.of(deployment("d1", hoursAfter(0), DeploymentStatus.SUCCESS));
        assertEquals(1, calculator.countFailedDeployments(deployments,
                List.of(incident("i1", hoursAfter(24), null))));
        assertEquals(0, calculator.countFailedDeployments(deployments,
                List.of(incident("i2", hoursAfter(24.5), null))));
    }

    @Test
    void testMttrIgnoresOpenIncidents() {
        List<IncidentRecord> incidents = List.of(
                incident("open", hoursAfter(1), null),
                incident("closed", hoursAfter(1), hoursAfter(5)));

        DoraMetrics metrics = calculator.calculate(List.of(), List.of(),
                List.of(deployment("d1", hoursAfter(100), DeploymentStatus.SUCCESS)), incidents, 30);

        assertEquals(4.0, metrics.mttrHours(), 1e-9);
        assertEquals(1, metrics.resolvedIncidentCount());
    }

    @Test
    void testOnlyOpenIncidentsBandLow() {
        DoraMetrics metrics = calculator.calculate(List.of(), List.of(),
                List.of(deployment("d1", hoursAfter(100), DeploymentStatus.SUCCESS)),
                List.of(incident("open", hoursAfter(1), null)), 30);

        assertEquals(0.0, metrics.mttrHours());
        assertEquals(PerformanceBand.LOW, metrics.mttrBand());
    }

    @Test
    void testDeploymentsWithoutCommits() {
        DoraMetrics metrics = calculator.calculate(
                List.of(commitAt("late", hoursAfter(50), 1, 0)),
                List.of(),
                List.of(deployment("d1", hoursAfter(10), DeploymentStatus.SUCCESS)),
                List.of(), 1);

        assertEquals(0.0, metrics.leadTimeHours());
        assertEquals(PerformanceBand.LOW, metrics.leadTimeBand());
        assertEquals(1.0, metrics.deploymentFrequencyPerDay());
        assertTrue(metrics.warnings().stream().anyMatch(w -> w.message().contains("lead time")));
    }

    @Test
    void testZeroWindowIsGuarded() {
        DoraMetrics metrics = calculator.calculate(List.of(), List.of(),
                List.of(deployment("d1", hoursAfter(0), DeploymentStatus.SUCCESS),
                        deployment("d2", hoursAfter(1), DeploymentStatus.SUCCESS)),
                List.of(), 0);

        assertEquals(2.0, metrics.deploymentFrequencyPerDay());
        assertTrue(metrics.warnings().stream().anyMatch(w -> w.kind() == AnalysisWarning.Kind.DIVISION_GUARD));
    }

    @Test
    void testPrCycleTime() {
        DoraMetrics metrics = calculator.calculate(List.of(),
                List.of(prMergedAt("1", hoursAfter(0), hoursAfter(10)),
                        prMergedAt("2", hoursAfter(0), hoursAfter(30)),
                        prMergedAt("3", hoursAfter(0), null)),
                List.of(), List.of(), 30);

        assertEquals(20.0, metrics.meanPrCycleTimeHours(), 1e-9);
    }

    @Test
    void testChangeFailureRateStaysInUnitInterval() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            List<DeploymentRecord> deployments = new ArrayList<>();
            List<IncidentRecord> incidents = new ArrayList<>();
            int count = 1 + random.nextInt(20);
            for (int i = 0; i < count; i++) {
                DeploymentStatus status = DeploymentStatus.values()[random.nextInt(3)];
                deployments.add(deployment("d" + i, hoursAfter(random.nextInt(500)), status));
            }
            int incidentCount = random.nextInt(30);
            for (int i = 0; i < incidentCount; i++) {
                incidents.add(incident("i" + i, hoursAfter(random.nextInt(500)), null));
            }

            DoraMetrics metrics = calculator.calculate(List.of(), List.of(), deployments, incidents, 21);

            assertTrue(metrics.changeFailureRate() >= 0.0 && metrics.changeFailureRate() <= 1.0);
            assertTrue(metrics.failedDeploymentCount() <= metrics.deploymentCount());
        }
    }

    @Test
    void testWorstOf() {
        assertEquals(PerformanceBand.MEDIUM,
                PerformanceBand.worstOf(PerformanceBand.ELITE, PerformanceBand.MEDIUM, PerformanceBand.HIGH));
        assertEquals(PerformanceBand.ELITE, PerformanceBand.worstOf());
    }
}
