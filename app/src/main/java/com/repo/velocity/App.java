package com.repo.velocity;

import com.repo.velocity.churn.AuthorChurnStats;
import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.DeploymentRecord;
import com.repo.velocity.core.IncidentRecord;
import com.repo.velocity.core.PullRequestRecord;
import com.repo.velocity.dora.DoraMetrics;
import com.repo.velocity.forecast.ForecastResult;
import com.repo.velocity.ingest.LoadResult;
import com.repo.velocity.ingest.RecordLoader;
import com.repo.velocity.insights.Finding;
import com.repo.velocity.pipeline.AnalysisReport;
import com.repo.velocity.pipeline.AnalyticsPipeline;
import com.repo.velocity.report.CsvReporter;
import com.repo.velocity.report.ReportWriter;
import com.repo.velocity.rules.RiskAssessment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Velocity Analytics - churn, risk, DORA and forecasts from harvested records.
 *
 * Usage: java -jar app.jar --commits <file> [--prs <file>] [--deployments <file>]
 * [--incidents <file>] [--window-days <n>] [--config <file>] [--output <dir>]
 */
public class App {

    static final int DEFAULT_WINDOW_DAYS = 30;

    public static void main(String[] args) {
        System.out.println("=== Velocity Analytics ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            System.exit(1);
        }

        try {
            new App().run(cliArgs);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: java -jar app.jar --commits <file> [options]

                Arguments:
                  --commits <file>       JSON array of commits (required)
                  --prs <file>           JSON array of pull requests
                  --deployments <file>   JSON array of deployments
                  --incidents <file>     JSON array of incidents
                  --window-days <n>      Observation window in days (default: 30)
                  --config <file>        YAML configuration (default: ./velocity.yaml if present)
                  --output <dir>         Output directory for reports (default: current directory)
                """);
    }

    record CliArgs(
            Path commitsFile,
            Path prsFile,
            Path deploymentsFile,
            Path incidentsFile,
            int windowDays,
            Path configFile,
            Path outputDir) {
    }

    static CliArgs parseArgs(String[] args) {
        Path commitsFile = null;
        Path prsFile = null;
        Path deploymentsFile = null;
        Path incidentsFile = null;
        int windowDays = DEFAULT_WINDOW_DAYS;
        Path configFile = null;
        Path outputDir = Path.of(".");

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--commits" -> {
                    if (i + 1 < args.length)
                        commitsFile = Path.of(args[++i]);
                }
                case "--prs" -> {
                    if (i + 1 < args.length)
                        prsFile = Path.of(args[++i]);
                }
                case "--deployments" -> {
                    if (i + 1 < args.length)
                        deploymentsFile = Path.of(args[++i]);
                }
                case "--incidents" -> {
                    if (i + 1 < args.length)
                        incidentsFile = Path.of(args[++i]);
                }
                case "--window-days" -> {
                    if (i + 1 < args.length) {
                        try {
                            windowDays = Integer.parseInt(args[++i]);
                        } catch (NumberFormatException e) {
                            return null;
                        }
                    }
                }
                case "--config" -> {
                    if (i + 1 < args.length)
                        configFile = Path.of(args[++i]);
                }
                case "--output" -> {
                    if (i + 1 < args.length)
                        outputDir = Path.of(args[++i]);
                }
                default -> {
                    // unknown flags are ignored
                }
            }
        }

        if (commitsFile == null) {
            return null;
        }
        return new CliArgs(commitsFile, prsFile, deploymentsFile, incidentsFile, windowDays, configFile, outputDir);
    }

    void run(CliArgs args) throws IOException {
        AnalyticsConfig config = args.configFile() != null
                ? AnalyticsConfig.loadFile(args.configFile())
                : AnalyticsConfig.load(Path.of("."));

        // Phase 1: Load records
        System.out.println("\n>>> PHASE 1: LOADING RECORDS <<<");
        RecordLoader loader = new RecordLoader();
        List<AnalysisWarning> loadWarnings = new ArrayList<>();

        LoadResult<CommitRecord> commits = loader.loadCommits(args.commitsFile());
        loadWarnings.addAll(commits.warnings());
        LoadResult<PullRequestRecord> prs = args.prsFile() != null
                ? loader.loadPullRequests(args.prsFile()) : LoadResult.empty();
        loadWarnings.addAll(prs.warnings());
        LoadResult<DeploymentRecord> deployments = args.deploymentsFile() != null
                ? loader.loadDeployments(args.deploymentsFile()) : LoadResult.empty();
        loadWarnings.addAll(deployments.warnings());
        LoadResult<IncidentRecord> incidents = args.incidentsFile() != null
                ? loader.loadIncidents(args.incidentsFile()) : LoadResult.empty();
        loadWarnings.addAll(incidents.warnings());

        System.out.printf("Commits: %d | Pull requests: %d | Deployments: %d | Incidents: %d | Skipped: %d%n",
                commits.records().size(), prs.records().size(), deployments.records().size(),
                incidents.records().size(), loadWarnings.size());

        // Phase 2: Analyze
        System.out.println("\n>>> PHASE 2: ANALYZING VELOCITY <<<");
        AnalysisReport report = new AnalyticsPipeline(config).runAnalytics(
                commits.records(), prs.records(), deployments.records(), incidents.records(), args.windowDays());

        printAuthorTable(report.authorStats());
        printDora(report.dora());
        printForecasts(report.forecasts());

        // Phase 3: Generate reports
        System.out.println("\n>>> PHASE 3: GENERATING REPORTS <<<");
        Files.createDirectories(args.outputDir());
        Path jsonPath = args.outputDir().resolve("velocity-report.json");
        Path authorsPath = args.outputDir().resolve("velocity-authors.csv");
        Path risksPath = args.outputDir().resolve("velocity-risks.csv");

        new ReportWriter().write(report, jsonPath);
        System.out.println("JSON Report generated at: " + jsonPath.toAbsolutePath());
        CsvReporter csv = new CsvReporter();
        csv.writeAuthors(report.authorStats(), authorsPath);
        System.out.println("CSV Report generated at: " + authorsPath.toAbsolutePath());
        csv.writeRisks(report.riskAssessments(), risksPath);
        System.out.println("CSV Report generated at: " + risksPath.toAbsolutePath());

        printSummary(report, loadWarnings);
    }

    private void printAuthorTable(List<AuthorChurnStats> authors) {
        System.out.println("\n| %-30s | %-7s | %-8s | %-8s | %-6s | %-7s |".formatted(
                "Author", "Commits", "Added", "Deleted", "Ratio", "Score"));
        System.out.println("|" + "-".repeat(32) + "|" + "-".repeat(9) + "|" + "-".repeat(10) + "|"
                + "-".repeat(10) + "|" + "-".repeat(8) + "|" + "-".repeat(9) + "|");
        for (AuthorChurnStats a : authors) {
            System.out.println("| %-30s | %-7d | %-8d | %-8d | %-6.2f | %-7.2f |".formatted(
                    truncate(a.author(), 30),
                    a.commitCount(),
                    a.totalAdditions(),
                    a.totalDeletions(),
                    a.churnRatio(),
                    a.productivityScore()));
        }
    }

    private void printDora(DoraMetrics dora) {
        System.out.println("\nDORA Metrics:");
        System.out.printf("  %-25s: %.1f h (%s)%n", "Lead time", dora.leadTimeHours(), dora.leadTimeBand());
        System.out.printf("  %-25s: %.2f /day (%s)%n", "Deployment frequency",
                dora.deploymentFrequencyPerDay(), dora.deploymentFrequencyBand());
        System.out.printf("  %-25s: %.0f%% (%s)%n", "Change failure rate",
                dora.changeFailureRate() * 100, dora.changeFailureRateBand());
        System.out.printf("  %-25s: %.1f h (%s)%n", "MTTR", dora.mttrHours(), dora.mttrBand());
        System.out.printf("  %-25s: %s%n", "Overall", dora.overallBand());
    }

    private void printForecasts(List<ForecastResult> forecasts) {
        System.out.println("\nNext-week Forecasts:");
        for (ForecastResult f : forecasts) {
            System.out.printf("  %-12s: %.1f [%.1f - %.1f] %s, %s confidence%s%n",
                    f.metric().code(),
                    f.predictedValue(),
                    f.range().optimistic(),
                    f.range().pessimistic(),
                    f.trendDirection(),
                    f.confidence(),
                    f.isFallback() ? " (" + f.reason() + ")" : "");
        }
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }

    private void printSummary(AnalysisReport report, List<AnalysisWarning> loadWarnings) {
        System.out.println("\n=== SUMMARY ===");
        System.out.printf("Total churn: %d lines across %d commits (avg %.1f, median %.1f)%n",
                report.churn().totalChurn(), report.churn().commitCount(),
                report.churn().avgChurn(), report.churn().medianChurn());
        System.out.printf("Risk tiers: %d high | %d medium | %d low | %d churn outliers%n",
                report.risk().high().size(), report.risk().medium().size(), report.risk().low().size(),
                report.risk().outliers().outliers().size());

        List<RiskAssessment> topRisks = report.risk().assessments().stream()
                .filter(RiskAssessment::isFlagged)
                .sorted((a, b) -> Integer.compare(b.riskScore(), a.riskScore()))
                .limit(5)
                .toList();

        if (!topRisks.isEmpty()) {
            System.out.println("\nTop 5 Risk Items:");
            for (int i = 0; i < topRisks.size(); i++) {
                RiskAssessment r = topRisks.get(i);
                System.out.printf("  %d. %s by %s (Score: %d, %s: %s)%n",
                        i + 1,
                        truncate(r.itemId(), 40),
                        r.author(),
                        r.riskScore(),
                        r.tier(),
                        String.join(", ", r.factorCodes()));
            }
        }

        if (!report.findings().isEmpty()) {
            System.out.println("\nFindings:");
            for (Finding f : report.findings()) {
                System.out.printf("  [%s] %-26s %s%n", f.kind(), f.code(), f.message());
            }
        }

        int warningCount = loadWarnings.size() + report.warnings().size();
        if (warningCount > 0) {
            System.out.println("\nWarnings (" + warningCount + "):");
            loadWarnings.forEach(w -> System.out.println("  " + w));
            report.warnings().forEach(w -> System.out.println("  " + w));
        }
    }
}
