package com.repo.velocity.churn;

import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.PullRequestRecord;
import com.repo.velocity.core.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces a batch of commits into team totals and per-author churn statistics.
 * Pure transform: no state survives between calls.
 */
public class ChurnAggregator {

    public static final String STAGE = "churn";

    private static final Logger log = LoggerFactory.getLogger(ChurnAggregator.class);

    // Productivity score weights
    private static final double COMMIT_WEIGHT = 0.3;
    private static final double CHURN_WEIGHT = 0.4;
    private static final double FILES_WEIGHT = 0.3;
    private static final double CHURN_SCALE = 100.0;
    private static final double FILES_SCALE = 10.0;

    // Running totals for one author
    private static final class AuthorAccumulator {
        int commits;
        long additions;
        long deletions;
        long files;
    }

    public ChurnSummary aggregate(List<CommitRecord> commits) {
        return aggregate(commits, List.of());
    }

    /**
     * Aggregate commits and bucket pull requests by size.
     *
     * @param commits      commits of the batch, may be empty
     * @param pullRequests pull requests of the batch, may be empty
     * @return summary; never null
     */
    public ChurnSummary aggregate(List<CommitRecord> commits, List<PullRequestRecord> pullRequests) {
        List<AnalysisWarning> warnings = new ArrayList<>();
        List<Long> churnPerCommit = new ArrayList<>();
        Map<String, AuthorAccumulator> byAuthor = new TreeMap<>();

        long additions = 0;
        long deletions = 0;
        long files = 0;

        for (CommitRecord commit : commits) {
            if (commit == null) {
                warnings.add(AnalysisWarning.malformed(STAGE, "skipped null commit record"));
                continue;
            }
            additions += commit.additions();
            deletions += commit.deletions();
            files += commit.filesChanged();
            churnPerCommit.add(commit.churn());

            AuthorAccumulator acc = byAuthor.computeIfAbsent(commit.author(), a -> new AuthorAccumulator());
            acc.commits++;
            acc.additions += commit.additions();
            acc.deletions += commit.deletions();
            acc.files += commit.filesChanged();
        }

        Map<PrSizeCategory, Integer> distribution = prSizeDistribution(pullRequests, warnings);

        if (churnPerCommit.isEmpty()) {
            log.debug("No commits to aggregate");
            return new ChurnSummary(0, 0, 0, 0, 0.0, 0.0, 0.0, Map.of(), distribution, warnings);
        }

        Map<String, AuthorChurnStats> authors = rankAuthors(byAuthor);
        log.debug("Aggregated {} commits from {} authors", churnPerCommit.size(), authors.size());

        return new ChurnSummary(
                churnPerCommit.size(),
                additions,
                deletions,
                files,
                Statistics.mean(churnPerCommit),
                Statistics.median(churnPerCommit),
                Statistics.sampleStdDev(churnPerCommit),
                authors,
                distribution,
                warnings);
    }

    /**
     * {@code 0.3*commitCount + 0.4*(churn/100) + 0.3*(filesChanged/10)}.
     */
    public static double productivityScore(int commitCount, long churn, long filesChanged) {
        return COMMIT_WEIGHT * commitCount
                + CHURN_WEIGHT * (churn / CHURN_SCALE)
                + FILES_WEIGHT * (filesChanged / FILES_SCALE);
    }

    private Map<String, AuthorChurnStats> rankAuthors(Map<String, AuthorAccumulator> byAuthor) {
        List<AuthorChurnStats> stats = new ArrayList<>();
        for (Map.Entry<String, AuthorAccumulator> entry : byAuthor.entrySet()) {
            AuthorAccumulator acc = entry.getValue();
            long churn = acc.additions + acc.deletions;
            stats.add(new AuthorChurnStats(
                    entry.getKey(),
                    acc.commits,
                    acc.additions,
                    acc.deletions,
                    acc.files,
                    Statistics.guardedRatio(acc.deletions, acc.additions),
                    (double) churn / acc.commits,
                    productivityScore(acc.commits, churn, acc.files)));
        }

        // Highest score first; ties broken by name so the order is stable
        stats.sort(Comparator.comparingDouble(AuthorChurnStats::productivityScore).reversed()
                .thenComparing(AuthorChurnStats::author));

        Map<String, AuthorChurnStats> ranked = new LinkedHashMap<>();
        for (AuthorChurnStats s : stats) {
            ranked.put(s.author(), s);
        }
        return ranked;
    }

    private Map<PrSizeCategory, Integer> prSizeDistribution(List<PullRequestRecord> pullRequests,
            List<AnalysisWarning> warnings) {
        Map<PrSizeCategory, Integer> distribution = new EnumMap<>(PrSizeCategory.class);
        for (PrSizeCategory category : PrSizeCategory.values()) {
            distribution.put(category, 0);
        }
        for (PullRequestRecord pr : pullRequests) {
            if (pr == null) {
                warnings.add(AnalysisWarning.malformed(STAGE, "skipped null pull request record"));
                continue;
            }
            distribution.merge(PrSizeCategory.of(pr.churn()), 1, Integer::sum);
        }
        return distribution;
    }
}
