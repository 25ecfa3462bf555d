package com.repo.velocity.churn;

import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.CiStatus;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.PullRequestRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.repo.velocity.core.Fixtures.commit;
import static com.repo.velocity.core.Fixtures.mergedPr;
import static org.junit.jupiter.api.Assertions.*;

class ChurnAggregatorTest {

    private final ChurnAggregator aggregator = new ChurnAggregator();

    @Test
    void testTeamTotals() {
        ChurnSummary summary = aggregator.aggregate(List.of(
                commit("c1", "alice", 100, 50, 2),
                commit("c2", "bob", 200, 10, 3),
                commit("c3", "alice", 50, 300, 4)));

        assertEquals(3, summary.commitCount());
        assertEquals(710, summary.totalChurn());
        assertEquals(summary.totalAdditions() + summary.totalDeletions(), summary.totalChurn());
        assertEquals(236.7, summary.avgChurn(), 0.05);
        assertEquals(210.0, summary.medianChurn());
        assertEquals(9, summary.totalFilesChanged());
        assertEquals(-10, summary.netChange());
    }

    @Test
    void testAuthorChurnSumsToTotal() {
        ChurnSummary summary = aggregator.aggregate(List.of(
                commit("c1", "alice", 100, 50, 2),
                commit("c2", "bob", 200, 10, 3),
                commit("c3", "alice", 50, 300, 4),
                commit("c4", "carol", 7, 0, 1)));

        long authorChurn = summary.authors().values().stream().mapToLong(AuthorChurnStats::churn).sum();
        assertEquals(summary.totalChurn(), authorChurn);

        AuthorChurnStats alice = summary.authors().get("alice");
        assertEquals(2, alice.commitCount());
        assertEquals(150, alice.totalAdditions());
        assertEquals(350, alice.totalDeletions());
        assertEquals(350.0 / 150.0, alice.churnRatio(), 1e-12);
        assertEquals(250.0, alice.avgChurnPerCommit());
        assertEquals(3.0, alice.filesPerCommit());
    }

    @Test
    void testChurnRatioWithoutAdditions() {
        ChurnSummary summary = aggregator.aggregate(List.of(commit("c1", "dave", 0, 40, 1)));
        AuthorChurnStats dave = summary.authors().get("dave");
        assertEquals(40.0, dave.churnRatio(), "Deletions over max(additions, 1)");
        assertTrue(Double.isFinite(dave.churnRatio()));
    }

    @Test
    void testProductivityScore() {
        // 0.3 * 2 + 0.4 * (500 / 100) + 0.3 * (6 / 10)
        assertEquals(2.78, ChurnAggregator.productivityScore(2, 500, 6), 1e-9);
    }

    @Test
    void testAuthorsRankedByScore() {
        ChurnSummary summary = aggregator.aggregate(List.of(
                commit("c1", "zed", 10, 0, 1),
                commit("c2", "amy", 900, 100, 9),
                commit("c3", "bo", 10, 0, 1)));

        List<String> order = new ArrayList<>(summary.authors().keySet());
        assertEquals(List.of("amy", "bo", "zed"), order, "Highest score first, ties by name");
    }

    @Test
    void testEmptyInput() {
        ChurnSummary summary = aggregator.aggregate(List.of());
        assertEquals(0, summary.commitCount());
        assertEquals(0, summary.totalChurn());
        assertEquals(0.0, summary.avgChurn());
        assertEquals(0.0, summary.churnStdDev());
        assertTrue(summary.authors().isEmpty());
        assertEquals(PrSizeCategory.values().length, summary.prSizeDistribution().size());
    }

    @Test
    void testNullCommitsSkippedWithWarning() {
        List<CommitRecord> commits = Arrays.asList(commit("c1", "alice", 10, 5, 1), null);
        ChurnSummary summary = aggregator.aggregate(commits);
        assertEquals(1, summary.commitCount());
        assertEquals(1, summary.warnings().size());
        assertEquals(AnalysisWarning.Kind.MALFORMED_RECORD, summary.warnings().get(0).kind());
    }

    @Test
    void testPrSizeDistribution() {
        List<PullRequestRecord> prs = List.of(
                mergedPr("1", 2, 20, 10, CiStatus.SUCCESS),
                mergedPr("2", 2, 49, 0, CiStatus.SUCCESS),
                mergedPr("3", 2, 50, 0, CiStatus.SUCCESS),
                mergedPr("4", 2, 600, 100, CiStatus.SUCCESS),
                mergedPr("5", 2, 1000, 0, CiStatus.SUCCESS));

        ChurnSummary summary = aggregator.aggregate(List.of(), prs);

        assertEquals(2, summary.prSizeDistribution().get(PrSizeCategory.SMALL));
        assertEquals(1, summary.prSizeDistribution().get(PrSizeCategory.MEDIUM));
        assertEquals(1, summary.prSizeDistribution().get(PrSizeCategory.LARGE));
        assertEquals(1, summary.prSizeDistribution().get(PrSizeCategory.EXTRA_LARGE));
    }
}
