package com.repo.velocity.churn;

/**
 * Churn aggregated over one author's commits.
 */
public record AuthorChurnStats(
        String author,
        int commitCount,
        long totalAdditions,
        long totalDeletions,
        long filesChanged,

        /** Deletions / max(additions, 1) */
        double churnRatio,

        /** Total churn divided by commit count */
        double avgChurnPerCommit,

        /** Ranking score only, not used by any threshold */
        double productivityScore) {

    public long churn() {
        return totalAdditions + totalDeletions;
    }

    public long netChange() {
        return totalAdditions - totalDeletions;
    }

    public double filesPerCommit() {
        return commitCount == 0 ? 0.0 : (double) filesChanged / commitCount;
    }
}
