package com.repo.velocity.rules;

import com.repo.velocity.core.CiStatus;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.PullRequestRecord;
import com.repo.velocity.core.Statistics;

/**
 * Uniform view over a commit or a pull request for rule evaluation.
 * Review and CI fields are neutral for commits.
 */
public record RiskSubject(
        String itemId,
        Kind kind,
        String author,
        int additions,
        int deletions,
        int filesChanged,
        int reviewCount,
        boolean merged,
        CiStatus ciStatus) {

    public enum Kind {
        COMMIT,
        PULL_REQUEST
    }

    public static RiskSubject of(CommitRecord commit) {
        return new RiskSubject(commit.sha(), Kind.COMMIT, commit.author(),
                commit.additions(), commit.deletions(), commit.filesChanged(),
                0, false, CiStatus.PENDING);
    }

    public static RiskSubject of(PullRequestRecord pr) {
        return new RiskSubject(pr.id(), Kind.PULL_REQUEST, pr.author(),
                pr.additions(), pr.deletions(), pr.filesChanged(),
                pr.reviewCount(), pr.isMerged(), pr.ciStatus());
    }

    public long churn() {
        return (long) additions + deletions;
    }

    public double deletionRatio() {
        return Statistics.guardedRatio(deletions, additions);
    }

    public boolean isPullRequest() {
        return kind == Kind.PULL_REQUEST;
    }
}
