package com.repo.velocity.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Record builders shared by the tests. {@link #T0} is a Monday at midnight UTC.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Fixtures() {
    }

    public static Instant hoursAfter(double hours) {
        return T0.plus(Duration.ofMinutes(Math.round(hours * 60)));
    }

    public static Instant daysAfter(int days) {
        return T0.plus(Duration.ofDays(days));
    }

    public static CommitRecord commit(String sha, String author, int additions, int deletions, int files) {
        return new CommitRecord(sha, author, T0, additions, deletions, files, "change " + sha);
    }

    public static CommitRecord commitAt(String sha, Instant at, int additions, int deletions) {
        return new CommitRecord(sha, "alice", at, additions, deletions, 1, "");
    }

    public static PullRequestRecord mergedPr(String id, int reviews, int additions, int deletions, CiStatus ci) {
        return new PullRequestRecord(id, "alice", T0, hoursAfter(10), reviews, additions, deletions, 2, ci);
    }

    public static PullRequestRecord prMergedAt(String id, Instant created, Instant merged) {
        return new PullRequestRecord(id, "alice", created, merged, 2, 10, 5, 1, CiStatus.SUCCESS);
    }

    public static DeploymentRecord deployment(String id, Instant at, DeploymentStatus status) {
        return new DeploymentRecord(id, at, status);
    }

    public static IncidentRecord incident(String id, Instant detected, Instant resolved) {
        return new IncidentRecord(id, detected, resolved);
    }
}
