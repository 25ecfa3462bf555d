package com.repo.velocity.core;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;

import static com.repo.velocity.core.MalformedRecordException.requireNonNegative;
import static com.repo.velocity.core.MalformedRecordException.requirePresent;
import static com.repo.velocity.core.MalformedRecordException.requireText;

/**
 * A harvested pull request. {@code mergedAt == null} means open or closed without merge.
 */
public record PullRequestRecord(
        String id,
        String author,
        Instant createdAt,
        Instant mergedAt,
        int reviewCount,
        int additions,
        int deletions,
        int filesChanged,
        CiStatus ciStatus) {

    public PullRequestRecord {
        requireText(id, id, "id");
        requireText(id, author, "author");
        requirePresent(id, createdAt, "createdAt");
        requireNonNegative(id, reviewCount, "reviewCount");
        requireNonNegative(id, additions, "additions");
        requireNonNegative(id, deletions, "deletions");
        requireNonNegative(id, filesChanged, "filesChanged");
        if (mergedAt != null && mergedAt.isBefore(createdAt)) {
            throw new MalformedRecordException(id, "mergedAt is before createdAt");
        }
        ciStatus = ciStatus == null ? CiStatus.PENDING : ciStatus;
    }

    public boolean isMerged() {
        return mergedAt != null;
    }

    public long churn() {
        return (long) additions + deletions;
    }

    /**
     * Hours from creation to merge; empty while the pull request is unmerged.
     */
    public OptionalDouble leadTimeHours() {
        if (mergedAt == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Durations.hours(Duration.between(createdAt, mergedAt)));
    }
}
