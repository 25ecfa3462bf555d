package com.repo.velocity.core;

import java.time.Instant;

import static com.repo.velocity.core.MalformedRecordException.requireNonNegative;
import static com.repo.velocity.core.MalformedRecordException.requirePresent;
import static com.repo.velocity.core.MalformedRecordException.requireText;

/**
 * A single harvested commit.
 */
public record CommitRecord(
        /** Commit hash, unique within a batch */
        String sha,

        /** Author login or email */
        String author,

        /** Commit time */
        Instant timestamp,

        /** Lines added */
        int additions,

        /** Lines deleted */
        int deletions,

        /** Number of files touched */
        int filesChanged,

        /** Commit message (may be empty) */
        String message) {

    public CommitRecord {
        requireText(sha, sha, "sha");
        requireText(sha, author, "author");
        requirePresent(sha, timestamp, "timestamp");
        requireNonNegative(sha, additions, "additions");
        requireNonNegative(sha, deletions, "deletions");
        requireNonNegative(sha, filesChanged, "filesChanged");
        message = message == null ? "" : message;
    }

    /**
     * Lines added plus lines deleted.
     */
    public long churn() {
        return (long) additions + deletions;
    }
}
