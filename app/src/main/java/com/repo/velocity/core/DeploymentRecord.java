package com.repo.velocity.core;

import java.time.Instant;

import static com.repo.velocity.core.MalformedRecordException.requirePresent;
import static com.repo.velocity.core.MalformedRecordException.requireText;

/**
 * A production deployment, already normalized by the caller.
 */
public record DeploymentRecord(String id, Instant timestamp, DeploymentStatus status) {

    public DeploymentRecord {
        requireText(id, id, "id");
        requirePresent(id, timestamp, "timestamp");
        requirePresent(id, status, "status");
    }

    public boolean isFailed() {
        return status.isFailure();
    }
}
