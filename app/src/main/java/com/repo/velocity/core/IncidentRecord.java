package com.repo.velocity.core;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;

import static com.repo.velocity.core.MalformedRecordException.requirePresent;
import static com.repo.velocity.core.MalformedRecordException.requireText;

/**
 * A production incident. The status is derived from {@code resolvedAt}: an incident
 * without a resolution time is open and does not count towards MTTR.
 */
public record IncidentRecord(String id, Instant detectedAt, Instant resolvedAt) {

    public IncidentRecord {
        requireText(id, id, "id");
        requirePresent(id, detectedAt, "detectedAt");
        if (resolvedAt != null && resolvedAt.isBefore(detectedAt)) {
            throw new MalformedRecordException(id, "resolvedAt is before detectedAt");
        }
    }

    public IncidentStatus status() {
        return resolvedAt == null ? IncidentStatus.OPEN : IncidentStatus.RESOLVED;
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public OptionalDouble recoveryHours() {
        if (resolvedAt == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Durations.hours(Duration.between(detectedAt, resolvedAt)));
    }
}
