package com.repo.velocity.core;

/**
 * A degraded condition met while building a report. Warnings never abort a run;
 * they travel with the report so front ends can decide what to surface.
 */
public record AnalysisWarning(String stage, Kind kind, String message) {

    public enum Kind {
        /** A record was missing a required field and was skipped */
        MALFORMED_RECORD,
        /** Too few data points for a confident result; a default was used */
        INSUFFICIENT_DATA,
        /** A zero denominator was floored to 1 */
        DIVISION_GUARD,
        /** A whole stage failed and its empty result was substituted */
        STAGE_FAILURE
    }

    public static AnalysisWarning malformed(String stage, String message) {
        return new AnalysisWarning(stage, Kind.MALFORMED_RECORD, message);
    }

    public static AnalysisWarning insufficientData(String stage, String message) {
        return new AnalysisWarning(stage, Kind.INSUFFICIENT_DATA, message);
    }

    public static AnalysisWarning divisionGuard(String stage, String message) {
        return new AnalysisWarning(stage, Kind.DIVISION_GUARD, message);
    }

    public static AnalysisWarning stageFailure(String stage, String message) {
        return new AnalysisWarning(stage, Kind.STAGE_FAILURE, message);
    }

    @Override
    public String toString() {
        return "[" + stage + "] " + kind + ": " + message;
    }
}
