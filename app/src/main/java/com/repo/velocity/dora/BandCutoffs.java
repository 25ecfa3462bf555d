package com.repo.velocity.dora;

/**
 * Cutoffs that map one DORA metric onto a {@link PerformanceBand}.
 *
 * <p>For "higher is better" metrics (deployment frequency) a value at or above a cutoff
 * earns that band. For "lower is better" metrics the comparison is strict for the time
 * based metrics and inclusive for the failure rate, mirroring the published tables:
 * lead time {@code < 24h} is elite while a failure rate of exactly 15% still is.
 */
public record BandCutoffs(double elite, double high, double medium, Direction direction) {

    public enum Direction {
        HIGHER_IS_BETTER,
        LOWER_IS_BETTER,
        LOWER_OR_EQUAL_IS_BETTER
    }

    public static BandCutoffs higherIsBetter(double elite, double high, double medium) {
        return new BandCutoffs(elite, high, medium, Direction.HIGHER_IS_BETTER);
    }

    public static BandCutoffs lowerIsBetter(double elite, double high, double medium) {
        return new BandCutoffs(elite, high, medium, Direction.LOWER_IS_BETTER);
    }

    public static BandCutoffs atMost(double elite, double high, double medium) {
        return new BandCutoffs(elite, high, medium, Direction.LOWER_OR_EQUAL_IS_BETTER);
    }

    public PerformanceBand band(double value) {
        if (meets(value, elite)) {
            return PerformanceBand.ELITE;
        }
        if (meets(value, high)) {
            return PerformanceBand.HIGH;
        }
        if (meets(value, medium)) {
            return PerformanceBand.MEDIUM;
        }
        return PerformanceBand.LOW;
    }

    private boolean meets(double value, double cutoff) {
        return switch (direction) {
            case HIGHER_IS_BETTER -> value >= cutoff;
            case LOWER_IS_BETTER -> value < cutoff;
            case LOWER_OR_EQUAL_IS_BETTER -> value <= cutoff;
        };
    }
}
