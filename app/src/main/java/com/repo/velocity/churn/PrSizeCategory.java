package com.repo.velocity.churn;

/**
 * Pull request size buckets by churn.
 */
public enum PrSizeCategory {
    SMALL(50),
    MEDIUM(300),
    LARGE(1000),
    EXTRA_LARGE(Integer.MAX_VALUE);

    private final int upperBoundExclusive;

    PrSizeCategory(int upperBoundExclusive) {
        this.upperBoundExclusive = upperBoundExclusive;
    }

    public static PrSizeCategory of(long churn) {
        for (PrSizeCategory category : values()) {
            if (churn < category.upperBoundExclusive) {
                return category;
            }
        }
        return EXTRA_LARGE;
    }
}
