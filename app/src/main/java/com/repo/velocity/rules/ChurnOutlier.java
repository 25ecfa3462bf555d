package com.repo.velocity.rules;

/**
 * A commit whose churn falls outside the IQR fences of the team distribution.
 */
public record ChurnOutlier(String itemId, String author, long churn, Direction direction) {

    public enum Direction {
        HIGH,
        LOW
    }
}
