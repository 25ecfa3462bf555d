package com.repo.velocity.forecast;

/**
 * Optimistic and pessimistic bounds around a forecast.
 */
public record ForecastRange(double optimistic, double pessimistic) {
}
