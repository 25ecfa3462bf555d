package com.repo.velocity.forecast;

import java.time.LocalDate;
import java.util.List;

/**
 * Weekly observations of one metric, oldest week first.
 */
public record WeeklySeries(ForecastMetric metric, List<Point> points) {

    /**
     * @param weekStart Monday of the ISO week, UTC
     */
    public record Point(LocalDate weekStart, double value) {
    }

    public WeeklySeries {
        points = List.copyOf(points);
    }

    public List<Double> values() {
        return points.stream().map(Point::value).toList();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }
}
