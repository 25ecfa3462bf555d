package com.repo.velocity.forecast;

import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.PullRequestRecord;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Buckets records into ISO weeks (Monday start, UTC) to feed the forecaster.
 */
public class WeeklySeriesBuilder {

    /**
     * Total commit churn per week, from the first active week to the last.
     * Quiet weeks in between count as zero churn.
     */
    public WeeklySeries weeklyChurn(List<CommitRecord> commits) {
        TreeMap<LocalDate, Double> byWeek = new TreeMap<>();
        for (CommitRecord commit : commits) {
            if (commit == null) {
                continue;
            }
            byWeek.merge(weekStart(commit.timestamp()), (double) commit.churn(), Double::sum);
        }

        List<WeeklySeries.Point> points = new ArrayList<>();
        if (!byWeek.isEmpty()) {
            LocalDate last = byWeek.lastKey();
            for (LocalDate week = byWeek.firstKey(); !week.isAfter(last); week = week.plusWeeks(1)) {
                points.add(new WeeklySeries.Point(week, byWeek.getOrDefault(week, 0.0)));
            }
        }
        return new WeeklySeries(ForecastMetric.CHURN, points);
    }

    /**
     * Mean open-to-merge time in hours of the pull requests merged each week.
     * Weeks without a merge are left out rather than counted as zero.
     */
    public WeeklySeries weeklyCycleTime(List<PullRequestRecord> pullRequests) {
        Map<LocalDate, double[]> byWeek = new TreeMap<>();
        for (PullRequestRecord pr : pullRequests) {
            if (pr == null) {
                continue;
            }
            OptionalDouble hours = pr.leadTimeHours();
            if (hours.isEmpty()) {
                continue;
            }
            // [sum, count]
            double[] acc = byWeek.computeIfAbsent(weekStart(pr.mergedAt()), w -> new double[2]);
            acc[0] += hours.getAsDouble();
            acc[1]++;
        }

        List<WeeklySeries.Point> points = new ArrayList<>();
        for (Map.Entry<LocalDate, double[]> entry : byWeek.entrySet()) {
            double[] acc = entry.getValue();
            points.add(new WeeklySeries.Point(entry.getKey(), acc[0] / acc[1]));
        }
        return new WeeklySeries(ForecastMetric.CYCLE_TIME, points);
    }

    static LocalDate weekStart(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
