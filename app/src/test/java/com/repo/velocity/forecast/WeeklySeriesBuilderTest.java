package com.repo.velocity.forecast;

import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.PullRequestRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static com.repo.velocity.core.Fixtures.commitAt;
import static com.repo.velocity.core.Fixtures.daysAfter;
import static com.repo.velocity.core.Fixtures.hoursAfter;
import static com.repo.velocity.core.Fixtures.prMergedAt;
import static org.junit.jupiter.api.Assertions.*;

class WeeklySeriesBuilderTest {

    private final WeeklySeriesBuilder builder = new WeeklySeriesBuilder();

    @Test
    void testWeeklyChurnFillsQuietWeeks() {
        List<CommitRecord> commits = List.of(
                commitAt("a", daysAfter(0), 80, 20),
                commitAt("b", daysAfter(2), 40, 10),
                commitAt("c", daysAfter(15), 30, 0));

        WeeklySeries series = builder.weeklyChurn(commits);

        assertEquals(ForecastMetric.CHURN, series.metric());
        assertEquals(List.of(150.0, 0.0, 30.0), series.values());
        assertEquals(LocalDate.of(2024, 1, 1), series.points().get(0).weekStart());
        assertEquals(LocalDate.of(2024, 1, 15), series.points().get(2).weekStart());
    }

    @Test
    void testSundayBelongsToPrecedingMonday() {
        assertEquals(LocalDate.of(2024, 1, 1),
                WeeklySeriesBuilder.weekStart(Instant.parse("2024-01-07T23:59:59Z")));
        assertEquals(LocalDate.of(2024, 1, 8),
                WeeklySeriesBuilder.weekStart(Instant.parse("2024-01-08T00:00:00Z")));
    }

    @Test
    void testWeeklyChurnEmpty() {
        assertTrue(builder.weeklyChurn(List.of()).isEmpty());
        assertTrue(builder.weeklyChurn(Arrays.asList((CommitRecord) null)).isEmpty());
    }

    @Test
    void testWeeklyCycleTimeSkipsWeeksWithoutMerges() {
        List<PullRequestRecord> prs = List.of(
                prMergedAt("1", hoursAfter(0), hoursAfter(10)),
                prMergedAt("2", hoursAfter(4), hoursAfter(24)),
                prMergedAt("3", daysAfter(15), hoursAfter(15 * 24 + 5)),
                prMergedAt("open", hoursAfter(0), null));

        WeeklySeries series = builder.weeklyCycleTime(prs);

        assertEquals(ForecastMetric.CYCLE_TIME, series.metric());
        assertEquals(List.of(15.0, 5.0), series.values());
        assertEquals(LocalDate.of(2024, 1, 15), series.points().get(1).weekStart());
    }
}
