package com.repo.velocity.rules;

import com.repo.velocity.core.AnalysisWarning;
import com.repo.velocity.core.AnalyticsConfig;
import com.repo.velocity.core.CommitRecord;
import com.repo.velocity.core.Statistics;

import java.util.ArrayList;
import java.util.List;

/**
 * IQR fence outlier detection over commit churn.
 * A commit is an outlier when its churn lies outside
 * {@code [Q1 - k*IQR, Q3 + k*IQR]}, k = 1.5 by default.
 */
public class OutlierDetector {

    private final AnalyticsConfig config;

    public OutlierDetector(AnalyticsConfig config) {
        this.config = config;
    }

    public OutlierReport detect(List<CommitRecord> commits) {
        int minPoints = config.getOutlierMinPoints();
        if (commits.size() < minPoints) {
            return OutlierReport.empty(List.of(AnalysisWarning.insufficientData(RiskClassifier.STAGE,
                    "outlier detection needs at least " + minPoints + " commits, got " + commits.size())));
        }

        List<Long> churn = commits.stream().map(CommitRecord::churn).toList();
        double q1 = Statistics.quantile(churn, 0.25);
        double q3 = Statistics.quantile(churn, 0.75);
        double spread = config.getIqrMultiplier() * (q3 - q1);
        double lowerFence = q1 - spread;
        double upperFence = q3 + spread;

        List<ChurnOutlier> outliers = new ArrayList<>();
        for (CommitRecord commit : commits) {
            if (commit.churn() > upperFence) {
                outliers.add(new ChurnOutlier(commit.sha(), commit.author(), commit.churn(),
                        ChurnOutlier.Direction.HIGH));
            } else if (commit.churn() < lowerFence) {
                outliers.add(new ChurnOutlier(commit.sha(), commit.author(), commit.churn(),
                        ChurnOutlier.Direction.LOW));
            }
        }
        return new OutlierReport(q1, q3, lowerFence, upperFence, outliers, List.of());
    }
}
