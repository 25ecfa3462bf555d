package com.repo.velocity.churn;

import com.repo.velocity.core.AnalysisWarning;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Team-wide churn totals plus per-author statistics.
 */
public record ChurnSummary(
        int commitCount,
        long totalAdditions,
        long totalDeletions,
        long totalFilesChanged,
        double avgChurn,
        double medianChurn,
        double churnStdDev,

        /** Author to stats, ranked by productivity score */
        Map<String, AuthorChurnStats> authors,

        /** Pull requests per size bucket, every bucket present */
        Map<PrSizeCategory, Integer> prSizeDistribution,

        List<AnalysisWarning> warnings) {

    public ChurnSummary {
        authors = Collections.unmodifiableMap(new LinkedHashMap<>(authors));
        Map<PrSizeCategory, Integer> distribution = new EnumMap<>(PrSizeCategory.class);
        distribution.putAll(prSizeDistribution);
        prSizeDistribution = Collections.unmodifiableMap(distribution);
        warnings = List.copyOf(warnings);
    }

    public long totalChurn() {
        return totalAdditions + totalDeletions;
    }

    public long netChange() {
        return totalAdditions - totalDeletions;
    }

    /**
     * Well-formed summary of an empty batch.
     */
    public static ChurnSummary empty() {
        return empty(List.of());
    }

    public static ChurnSummary empty(List<AnalysisWarning> warnings) {
        Map<PrSizeCategory, Integer> distribution = new EnumMap<>(PrSizeCategory.class);
        for (PrSizeCategory category : PrSizeCategory.values()) {
            distribution.put(category, 0);
        }
        return new ChurnSummary(0, 0, 0, 0, 0.0, 0.0, 0.0, Map.of(), distribution, warnings);
    }
}
