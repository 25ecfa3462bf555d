package com.repo.velocity.ingest;

import com.repo.velocity.core.AnalysisWarning;

import java.util.List;

/**
 * Records parsed from one file plus a warning per record that had to be skipped.
 */
public record LoadResult<T>(List<T> records, List<AnalysisWarning> warnings) {

    public LoadResult {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public static <T> LoadResult<T> empty() {
        return new LoadResult<>(List.of(), List.of());
    }
}
