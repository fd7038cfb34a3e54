package com.parallel.wordflux;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combined outcome of a run. Totals cover successful files only.
 */
public record AggregateResult(
        List<FileCountResult> successful,
        List<FileFailure> failed,
        Map<String, Long> combinedFrequencies,
        long totalWords,
        int totalUniqueWords,
        long totalLinesProcessed,
        double durationSeconds,
        int workersUsed) {

    public AggregateResult {
        Objects.requireNonNull(successful, "successful");
        Objects.requireNonNull(failed, "failed");
        Objects.requireNonNull(combinedFrequencies, "combinedFrequencies");
        if (totalUniqueWords != combinedFrequencies.size()) {
            throw new IllegalArgumentException("totalUniqueWords must equal the number of distinct tokens");
        }
    }

    public static AggregateResult empty() {
        return new AggregateResult(List.of(), List.of(), Map.of(), 0, 0, 0, 0.0, 0);
    }

    public int totalFiles() {
        return successful.size() + failed.size();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public List<WordCount> topWords(int n) {
        return FrequencyMaps.topWords(combinedFrequencies, n);
    }
}
