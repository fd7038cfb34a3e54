package com.parallel.wordflux;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-wide totals. Only the scheduler thread touches an instance, one terminal message at a time.
 */
public class Aggregator {

    private final List<FileCountResult> successful = new ArrayList<>();
    private final List<FileFailure> failed = new ArrayList<>();
    private final Map<String, Long> combined = new HashMap<>();
    private long totalWords;
    private long totalLines;

    public void record(FileOutcome outcome) {
        if (outcome instanceof FileCountResult result) {
            successful.add(result);
            FrequencyMaps.mergeInto(combined, result.frequencies());
            totalWords += result.totalWords();
            totalLines += result.linesProcessed();
        } else if (outcome instanceof FileFailure failure) {
            failed.add(failure);
        } else {
            throw new IllegalArgumentException("Unknown outcome type: " + outcome);
        }
    }

    public int recorded() {
        return successful.size() + failed.size();
    }

    public AggregateResult result(double durationSeconds, int workersUsed) {
        return new AggregateResult(
                Collections.unmodifiableList(new ArrayList<>(successful)),
                Collections.unmodifiableList(new ArrayList<>(failed)),
                Map.copyOf(combined),
                totalWords,
                combined.size(),
                totalLines,
                durationSeconds,
                workersUsed);
    }
}
