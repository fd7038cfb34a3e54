package com.parallel.wordflux;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Counts for one fully scanned file. The frequency map is read-only once the result exists.
 */
public record FileCountResult(
        Path path,
        long totalWords,
        int uniqueWords,
        long linesProcessed,
        Map<String, Long> frequencies,
        double durationSeconds) implements FileOutcome {

    public FileCountResult {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(frequencies, "frequencies");
        if (uniqueWords != frequencies.size()) {
            throw new IllegalArgumentException("uniqueWords must equal the number of distinct tokens");
        }
        frequencies = Collections.unmodifiableMap(frequencies);
    }

    @Override
    public boolean success() {
        return true;
    }
}
