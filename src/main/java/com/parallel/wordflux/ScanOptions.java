package com.parallel.wordflux;

/**
 * Options for one file scan. A {@code null} listener disables progress reporting.
 */
public record ScanOptions(int progressInterval, ProgressListener listener) {

    public static final int DEFAULT_PROGRESS_INTERVAL = 10_000;

    public ScanOptions {
        if (progressInterval < 1) {
            progressInterval = DEFAULT_PROGRESS_INTERVAL;
        }
    }

    public static ScanOptions defaults() {
        return new ScanOptions(DEFAULT_PROGRESS_INTERVAL, null);
    }

    public static ScanOptions every(int lines, ProgressListener listener) {
        return new ScanOptions(lines, listener);
    }
}
