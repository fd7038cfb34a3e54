package com.parallel.wordflux;

/**
 * Periodic progress of a single scan.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(long linesProcessed, int uniqueWordsSoFar, long totalWordsSoFar);
}
