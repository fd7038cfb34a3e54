package com.parallel.wordflux;

import java.nio.file.Path;

/**
 * Informational messages a worker posts to the scheduler while it runs.
 * The terminal {@link FileOutcome} travels through the worker's future instead.
 */
public interface WorkerMessage {

    /** Position of the file in the submitted list. */
    int index();

    Path path();

    record Started(int index, Path path, long startedAtNanos) implements WorkerMessage {
    }

    record Progress(int index, Path path, long linesProcessed, int uniqueWords, long totalWords)
            implements WorkerMessage {
    }
}
