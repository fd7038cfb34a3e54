package com.parallel.wordflux;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;

/**
 * Scans a single file on a pool thread. The worker owns its reader and its frequency map;
 * it only talks to the scheduler through the message channel and its own return value.
 * Handled scan errors come back as a {@link FileFailure}; anything else escapes and is
 * turned into a crash by the scheduler.
 */
public class FileWorker implements Callable<FileOutcome> {

    private final int index;
    private final Path path;
    private final FileCounter counter;
    private final int progressInterval;
    private final BlockingQueue<WorkerMessage> channel;

    public FileWorker(int index, Path path, FileCounter counter, int progressInterval,
                      BlockingQueue<WorkerMessage> channel) {
        this.index = index;
        this.path = Objects.requireNonNull(path, "path");
        this.counter = Objects.requireNonNull(counter, "counter");
        this.progressInterval = progressInterval;
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public int index() {
        return index;
    }

    public Path path() {
        return path;
    }

    @Override
    public FileOutcome call() {
        channel.offer(new WorkerMessage.Started(index, path, System.nanoTime()));
        ScanOptions options = ScanOptions.every(progressInterval, (lines, unique, total) ->
                channel.offer(new WorkerMessage.Progress(index, path, lines, unique, total)));
        try {
            return counter.count(path, options);
        } catch (FileCountException e) {
            return e.toFailure();
        }
    }
}
