package com.parallel.wordflux;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntSupplier;

/**
 * Runs one {@link FileWorker} per file with bounded concurrency and folds every terminal
 * outcome into a single {@link AggregateResult}. Outcomes are recorded in submission order,
 * and a failing or crashing file never affects the others.
 */
public class BatchScheduler {

    private static final long POLL_MILLIS = 25;

    private final SchedulerConfig config;
    private final FileCounter counter;
    private final Consumer<String> logger;
    private final IntSupplier availableProcessors;

    public BatchScheduler(SchedulerConfig config, Consumer<String> logger) {
        this(config, new StreamingFileCounter(), logger, () -> Runtime.getRuntime().availableProcessors());
    }

    public BatchScheduler(SchedulerConfig config,
                          FileCounter counter,
                          Consumer<String> logger,
                          IntSupplier availableProcessors) {
        this.config = Objects.requireNonNull(config, "config").normalized();
        this.counter = Objects.requireNonNull(counter, "counter");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.availableProcessors = Objects.requireNonNull(availableProcessors, "availableProcessors");
    }

    /**
     * {@code max(1, min(configured, fileCount, available))}; an unset configuration means {@code available}.
     */
    public static int effectiveConcurrency(Integer configured, int fileCount, int available) {
        int requested = configured != null ? configured : available;
        return Math.max(1, Math.min(requested, Math.min(fileCount, available)));
    }

    /**
     * Splits {@code items} into consecutive groups of at most {@code size}, keeping their order.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + size);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return batches;
    }

    public SchedulerConfig config() {
        return config;
    }

    public AggregateResult run(List<Path> files) throws InterruptedException {
        Objects.requireNonNull(files, "files");
        if (files.isEmpty()) {
            if (config.verbose()) {
                logger.accept(LogFormat.stamp("No files to process."));
            }
            return AggregateResult.empty();
        }

        long start = System.nanoTime();
        int available = Math.max(1, availableProcessors.getAsInt());
        if (config.maxWorkers() != null && config.maxWorkers() < 1) {
            logger.accept(LogFormat.stamp("maxWorkers=" + config.maxWorkers() + " is below 1, using a single worker."));
        }
        int workers = effectiveConcurrency(config.maxWorkers(), files.size(), available);

        if (config.verbose()) {
            logger.accept(LogFormat.rule('='));
            logger.accept("Word count (" + config.mode().name().toLowerCase(Locale.ROOT) + " scheduling)");
            logger.accept("   Available processors: " + available);
            logger.accept("   Workers:              " + workers);
            logger.accept("   Files:                " + files.size());
            logger.accept(LogFormat.rule('='));
        }

        Aggregator aggregator = new Aggregator();
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        try {
            if (config.mode() == ScheduleMode.ROLLING) {
                dispatch(pool, files, 0, aggregator);
            } else {
                List<List<Path>> batches = partition(files, workers);
                int offset = 0;
                for (int b = 0; b < batches.size(); b++) {
                    if (config.verbose() && batches.size() > 1) {
                        logger.accept(LogFormat.stamp("Batch " + (b + 1) + "/" + batches.size()));
                    }
                    dispatch(pool, batches.get(b), offset, aggregator);
                    offset += batches.get(b).size();
                }
            }
        } finally {
            pool.shutdownNow();
        }

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        AggregateResult result = aggregator.result(seconds, workers);
        if (config.verbose()) {
            logSummary(result);
        }
        return result;
    }

    /**
     * Submits one worker per path and blocks until every one of them has a terminal outcome.
     */
    private void dispatch(ExecutorService pool, List<Path> group, int offset, Aggregator aggregator)
            throws InterruptedException {
        int n = group.size();
        BlockingQueue<WorkerMessage> channel = new LinkedBlockingQueue<>();
        List<Future<FileOutcome>> futures = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            futures.add(pool.submit(new FileWorker(offset + i, group.get(i), counter,
                    config.progressInterval(), channel)));
        }

        FileOutcome[] outcomes = new FileOutcome[n];
        long[] startedAt = new long[n];
        boolean[] abandoned = new boolean[n];
        int next = 0;
        while (next < n) {
            WorkerMessage message = channel.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (message != null) {
                handle(message, startedAt, abandoned, offset);
            }

            for (int i = next; i < n; i++) {
                if (outcomes[i] != null) {
                    continue;
                }
                Future<FileOutcome> future = futures.get(i);
                if (future.isDone()) {
                    outcomes[i] = collect(future, offset + i, group.get(i));
                } else if (timedOut(startedAt[i])) {
                    future.cancel(true);
                    abandoned[i] = true;
                    outcomes[i] = new FileFailure(group.get(i), ErrorKind.WORKER_TIMEOUT,
                            "Worker exceeded " + config.workerTimeout().toMillis() + " ms");
                }
            }

            // a finished worker has posted all of its messages, so drain before recording it
            while ((message = channel.poll()) != null) {
                handle(message, startedAt, abandoned, offset);
            }

            while (next < n && outcomes[next] != null) {
                record(aggregator, offset + next, outcomes[next]);
                next++;
            }
        }
    }

    private void handle(WorkerMessage message, long[] startedAt, boolean[] abandoned, int offset) {
        int slot = message.index() - offset;
        if (abandoned[slot]) {
            return;
        }
        int id = message.index() + 1;
        if (message instanceof WorkerMessage.Started started) {
            startedAt[slot] = started.startedAtNanos();
            if (config.verbose()) {
                logger.accept(LogFormat.stamp("Worker " + id + ": processing " + started.path()));
            }
        } else if (message instanceof WorkerMessage.Progress progress) {
            if (config.verbose()) {
                logger.accept(LogFormat.stamp("Worker " + id + ": "
                        + LogFormat.number(progress.linesProcessed()) + " lines processed..."));
            }
            if (config.progressListener() != null) {
                config.progressListener().onProgress(
                        progress.linesProcessed(), progress.uniqueWords(), progress.totalWords());
            }
        }
    }

    private boolean timedOut(long startedAtNanos) {
        return config.workerTimeout() != null
                && startedAtNanos != 0
                && System.nanoTime() - startedAtNanos > config.workerTimeout().toNanos();
    }

    private FileOutcome collect(Future<FileOutcome> future, int index, Path path) throws InterruptedException {
        try {
            FileOutcome outcome = future.get();
            if (outcome == null) {
                return new FileFailure(path, ErrorKind.WORKER_CRASHED, "Worker " + (index + 1) + " returned no result");
            }
            return outcome;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return new FileFailure(path, ErrorKind.WORKER_CRASHED,
                    "Worker " + (index + 1) + " crashed: " + cause);
        } catch (CancellationException e) {
            return new FileFailure(path, ErrorKind.WORKER_CRASHED, "Worker " + (index + 1) + " was cancelled");
        }
    }

    private void record(Aggregator aggregator, int index, FileOutcome outcome) {
        aggregator.record(outcome);
        int id = index + 1;
        if (outcome instanceof FileCountResult result) {
            if (config.verbose()) {
                logger.accept(LogFormat.stamp("Worker " + id + ": completed " + result.path()
                        + " in " + LogFormat.seconds(result.durationSeconds()) + "s ("
                        + LogFormat.number(result.uniqueWords()) + " unique words)"));
            }
        } else if (outcome instanceof FileFailure failure) {
            logger.accept(LogFormat.stamp("Worker " + id + ": " + failure.kind() + " in " + failure.path()
                    + " - " + failure.message()));
        }
    }

    private void logSummary(AggregateResult result) {
        logger.accept(LogFormat.rule('='));
        logger.accept("Run summary");
        logger.accept(LogFormat.rule('-'));
        logger.accept("   Total time:            " + LogFormat.seconds(result.durationSeconds()) + "s");
        logger.accept("   Successful files:      " + result.successful().size());
        logger.accept("   Failed files:          " + result.failed().size());
        logger.accept("   Lines processed:       " + LogFormat.number(result.totalLinesProcessed()));
        logger.accept("   Total words:           " + LogFormat.number(result.totalWords()));
        logger.accept("   Unique words (merged): " + LogFormat.number(result.totalUniqueWords()));
        logger.accept(LogFormat.rule('='));
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger sequence = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, "wordflux-worker-" + sequence.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
