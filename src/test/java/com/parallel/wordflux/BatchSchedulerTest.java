package com.parallel.wordflux;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BatchSchedulerTest {

    @TempDir
    Path dir;

    private final List<String> log = new CopyOnWriteArrayList<>();

    @Test
    void effectiveConcurrencyTakesTheSmallestLimit() {
        assertEquals(4, BatchScheduler.effectiveConcurrency(4, 10, 8));
        assertEquals(8, BatchScheduler.effectiveConcurrency(null, 10, 8));
        assertEquals(3, BatchScheduler.effectiveConcurrency(null, 3, 8));
        assertEquals(8, BatchScheduler.effectiveConcurrency(16, 10, 8));
    }

    @Test
    void effectiveConcurrencyNeverDropsBelowOne() {
        assertEquals(1, BatchScheduler.effectiveConcurrency(0, 10, 8));
        assertEquals(1, BatchScheduler.effectiveConcurrency(-3, 10, 8));
    }

    @Test
    void tenFilesWithFourWorkersMakeThreeBatches() {
        List<Integer> files = List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        int workers = BatchScheduler.effectiveConcurrency(4, files.size(), 8);

        List<List<Integer>> batches = BatchScheduler.partition(files, workers);

        assertEquals(3, batches.size());
        assertEquals(List.of(0, 1, 2, 3), batches.get(0));
        assertEquals(List.of(4, 5, 6, 7), batches.get(1));
        assertEquals(List.of(8, 9), batches.get(2));
    }

    @Test
    void emptyInputLaunchesNoWorker() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        FileCounter counter = (path, options) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("should not run");
        };

        AggregateResult result = scheduler(SchedulerConfig.defaults(), counter, 8).run(List.of());

        assertEquals(0, calls.get());
        assertTrue(result.successful().isEmpty());
        assertTrue(result.failed().isEmpty());
        assertEquals(0, result.totalWords());
        assertEquals(0, result.totalUniqueWords());
        assertEquals(0, result.totalLinesProcessed());
    }

    @Test
    void missingFileIsRecordedWithoutAffectingOthers() throws Exception {
        Path first = write("first.txt", "alpha beta\nbeta");
        Path missing = dir.resolve("missing.txt");
        Path third = write("third.txt", "beta gamma");

        AggregateResult result = scheduler(SchedulerConfig.defaults(), new StreamingFileCounter(), 8)
                .run(List.of(first, missing, third));

        assertEquals(2, result.successful().size());
        assertEquals(1, result.failed().size());
        assertEquals(ErrorKind.NOT_FOUND, result.failed().get(0).kind());
        assertEquals(missing, result.failed().get(0).path());
        assertEquals(5, result.totalWords());
        assertEquals(3, result.totalLinesProcessed());
        assertEquals(Map.of("alpha", 1L, "beta", 3L, "gamma", 1L), result.combinedFrequencies());
        assertEquals(3, result.totalUniqueWords());
    }

    @Test
    void neverRunsMoreWorkersThanTheLimit() throws Exception {
        List<Path> files = files(10);
        TrackingCounter counter = new TrackingCounter(Map.of(), 50);

        AggregateResult result = scheduler(SchedulerConfig.defaults().withMaxWorkers(4), counter, 8).run(files);

        assertEquals(10, result.successful().size());
        assertEquals(4, result.workersUsed());
        assertTrue(counter.maxRunning.get() <= 4, "max running was " + counter.maxRunning.get());
        assertEquals(10, counter.started.size());
    }

    @Test
    void resultsFollowSubmissionOrder() throws Exception {
        List<Path> files = files(6);
        Map<String, Long> delays = Map.of("f0.txt", 150L, "f1.txt", 100L, "f2.txt", 50L);

        AggregateResult batched = scheduler(SchedulerConfig.defaults().withMaxWorkers(3),
                new TrackingCounter(delays, 0), 8).run(files);
        AggregateResult rolling = scheduler(SchedulerConfig.defaults().withMaxWorkers(3).withMode(ScheduleMode.ROLLING),
                new TrackingCounter(delays, 0), 8).run(files);

        assertEquals(files, paths(batched));
        assertEquals(files, paths(rolling));
    }

    @Test
    void batchedModeWaitsForTheSlowestFileOfABatch() throws Exception {
        List<Path> files = files(4);
        TrackingCounter counter = new TrackingCounter(Map.of("f0.txt", 300L), 0);

        scheduler(SchedulerConfig.defaults().withMaxWorkers(2), counter, 8).run(files);

        assertTrue(counter.started.get("f2.txt") >= counter.finished.get("f0.txt"));
    }

    @Test
    void rollingModeRefillsFreeSlots() throws Exception {
        List<Path> files = files(4);
        TrackingCounter counter = new TrackingCounter(Map.of("f0.txt", 400L), 0);

        AggregateResult result = scheduler(
                SchedulerConfig.defaults().withMaxWorkers(2).withMode(ScheduleMode.ROLLING), counter, 8).run(files);

        assertEquals(4, result.successful().size());
        assertTrue(counter.started.get("f2.txt") < counter.finished.get("f0.txt"));
        assertTrue(counter.maxRunning.get() <= 2);
    }

    @Test
    void crashedWorkerBecomesAFailure() throws Exception {
        List<Path> files = files(3);
        FileCounter counter = (path, options) -> {
            if (path.getFileName().toString().equals("f1.txt")) {
                throw new IllegalStateException("unexpected fault");
            }
            return new StreamingFileCounter().count(path, options);
        };

        AggregateResult result = scheduler(SchedulerConfig.defaults(), counter, 4).run(files);

        assertEquals(2, result.successful().size());
        assertEquals(1, result.failed().size());
        FileFailure failure = result.failed().get(0);
        assertEquals(ErrorKind.WORKER_CRASHED, failure.kind());
        assertEquals(files.get(1), failure.path());
        assertTrue(failure.message().contains("unexpected fault"));
    }

    @Test
    void failureAfterProgressLeavesNoPartialCounts() throws Exception {
        List<Path> files = files(3);
        List<Long> progress = new ArrayList<>();
        FileCounter counter = (path, options) -> {
            if (path.getFileName().toString().equals("f1.txt")) {
                options.listener().onProgress(1, 2, 2);
                throw new FileCountException(ErrorKind.IO_ERROR, path, "disk went away");
            }
            return new StreamingFileCounter().count(path, options);
        };
        SchedulerConfig config = SchedulerConfig.defaults().withVerbose(false)
                .withProgressListener((lines, unique, total) -> progress.add(lines));

        AggregateResult result = scheduler(config, counter, 4).run(files);

        assertEquals(1, result.failed().size());
        assertEquals(ErrorKind.IO_ERROR, result.failed().get(0).kind());
        assertEquals(files.get(1), result.failed().get(0).path());
        assertEquals(List.of(1L), progress);
        assertFalse(result.combinedFrequencies().containsKey("word1"));
        assertEquals(Map.of("word0", 1L, "word2", 1L, "shared", 4L), result.combinedFrequencies());
        assertEquals(6, result.totalWords());
        assertEquals(4, result.totalLinesProcessed());
    }

    @Test
    void stalledWorkerTimesOut() throws Exception {
        List<Path> files = files(3);
        TrackingCounter counter = new TrackingCounter(Map.of("f1.txt", 10_000L), 0);
        SchedulerConfig config = SchedulerConfig.defaults().withWorkerTimeout(Duration.ofMillis(200));

        long start = System.nanoTime();
        AggregateResult result = scheduler(config, counter, 4).run(files);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertEquals(2, result.successful().size());
        assertEquals(1, result.failed().size());
        assertEquals(ErrorKind.WORKER_TIMEOUT, result.failed().get(0).kind());
        assertTrue(elapsedMillis < 5_000, "took " + elapsedMillis + " ms");
    }

    @Test
    void progressReachesTheListenerOnTheSchedulerThread() throws Exception {
        Path file = write("ten.txt", "a\n".repeat(10));
        List<Long> lines = new ArrayList<>();
        Thread caller = Thread.currentThread();
        List<Thread> threads = new ArrayList<>();
        SchedulerConfig config = new SchedulerConfig(1, 3, false, null, ScheduleMode.BATCHED,
                (processed, unique, total) -> {
                    lines.add(processed);
                    threads.add(Thread.currentThread());
                });

        scheduler(config, new StreamingFileCounter(), 4).run(List.of(file));

        assertEquals(List.of(3L, 6L, 9L), lines);
        assertTrue(threads.stream().allMatch(t -> t == caller));
    }

    @Test
    void quietRunLogsOnlyFailures() throws Exception {
        Path ok = write("ok.txt", "fine");
        Path missing = dir.resolve("gone.txt");

        scheduler(SchedulerConfig.defaults().withVerbose(false), new StreamingFileCounter(), 4)
                .run(List.of(ok, missing));

        assertEquals(1, log.size());
        assertTrue(log.get(0).contains("NOT_FOUND"));
    }

    @Test
    void zeroWorkersIsClampedWithAWarning() throws Exception {
        List<Path> files = files(2);

        AggregateResult result = scheduler(SchedulerConfig.defaults().withMaxWorkers(0).withVerbose(false),
                new StreamingFileCounter(), 4).run(files);

        assertEquals(1, result.workersUsed());
        assertEquals(2, result.successful().size());
        assertTrue(log.stream().anyMatch(line -> line.contains("below 1")));
    }

    private BatchScheduler scheduler(SchedulerConfig config, FileCounter counter, int processors) {
        return new BatchScheduler(config, counter, log::add, () -> processors);
    }

    private List<Path> files(int count) throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            files.add(write("f" + i + ".txt", "word" + i + " shared\nshared"));
        }
        return files;
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    private static List<Path> paths(AggregateResult result) {
        return result.successful().stream().map(FileCountResult::path).collect(Collectors.toList());
    }

    /**
     * Delegates to the streaming counter after an optional per-file delay and records timings.
     */
    private static final class TrackingCounter implements FileCounter {

        private final Map<String, Long> delays;
        private final long defaultDelay;
        private final StreamingFileCounter delegate = new StreamingFileCounter();
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxRunning = new AtomicInteger();
        final Map<String, Long> started = new ConcurrentHashMap<>();
        final Map<String, Long> finished = new ConcurrentHashMap<>();

        TrackingCounter(Map<String, Long> delays, long defaultDelay) {
            this.delays = delays;
            this.defaultDelay = defaultDelay;
        }

        @Override
        public FileCountResult count(Path path, ScanOptions options) throws FileCountException {
            String name = path.getFileName().toString();
            started.put(name, System.nanoTime());
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                long delay = delays.getOrDefault(name, defaultDelay);
                if (delay > 0) {
                    Thread.sleep(delay);
                }
                return delegate.count(path, options);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FileCountException(ErrorKind.IO_ERROR, path, "interrupted", e);
            } finally {
                running.decrementAndGet();
                finished.put(name, System.nanoTime());
            }
        }
    }
}
