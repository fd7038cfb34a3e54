package com.parallel.wordflux;

import java.time.Duration;
import java.util.Objects;

/**
 * Orchestrator settings.
 *
 * @param maxWorkers       upper bound of concurrent workers, {@code null} for the number of available processors
 * @param progressInterval lines between progress messages of each worker
 * @param verbose          whether start/progress/summary lines are logged
 * @param workerTimeout    maximum running time of one worker, {@code null} for no limit
 * @param mode             how files are dispatched to workers
 * @param progressListener optional sink for worker progress, invoked on the scheduler thread
 */
public record SchedulerConfig(
        Integer maxWorkers,
        int progressInterval,
        boolean verbose,
        Duration workerTimeout,
        ScheduleMode mode,
        ProgressListener progressListener) {

    public static final int WORKER_PROGRESS_INTERVAL = 50_000;

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(null, WORKER_PROGRESS_INTERVAL, true, null, ScheduleMode.BATCHED, null);
    }

    public SchedulerConfig withMaxWorkers(Integer value) {
        return new SchedulerConfig(value, progressInterval, verbose, workerTimeout, mode, progressListener);
    }

    public SchedulerConfig withVerbose(boolean value) {
        return new SchedulerConfig(maxWorkers, progressInterval, value, workerTimeout, mode, progressListener);
    }

    public SchedulerConfig withWorkerTimeout(Duration value) {
        return new SchedulerConfig(maxWorkers, progressInterval, verbose, value, mode, progressListener);
    }

    public SchedulerConfig withMode(ScheduleMode value) {
        return new SchedulerConfig(maxWorkers, progressInterval, verbose, workerTimeout, value, progressListener);
    }

    public SchedulerConfig withProgressListener(ProgressListener value) {
        return new SchedulerConfig(maxWorkers, progressInterval, verbose, workerTimeout, mode, value);
    }

    /**
     * Fills in defaults for unset or out-of-range values.
     */
    public SchedulerConfig normalized() {
        int interval = progressInterval > 0 ? progressInterval : WORKER_PROGRESS_INTERVAL;
        Duration timeout = workerTimeout != null && (workerTimeout.isZero() || workerTimeout.isNegative())
                ? null : workerTimeout;
        return new SchedulerConfig(maxWorkers, interval, verbose, timeout,
                Objects.requireNonNullElse(mode, ScheduleMode.BATCHED), progressListener);
    }
}
