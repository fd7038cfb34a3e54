package com.parallel.wordflux;

public enum ScheduleMode {
    /** Fixed batches; the next batch starts once every worker of the current one has finished. */
    BATCHED,
    /** A bounded pool that starts the next file as soon as any worker slot frees up. */
    ROLLING
}
