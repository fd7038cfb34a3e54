package com.parallel.wordflux;

/**
 * Closed set of reasons a single file can fail to produce counts.
 */
public enum ErrorKind {
    NOT_FOUND,
    IS_DIRECTORY,
    IO_ERROR,
    WORKER_CRASHED,
    WORKER_TIMEOUT
}
