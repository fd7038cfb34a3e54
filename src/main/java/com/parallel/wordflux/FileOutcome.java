package com.parallel.wordflux;

import java.nio.file.Path;

/**
 * Terminal message of a worker: either counts for the whole file or a failure.
 */
public interface FileOutcome {

    Path path();

    boolean success();
}
