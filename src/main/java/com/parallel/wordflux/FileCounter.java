package com.parallel.wordflux;

import java.nio.file.Path;

/**
 * Base contract for counting the words of one file.
 */
@FunctionalInterface
public interface FileCounter {

    FileCountResult count(Path path, ScanOptions options) throws FileCountException;
}
