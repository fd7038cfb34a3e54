package com.parallel.wordflux;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file that produced no counts, with the reason.
 */
public record FileFailure(Path path, ErrorKind kind, String message) implements FileOutcome {

    public FileFailure {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public boolean success() {
        return false;
    }
}
