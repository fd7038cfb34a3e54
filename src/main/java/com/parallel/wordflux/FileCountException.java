package com.parallel.wordflux;

import java.nio.file.Path;

/**
 * Raised by a {@link FileCounter} when a file cannot be scanned to the end.
 */
public class FileCountException extends Exception {

    private final ErrorKind kind;
    private final Path path;

    public FileCountException(ErrorKind kind, Path path, String message) {
        this(kind, path, message, null);
    }

    public FileCountException(ErrorKind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public ErrorKind kind() {
        return kind;
    }

    public Path path() {
        return path;
    }

    public FileFailure toFailure() {
        return new FileFailure(path, kind, getMessage());
    }
}
