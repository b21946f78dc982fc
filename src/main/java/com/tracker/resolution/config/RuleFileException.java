package com.tracker.resolution.config;

import java.nio.file.Path;

/**
 * Runtime exception thrown when a rule file exists but cannot be read,
 * parsed or written.
 */
public class RuleFileException extends RuntimeException {

    private final transient Path path;

    public RuleFileException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
