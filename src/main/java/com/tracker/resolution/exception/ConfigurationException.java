package com.tracker.resolution.exception;

/**
 * Thrown when an operation is attempted without the context it requires,
 * e.g. a user lookup by name without a project scope.
 */
public final class ConfigurationException extends ResolutionException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }
}
