package com.tracker.resolution.exception;

/**
 * Wraps a failure of the external directory data source: network error,
 * authorization failure or server error. Never retried by this layer.
 */
public final class UpstreamException extends ResolutionException {

    private final String operation;

    public UpstreamException(String operation, String message) {
        super(ErrorKind.UPSTREAM, operation + " failed: " + message);
        this.operation = operation;
    }

    public UpstreamException(String operation, String message, Throwable cause) {
        super(ErrorKind.UPSTREAM, operation + " failed: " + message, cause);
        this.operation = operation;
    }

    /**
     * Returns the directory operation that failed, e.g. "list-trackers".
     */
    public String getOperation() {
        return operation;
    }
}
