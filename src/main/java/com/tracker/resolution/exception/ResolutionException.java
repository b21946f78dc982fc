package com.tracker.resolution.exception;

/**
 * Base class of every error raised by the resolution and validation layer.
 * The set of subclasses is closed; {@link #getKind()} identifies the category.
 */
public abstract sealed class ResolutionException extends RuntimeException
        permits EntityNotFoundException, AmbiguousMatchException, ConfigurationException,
        ValidationException, TransitionException, UpstreamException {

    private final ErrorKind kind;

    protected ResolutionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ResolutionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
