package com.tracker.resolution.exception;

/**
 * Closed set of error categories raised by the resolution and validation layer.
 * Callers branch on the kind, never on message text.
 */
public enum ErrorKind {
    /** Zero candidates for a name lookup. */
    NOT_FOUND,
    /** More than one candidate for a name lookup. */
    AMBIGUOUS,
    /** Operation attempted without the context it needs. */
    CONFIGURATION,
    /** Custom field value outside its allowed set, or required fields missing. */
    VALIDATION,
    /** Disallowed status change. */
    TRANSITION,
    /** Failure of the external directory data source. */
    UPSTREAM
}
