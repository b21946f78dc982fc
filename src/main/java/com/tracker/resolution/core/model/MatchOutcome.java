package com.tracker.resolution.core.model;

/**
 * How a resolution request was answered.
 */
public enum MatchOutcome {
    /** Input parsed as an integer and was returned as-is. */
    IDENTIFIER,
    /** Input was a reserved keyword ("me", "open", "all", ...). */
    KEYWORD,
    /** Exactly one case-insensitive exact match. */
    EXACT,
    /** Exactly one case-insensitive substring match. */
    PARTIAL,
    /** No candidate. */
    NOT_FOUND,
    /** More than one candidate. */
    AMBIGUOUS
}
