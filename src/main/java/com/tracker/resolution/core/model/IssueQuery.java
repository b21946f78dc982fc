package com.tracker.resolution.core.model;

/**
 * Filter for an issue search.
 *
 * @param trackerId    tracker filter, 0 for any
 * @param statusFilter status filter token ("open", "closed", "*" or an ID)
 * @param sort         sort order, e.g. "updated_on:desc"
 * @param limit        page size
 * @param offset       page offset
 */
public record IssueQuery(int trackerId, String statusFilter, String sort, int limit, int offset) {

    public static final String RECENTLY_UPDATED = "updated_on:desc";
    public static final String ANY_STATUS = "*";

    public IssueQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
    }

    /**
     * Issues of a tracker in any status, most recently updated first.
     */
    public static IssueQuery recentlyUpdated(int trackerId, int limit, int offset) {
        return new IssueQuery(trackerId, ANY_STATUS, RECENTLY_UPDATED, limit, offset);
    }
}
