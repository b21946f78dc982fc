package com.tracker.resolution.core.model;

import java.util.List;

/**
 * An issue as returned by the directory, with its change history when
 * fetched individually.
 *
 * @param id       issue ID
 * @param tracker  tracker reference
 * @param status   current status reference
 * @param journals change history, empty for search results
 */
public record IssueRecord(int id, Candidate tracker, Candidate status, List<Journal> journals) {

    public IssueRecord {
        journals = journals != null ? List.copyOf(journals) : List.of();
    }

    public static IssueRecord brief(int id) {
        return new IssueRecord(id, null, null, List.of());
    }
}
