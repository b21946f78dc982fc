package com.tracker.resolution.core.model;

import java.util.List;

/**
 * An issue journal entry: a note and/or a set of attribute changes.
 *
 * @param id      journal ID
 * @param details attribute changes, possibly empty
 */
public record Journal(int id, List<JournalDetail> details) {

    public Journal {
        details = details != null ? List.copyOf(details) : List.of();
    }
}
