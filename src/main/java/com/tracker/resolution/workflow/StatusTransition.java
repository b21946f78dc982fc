package com.tracker.resolution.workflow;

import com.tracker.resolution.core.model.Journal;
import com.tracker.resolution.core.model.JournalDetail;

import java.util.ArrayList;
import java.util.List;

/**
 * An observed status change.
 *
 * @param fromStatusId status before the change
 * @param toStatusId   status after the change
 */
public record StatusTransition(int fromStatusId, int toStatusId) {

    /**
     * Scans journals for status changes in order of appearance. Details whose
     * old or new value is not an integer are ignored.
     */
    public static List<StatusTransition> extract(List<Journal> journals) {
        List<StatusTransition> transitions = new ArrayList<>();
        for (Journal journal : journals) {
            for (JournalDetail detail : journal.details()) {
                if (!detail.isStatusChange()) {
                    continue;
                }
                Integer from = parseStatusId(detail.oldValue());
                Integer to = parseStatusId(detail.newValue());
                if (from == null || to == null) {
                    continue;
                }
                transitions.add(new StatusTransition(from, to));
            }
        }
        return transitions;
    }

    private static Integer parseStatusId(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
