package com.tracker.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Full custom field definition from the privileged field listing.
 *
 * @param id             field ID
 * @param name           display name
 * @param customizedType what the field is attached to ("issue", "project", "user", ...)
 * @param fieldFormat    field format ("list", "string", ...)
 * @param required       whether the field is mandatory
 * @param multiple       whether multiple values are accepted
 * @param possibleValues enumerated values, empty for free text
 * @param trackers       trackers the field is enabled for
 * @param defaultValue   default value, may be null
 */
public record CustomFieldDefinitionFull(
        int id,
        String name,
        String customizedType,
        String fieldFormat,
        boolean required,
        boolean multiple,
        List<String> possibleValues,
        List<Candidate> trackers,
        String defaultValue
) {
    public static final String ISSUE_TYPE = "issue";

    public CustomFieldDefinitionFull {
        Objects.requireNonNull(name, "name is required");
        possibleValues = possibleValues != null ? List.copyOf(possibleValues) : List.of();
        trackers = trackers != null ? List.copyOf(trackers) : List.of();
    }

    public boolean isIssueField() {
        return ISSUE_TYPE.equals(customizedType);
    }
}
