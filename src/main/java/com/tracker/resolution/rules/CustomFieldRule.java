package com.tracker.resolution.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Validation rule for one custom field.
 *
 * @param name               display name of the field
 * @param values             allowed canonical values in display order; empty means free text
 * @param requiredByTrackers tracker IDs for which the field is mandatory
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record CustomFieldRule(
        @JsonProperty("name") String name,
        @JsonProperty("values") List<String> values,
        @JsonProperty("required_by_trackers") List<Integer> requiredByTrackers
) {
    public CustomFieldRule {
        Objects.requireNonNull(name, "name is required");
        values = values != null ? List.copyOf(values) : List.of();
        requiredByTrackers = requiredByTrackers != null ? List.copyOf(requiredByTrackers) : List.of();
    }

    public static CustomFieldRule freeText(String name) {
        return new CustomFieldRule(name, List.of(), List.of());
    }

    public static CustomFieldRule of(String name, List<String> values) {
        return new CustomFieldRule(name, values, List.of());
    }

    /**
     * Returns true if the field accepts any value.
     */
    public boolean freeTextOnly() {
        return values.isEmpty();
    }

    public boolean requiredFor(int trackerId) {
        return requiredByTrackers.contains(trackerId);
    }
}
