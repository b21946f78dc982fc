package com.tracker.resolution.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A status node in a tracker workflow. The closed flag is informational.
 *
 * @param name   display name
 * @param closed whether the status counts as closed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowStatus(
        @JsonProperty("name") String name,
        @JsonProperty("is_closed") boolean closed
) {
}
