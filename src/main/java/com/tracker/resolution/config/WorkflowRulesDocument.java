package com.tracker.resolution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracker.resolution.workflow.TrackerWorkflow;

import java.util.Map;

/**
 * On-disk form of workflow rules: {@code {"trackers": {"<trackerId>": workflow}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record WorkflowRulesDocument(@JsonProperty("trackers") Map<String, TrackerWorkflow> trackers) {
}
