package com.tracker.resolution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tracker.resolution.rules.CustomFieldRule;

import java.util.Map;

/**
 * On-disk form of custom field rules: {@code {"fields": {"<fieldId>": rule}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record CustomFieldRulesDocument(@JsonProperty("fields") Map<String, CustomFieldRule> fields) {
}
