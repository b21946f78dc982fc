package com.tracker.resolution.mcp;

import com.tracker.resolution.api.EntityResolver;
import com.tracker.resolution.api.IssueChangeValidator;
import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.exception.AmbiguousMatchException;
import com.tracker.resolution.exception.ResolutionException;
import com.tracker.resolution.exception.TransitionException;
import com.tracker.resolution.exception.ValidationException;
import com.tracker.resolution.rules.CustomFieldValue;
import com.tracker.resolution.rules.RequiredField;
import com.tracker.resolution.workflow.TrackerWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Builds the tool definitions an agent uses to check an issue change before
 * sending it. All tools are <strong>read-only</strong>.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code resolve_entity} -- name or ID of a project, tracker, status, priority,
 *       activity, user or custom field to its numeric ID</li>
 *   <li>{@code get_required_fields} -- custom fields a tracker requires</li>
 *   <li>{@code validate_custom_fields} -- checks and canonicalizes a custom field payload</li>
 *   <li>{@code validate_transition} -- checks a status change against the workflow</li>
 *   <li>{@code reference_workflow} -- statuses and permitted transitions of a tracker</li>
 * </ul>
 *
 * <p>A failed resolution or validation is returned as a result, not thrown:
 * {@code {"error": true, "kind": "AMBIGUOUS", "message": ..., "candidates": [...]}}.
 * Malformed arguments raise {@link IllegalArgumentException}.</p>
 */
public final class TrackerResolutionMcpTools {
    private static final Logger log = LoggerFactory.getLogger(TrackerResolutionMcpTools.class);

    private final IssueChangeValidator validator;

    public TrackerResolutionMcpTools(IssueChangeValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator is required");
    }

    /**
     * Returns all 5 read-only tool definitions.
     */
    public List<McpToolDefinition> getToolDefinitions() {
        return List.of(
                buildResolveEntityTool(),
                buildGetRequiredFieldsTool(),
                buildValidateCustomFieldsTool(),
                buildValidateTransitionTool(),
                buildReferenceWorkflowTool()
        );
    }

    /**
     * Finds a tool definition by name.
     */
    public Optional<McpToolDefinition> getTool(String name) {
        return getToolDefinitions().stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    private McpToolDefinition buildResolveEntityTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "kind", Map.of("type", "string", "description",
                                "Entity kind (project, tracker, status, priority, activity, user, custom_field)"),
                        "name", Map.of("type", "string", "description", "Name or numeric ID; 'me' for the current user"),
                        "project_id", Map.of("type", "integer", "description", "Project scope for user and custom field lookup"),
                        "tracker_id", Map.of("type", "integer", "description", "Tracker scope for custom field lookup")
                ),
                "required", List.of("kind", "name")
        );

        return new McpToolDefinition(
                "resolve_entity",
                "Resolve a name or ID to the numeric ID the tracker expects. Returns all candidates when the name is ambiguous.",
                schema,
                handled(params -> {
                    EntityKind kind = parseKind(stringParam(params, "kind"));
                    String name = stringParam(params, "name");
                    int projectId = intParam(params, "project_id", 0);
                    int trackerId = intParam(params, "tracker_id", 0);
                    EntityResolver resolver = validator.getResolver();
                    int id = switch (kind) {
                        case USER -> resolver.resolveUser(name, projectId);
                        case CUSTOM_FIELD -> resolver.resolveCustomField(name, projectId, trackerId);
                        default -> resolver.resolve(kind, name);
                    };
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("found", true);
                    result.put("kind", kind.name());
                    result.put("query", name);
                    result.put("id", id);
                    return result;
                })
        );
    }

    private McpToolDefinition buildGetRequiredFieldsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "tracker_id", Map.of("type", "integer", "description", "Tracker ID"),
                        "supplied_field_ids", Map.of("type", "array", "items", Map.of("type", "integer"),
                                "description", "Field IDs already in the payload")
                ),
                "required", List.of("tracker_id")
        );

        return new McpToolDefinition(
                "get_required_fields",
                "List the custom fields a tracker requires that are not yet supplied, with their allowed values.",
                schema,
                handled(params -> {
                    int trackerId = intParam(params, "tracker_id", 0);
                    Set<Integer> supplied = intSetParam(params, "supplied_field_ids");
                    List<RequiredField> missing = validator.getFieldRules().requiredFieldsMissing(trackerId, supplied);
                    List<Map<String, Object>> fields = missing.stream()
                            .map(f -> Map.<String, Object>of(
                                    "id", f.fieldId(),
                                    "name", f.name(),
                                    "values", f.allowedValues()
                            ))
                            .toList();
                    return Map.of("trackerId", trackerId, "count", fields.size(), "fields", fields);
                })
        );
    }

    private McpToolDefinition buildValidateCustomFieldsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "project_id", Map.of("type", "integer", "description", "Project ID"),
                        "tracker_id", Map.of("type", "integer", "description", "Tracker ID, 0 to skip the required-field check"),
                        "fields", Map.of("type", "object", "description",
                                "Values keyed by field name or ID; a list for multi-select fields")
                ),
                "required", List.of("fields")
        );

        return new McpToolDefinition(
                "validate_custom_fields",
                "Check a custom field payload. Resolves field names to IDs and corrects values to their canonical spelling.",
                schema,
                handled(params -> {
                    int projectId = intParam(params, "project_id", 0);
                    int trackerId = intParam(params, "tracker_id", 0);
                    Map<String, CustomFieldValue> fields = new LinkedHashMap<>();
                    mapParam(params, "fields").forEach((key, raw) ->
                            fields.put(String.valueOf(key), CustomFieldValue.fromRaw(raw)));

                    Map<Integer, CustomFieldValue> validated =
                            validator.validateCustomFields(fields, projectId, trackerId);
                    Map<String, Object> canonical = new LinkedHashMap<>();
                    validated.forEach((id, value) -> canonical.put(String.valueOf(id),
                            value instanceof CustomFieldValue.Single single ? single.value() : value.asList()));
                    return Map.of("valid", true, "fields", canonical);
                })
        );
    }

    private McpToolDefinition buildValidateTransitionTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "tracker_id", Map.of("type", "integer", "description", "Tracker ID of the issue"),
                        "current_status_id", Map.of("type", "integer", "description", "Current status ID of the issue"),
                        "target_status", Map.of("type", "string", "description", "Target status name or ID")
                ),
                "required", List.of("tracker_id", "current_status_id", "target_status")
        );

        return new McpToolDefinition(
                "validate_transition",
                "Check whether an issue may move to a status. On rejection the permitted targets are listed.",
                schema,
                handled(params -> {
                    int trackerId = intParam(params, "tracker_id", 0);
                    int currentStatusId = intParam(params, "current_status_id", 0);
                    String target = stringParam(params, "target_status");
                    int targetStatusId = validator.validateStatusChange(trackerId, currentStatusId, target);
                    return Map.of(
                            "valid", true,
                            "targetStatusId", targetStatusId,
                            "ruleKnown", validator.getWorkflowRules().hasRule(trackerId, currentStatusId)
                    );
                })
        );
    }

    private McpToolDefinition buildReferenceWorkflowTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "tracker_id", Map.of("type", "integer", "description", "Tracker ID"),
                        "status_id", Map.of("type", "integer", "description", "Only list targets of this status")
                ),
                "required", List.of("tracker_id")
        );

        return new McpToolDefinition(
                "reference_workflow",
                "Show the statuses of a tracker and the transitions known to be permitted between them.",
                schema,
                handled(params -> {
                    int trackerId = intParam(params, "tracker_id", 0);
                    Optional<TrackerWorkflow> tracker = validator.getWorkflowRules().getTracker(trackerId);
                    if (tracker.isEmpty()) {
                        return Map.of("found", false, "message", "No workflow known for tracker " + trackerId);
                    }
                    TrackerWorkflow workflow = tracker.get();
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("found", true);
                    result.put("trackerId", trackerId);
                    result.put("trackerName", workflow.name());
                    result.put("statuses", candidateMaps(workflow.statusCandidates()));
                    if (params.get("status_id") != null) {
                        int statusId = intParam(params, "status_id", 0);
                        result.put("statusId", statusId);
                        result.put("allowed", candidateMaps(
                                validator.getWorkflowRules().allowedTargets(trackerId, statusId)));
                    } else {
                        Map<String, List<Integer>> transitions =
                                new TreeMap<>(Comparator.comparingInt(Integer::parseInt));
                        transitions.putAll(workflow.transitions());
                        result.put("transitions", transitions);
                    }
                    return result;
                })
        );
    }

    // ── Argument handling ─────────────────────────────────────

    private static Function<Map<String, Object>, Map<String, Object>> handled(
            Function<Map<String, Object>, Map<String, Object>> handler) {
        return params -> {
            try {
                return handler.apply(params);
            } catch (ResolutionException e) {
                log.debug("tool.rejected kind={} reason='{}'", e.getKind(), e.getMessage());
                return errorResult(e);
            }
        };
    }

    static Map<String, Object> errorResult(ResolutionException e) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", true);
        result.put("kind", e.getKind().name());
        result.put("message", e.getMessage());
        if (e instanceof AmbiguousMatchException ambiguous) {
            result.put("candidates", candidateMaps(ambiguous.getCandidates()));
        } else if (e instanceof TransitionException transition) {
            result.put("allowed", candidateMaps(transition.getAllowed()));
        } else if (e instanceof ValidationException validation) {
            if (validation.isMissingRequired()) {
                result.put("missing", validation.getMissingFields().stream()
                        .map(f -> Map.<String, Object>of("id", f.fieldId(), "name", f.name(), "values", f.allowedValues()))
                        .toList());
            } else {
                result.put("allowed", validation.getAllowedValues());
            }
        }
        return result;
    }

    private static List<Map<String, Object>> candidateMaps(List<Candidate> candidates) {
        return candidates.stream()
                .map(c -> Map.<String, Object>of("id", c.id(), "name", c.name()))
                .toList();
    }

    private static EntityKind parseKind(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return EntityKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown entity kind: " + raw, e);
        }
    }

    private static String stringParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            throw new IllegalArgumentException("missing parameter: " + key);
        }
        return String.valueOf(value);
    }

    private static int intParam(Map<String, Object> params, String key, int defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("parameter " + key + " must be an integer: " + value, e);
        }
    }

    private static Set<Integer> intSetParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return Set.of();
        }
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException("parameter " + key + " must be a list");
        }
        Set<Integer> ids = new LinkedHashSet<>();
        for (Object item : items) {
            ids.add(item instanceof Number number ? number.intValue() : Integer.parseInt(String.valueOf(item).trim()));
        }
        return ids;
    }

    private static Map<?, ?> mapParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("parameter " + key + " must be an object");
        }
        return map;
    }
}
