package com.tracker.resolution.api;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.exception.ResolutionException;
import com.tracker.resolution.exception.TransitionException;
import com.tracker.resolution.exception.ValidationException;
import com.tracker.resolution.logging.LogContext;
import com.tracker.resolution.metrics.MetricsService;
import com.tracker.resolution.metrics.NoOpMetricsService;
import com.tracker.resolution.rules.CustomFieldRules;
import com.tracker.resolution.rules.CustomFieldValue;
import com.tracker.resolution.workflow.WorkflowRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * Validates the parts of an issue change that are subject to rules, before
 * the caller sends the mutation. Never writes anything itself.
 *
 * <ul>
 *   <li>Custom field payloads: names become IDs, values are checked against
 *       the allowed set and canonicalized, and fields required by the tracker
 *       must be present</li>
 *   <li>Status changes: the target status is resolved and the transition is
 *       checked against the tracker's workflow</li>
 * </ul>
 */
public class IssueChangeValidator {
    private static final Logger log = LoggerFactory.getLogger(IssueChangeValidator.class);

    private final EntityResolver resolver;
    private final CustomFieldRules fieldRules;
    private final WorkflowRules workflowRules;
    private final MetricsService metricsService;

    public IssueChangeValidator(EntityResolver resolver, CustomFieldRules fieldRules, WorkflowRules workflowRules) {
        this(resolver, fieldRules, workflowRules, new NoOpMetricsService());
    }

    public IssueChangeValidator(EntityResolver resolver, CustomFieldRules fieldRules, WorkflowRules workflowRules,
                                MetricsService metricsService) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.fieldRules = fieldRules != null ? fieldRules : CustomFieldRules.empty();
        this.workflowRules = workflowRules != null ? workflowRules : WorkflowRules.empty();
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Resolves and validates a custom field payload.
     *
     * @param fields    values keyed by field ID or field name
     * @param projectId project scope for field name lookup
     * @param trackerId tracker of the issue, 0 to skip the required-field check
     * @return canonical values keyed by field ID, in payload order
     * @throws ValidationException if a value is not allowed or required fields are missing
     * @throws ResolutionException if a field name cannot be resolved
     */
    public Map<Integer, CustomFieldValue> validateCustomFields(Map<String, CustomFieldValue> fields,
                                                              int projectId, int trackerId) {
        try (LogContext ctx = LogContext.forValidation(String.valueOf(projectId), String.valueOf(trackerId))) {
            Map<Integer, CustomFieldValue> validated = new LinkedHashMap<>();
            for (Map.Entry<String, CustomFieldValue> entry : fields.entrySet()) {
                int fieldId = resolveFieldId(entry.getKey(), projectId, trackerId);
                validated.put(fieldId, guarded(() -> fieldRules.validate(fieldId, entry.getValue())));
            }
            guarded(() -> {
                fieldRules.requireFields(trackerId, validated.keySet());
                return null;
            });
            log.debug("validate.custom_fields fields={}", validated.size());
            return validated;
        }
    }

    /**
     * Resolves a target status and checks the transition from the current one.
     *
     * @param targetStatus target status name or ID
     * @return the resolved target status ID
     * @throws TransitionException if the workflow forbids the change
     */
    public int validateStatusChange(int trackerId, int currentStatusId, String targetStatus) {
        int targetStatusId = resolver.resolveStatusId(targetStatus);
        guarded(() -> {
            workflowRules.validateTransition(trackerId, currentStatusId, targetStatusId);
            return null;
        });
        log.debug("validate.transition trackerId={} from={} to={}", trackerId, currentStatusId, targetStatusId);
        return targetStatusId;
    }

    /**
     * Returns the statuses reachable from the current one according to the
     * workflow, or an empty list when no rule is known.
     */
    public List<Candidate> allowedStatuses(int trackerId, int currentStatusId) {
        return workflowRules.allowedTargets(trackerId, currentStatusId);
    }

    public CustomFieldRules getFieldRules() {
        return fieldRules;
    }

    public WorkflowRules getWorkflowRules() {
        return workflowRules;
    }

    public EntityResolver getResolver() {
        return resolver;
    }

    private int resolveFieldId(String key, int projectId, int trackerId) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            OptionalInt fromRules = fieldRules.findFieldIdByName(key);
            if (fromRules.isPresent()) {
                return fromRules.getAsInt();
            }
            return resolver.resolveCustomField(key, projectId, trackerId);
        }
    }

    private <T> T guarded(Supplier<T> check) {
        try {
            return check.get();
        } catch (ValidationException | TransitionException e) {
            metricsService.incrementRuleViolation(e.getKind());
            log.info("validate.rejected kind={} reason='{}'", e.getKind(), e.getMessage());
            throw e;
        }
    }
}
