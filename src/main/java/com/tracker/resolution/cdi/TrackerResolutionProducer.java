package com.tracker.resolution.cdi;

import com.tracker.resolution.api.ResolverConfig;
import com.tracker.resolution.cache.CacheConfig;
import com.tracker.resolution.config.RuleFiles;
import com.tracker.resolution.metrics.MetricsService;
import com.tracker.resolution.metrics.MicrometerMetricsService;
import com.tracker.resolution.metrics.NoOpMetricsService;
import com.tracker.resolution.rules.CustomFieldRules;
import com.tracker.resolution.workflow.MiningOptions;
import com.tracker.resolution.workflow.WorkflowRules;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * CDI producer that wires the resolution layer from MicroProfile Config properties.
 *
 * <p>Rule sets and configuration are application-wide. Resolvers are not: their
 * directory cache depends on the caller's privileges, so they are obtained per
 * identity from {@code ResolverSessions}.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * tracker-resolution:
 *   rules:
 *     custom-fields-file: custom_field_rules.json
 *     workflow-file: workflow_rules.json
 *   mining:
 *     per-tracker: 50
 *   resolver:
 *     project-limit: 1000
 *     membership-limit: 1000
 *   cache:
 *     max-size: 10000
 *   metrics:
 *     enabled: true
 * </pre>
 */
@ApplicationScoped
public class TrackerResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(TrackerResolutionProducer.class);

    // ── Rule files ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tracker-resolution.rules.custom-fields-file", defaultValue = "custom_field_rules.json")
    String customFieldsFile;

    @Inject
    @ConfigProperty(name = "tracker-resolution.rules.workflow-file", defaultValue = "workflow_rules.json")
    String workflowFile;

    // ── Mining ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tracker-resolution.mining.per-tracker", defaultValue = "50")
    int miningPerTracker;

    // ── Resolver ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tracker-resolution.resolver.project-limit", defaultValue = "1000")
    int projectLimit;

    @Inject
    @ConfigProperty(name = "tracker-resolution.resolver.membership-limit", defaultValue = "1000")
    int membershipLimit;

    @Inject
    @ConfigProperty(name = "tracker-resolution.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "tracker-resolution.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public CustomFieldRules customFieldRules() {
        CustomFieldRules rules = RuleFiles.loadCustomFieldRules(Path.of(customFieldsFile));
        log.info("Producing CustomFieldRules: file={} fields={}", customFieldsFile, rules.size());
        return rules;
    }

    @Produces
    @ApplicationScoped
    public WorkflowRules workflowRules() {
        WorkflowRules rules = RuleFiles.loadWorkflowRules(Path.of(workflowFile));
        log.info("Producing WorkflowRules: file={} trackers={}", workflowFile, rules.size());
        return rules;
    }

    @Produces
    @ApplicationScoped
    public ResolverConfig resolverConfig() {
        return ResolverConfig.builder()
                .projectLimit(projectLimit)
                .membershipLimit(membershipLimit)
                .cacheConfig(new CacheConfig(cacheMaxSize))
                .build();
    }

    @Produces
    @ApplicationScoped
    public MiningOptions miningOptions() {
        return MiningOptions.perTracker(miningPerTracker);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (!metricsEnabled) {
            log.info("Metrics disabled");
            return new NoOpMetricsService();
        }
        MeterRegistry registry = meterRegistries != null && meterRegistries.isResolvable()
                ? meterRegistries.get() : new SimpleMeterRegistry();
        log.info("Metrics enabled: registry={}", registry.getClass().getSimpleName());
        return new MicrometerMetricsService(registry);
    }
}
