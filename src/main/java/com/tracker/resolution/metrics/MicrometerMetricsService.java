package com.tracker.resolution.metrics;

import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.core.model.MatchOutcome;
import com.tracker.resolution.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code tracker.resolution}: Counter (tags: kind, outcome)</li>
 *   <li>{@code tracker.directory.fetch}: Timer (tag: kind)</li>
 *   <li>{@code tracker.rule.violation}: Counter (tag: kind)</li>
 *   <li>{@code tracker.mining.issues}: DistributionSummary, issues inspected per tracker</li>
 *   <li>{@code tracker.mining.transitions}: DistributionSummary, transitions found per tracker</li>
 *   <li>{@code tracker.mining.fetch.failure}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary minedIssuesSummary;
    private final DistributionSummary minedTransitionsSummary;
    private final Counter miningFetchFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.minedIssuesSummary = DistributionSummary.builder("tracker.mining.issues")
                .description("Issues inspected per tracker during workflow mining")
                .register(registry);
        this.minedTransitionsSummary = DistributionSummary.builder("tracker.mining.transitions")
                .description("Status transitions observed per tracker during workflow mining")
                .register(registry);
        this.miningFetchFailureCounter = Counter.builder("tracker.mining.fetch.failure")
                .description("Issue fetches skipped during workflow mining")
                .register(registry);
    }

    @Override
    public void recordResolution(EntityKind kind, MatchOutcome outcome) {
        String key = "resolution:" + kind.name() + ":" + outcome.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("tracker.resolution")
                        .description("Number of name/ID resolutions")
                        .tag("kind", kind.name())
                        .tag("outcome", outcome.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordDirectoryFetch(EntityKind kind, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(kind.name(), k ->
                Timer.builder("tracker.directory.fetch")
                        .description("Duration of directory fetches")
                        .tag("kind", kind.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRuleViolation(ErrorKind kind) {
        String key = "violation:" + kind.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("tracker.rule.violation")
                        .description("Number of rejected custom field values and status changes")
                        .tag("kind", kind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordMinedTracker(int issuesInspected, int transitionsFound) {
        minedIssuesSummary.record(issuesInspected);
        minedTransitionsSummary.record(transitionsFound);
    }

    @Override
    public void incrementMiningFetchFailure() {
        miningFetchFailureCounter.increment();
    }
}
