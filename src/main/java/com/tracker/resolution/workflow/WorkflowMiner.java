package com.tracker.resolution.workflow;

import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.IssueQuery;
import com.tracker.resolution.core.model.IssueRecord;
import com.tracker.resolution.core.model.IssueStatus;
import com.tracker.resolution.directory.DirectoryClient;
import com.tracker.resolution.exception.UpstreamException;
import com.tracker.resolution.logging.LogContext;
import com.tracker.resolution.metrics.MetricsService;
import com.tracker.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reconstructs workflow graphs from issue history, for servers that do not
 * expose the permitted transitions of an issue.
 *
 * <p>For every tracker, the most recently updated issues are sampled and each
 * one is fetched with its journals. Status changes found in the journals are
 * accumulated into a graph per tracker. The result only contains transitions
 * that were actually exercised; it never proves a transition impossible.</p>
 *
 * <p>All calls are sequential. A failed search skips the tracker and a failed
 * issue fetch skips the issue; neither is retried. Failures listing trackers
 * or statuses propagate.</p>
 */
public class WorkflowMiner {
    private static final Logger log = LoggerFactory.getLogger(WorkflowMiner.class);

    private final DirectoryClient client;
    private final MetricsService metricsService;

    public WorkflowMiner(DirectoryClient client) {
        this(client, new NoOpMetricsService());
    }

    public WorkflowMiner(DirectoryClient client, MetricsService metricsService) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Mines workflow rules with default options.
     */
    public WorkflowRules mine() {
        return mine(MiningOptions.defaults());
    }

    /**
     * Mines workflow rules for every tracker.
     *
     * @throws UpstreamException if trackers or statuses cannot be listed
     */
    public WorkflowRules mine(MiningOptions options) {
        List<Candidate> trackers = client.listTrackers();
        List<IssueStatus> statuses = client.listStatuses();
        log.info("mining.started trackers={} perTracker={}", trackers.size(), options.perTracker());

        Map<Integer, TrackerObservations> observations = new LinkedHashMap<>();
        for (int i = 0; i < trackers.size(); i++) {
            Candidate tracker = trackers.get(i);
            try (LogContext ctx = LogContext.forMining(String.valueOf(tracker.id()), tracker.name())) {
                log.info("mining.tracker index={}/{} name='{}'", i + 1, trackers.size(), tracker.name());
                List<IssueRecord> sample = sampleIssues(tracker, options);
                if (sample.isEmpty()) {
                    log.info("mining.tracker.skipped reason=no-issues");
                    continue;
                }
                TrackerObservations observed = observe(tracker, sample);
                metricsService.recordMinedTracker(sample.size(), observed.getTransitionCount());
                log.info("mining.tracker.done issues={} transitions={}",
                        sample.size(), observed.getTransitionCount());
                observations.put(tracker.id(), observed);
            }
        }

        WorkflowRules rules = WorkflowGraphBuilder.build(statuses, observations);
        log.info("mining.completed trackersWithRules={}", rules.size());
        return rules;
    }

    private List<IssueRecord> sampleIssues(Candidate tracker, MiningOptions options) {
        List<IssueRecord> sample = new ArrayList<>();
        int remaining = options.perTracker();
        int offset = 0;
        while (remaining > 0) {
            int limit = Math.min(remaining, options.pageSize());
            List<IssueRecord> page;
            try {
                page = client.searchIssues(IssueQuery.recentlyUpdated(tracker.id(), limit, offset));
            } catch (UpstreamException e) {
                log.warn("mining.search.failed tracker='{}' offset={} error={}", tracker.name(), offset, e.getMessage());
                break;
            }
            sample.addAll(page.size() > limit ? page.subList(0, limit) : page);
            if (page.size() < limit) {
                break;
            }
            remaining -= limit;
            offset += limit;
        }
        return sample;
    }

    private TrackerObservations observe(Candidate tracker, List<IssueRecord> sample) {
        TrackerObservations observed = new TrackerObservations(tracker.name());
        for (IssueRecord brief : sample) {
            IssueRecord issue;
            try {
                issue = client.getIssue(brief.id());
            } catch (UpstreamException e) {
                metricsService.incrementMiningFetchFailure();
                log.warn("mining.issue.failed issueId={} error={}", brief.id(), e.getMessage());
                continue;
            }
            observed.recordAll(StatusTransition.extract(issue.journals()));
        }
        return observed;
    }
}
