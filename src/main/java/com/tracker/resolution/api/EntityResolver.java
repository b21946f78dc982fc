package com.tracker.resolution.api;

import com.tracker.resolution.cache.CacheStats;
import com.tracker.resolution.cache.CaffeineDirectoryCache;
import com.tracker.resolution.cache.DirectoryCache;
import com.tracker.resolution.cache.DirectoryKey;
import com.tracker.resolution.core.model.Candidate;
import com.tracker.resolution.core.model.CustomFieldDefinition;
import com.tracker.resolution.core.model.CustomFieldDefinitionFull;
import com.tracker.resolution.core.model.EntityKind;
import com.tracker.resolution.core.model.IssueStatus;
import com.tracker.resolution.core.model.MatchOutcome;
import com.tracker.resolution.core.model.Membership;
import com.tracker.resolution.core.model.Project;
import com.tracker.resolution.directory.DirectoryClient;
import com.tracker.resolution.exception.AmbiguousMatchException;
import com.tracker.resolution.exception.ConfigurationException;
import com.tracker.resolution.exception.EntityNotFoundException;
import com.tracker.resolution.exception.UpstreamException;
import com.tracker.resolution.logging.LogContext;
import com.tracker.resolution.metrics.MetricsService;
import com.tracker.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Supplier;

/**
 * Resolves human-supplied names and IDs to canonical numeric identifiers.
 *
 * <h2>Resolution rules</h2>
 * <ul>
 *   <li>Input that parses as an integer is returned unchanged, without any
 *       directory access or existence check</li>
 *   <li>Otherwise the directory of the kind is loaded once and cached for the
 *       lifetime of this instance</li>
 *   <li>A case-insensitive exact match is tried first, then a substring match</li>
 *   <li>No candidate raises {@link EntityNotFoundException}; several candidates
 *       raise {@link AmbiguousMatchException} carrying all of them. The resolver
 *       never picks a best match</li>
 * </ul>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * EntityResolver resolver = EntityResolver.builder()
 *     .client(directoryClient)
 *     .build();
 *
 * int projectId = resolver.resolveProject("web portal");
 * int trackerId = resolver.resolveTracker("bug");
 * int assignee = resolver.resolveUser("alice", projectId);
 * </pre>
 *
 * <p>The directory cache reflects the privileges of the client it was built
 * with. Instances are not thread-safe and must not be shared between callers
 * with different identities; see {@code ResolverSessions}.</p>
 */
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    public static final String STATUS_OPEN = "open";
    public static final String STATUS_CLOSED = "closed";
    public static final String STATUS_ANY = "*";
    public static final String STATUS_ALL = "all";
    public static final String CURRENT_USER = "me";

    private final DirectoryClient client;
    private final ResolverConfig config;
    private final DirectoryCache cache;
    private final MetricsService metricsService;

    private EntityResolver(Builder builder) {
        this.client = builder.client;
        this.config = builder.config;
        this.cache = builder.cache != null
                ? builder.cache : new CaffeineDirectoryCache(config.getCacheConfig());
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
    }

    // ── Context-free kinds ────────────────────────────────────

    /**
     * Resolves a project by name or identifier (exact), or by name substring.
     */
    public int resolveProject(String nameOrId) {
        OptionalInt id = parseId(EntityKind.PROJECT, nameOrId);
        if (id.isPresent()) {
            return id.getAsInt();
        }
        List<Project> projects = getProjects();
        return select(EntityKind.PROJECT, nameOrId, NameMatcher.match(projects, nameOrId,
                p -> new Candidate(p.id(), p.name()),
                p -> Arrays.asList(p.name(), p.identifier())));
    }

    public int resolveTracker(String nameOrId) {
        return resolveNamed(EntityKind.TRACKER, nameOrId, this::getTrackers);
    }

    public int resolvePriority(String nameOrId) {
        return resolveNamed(EntityKind.PRIORITY, nameOrId, this::getPriorities);
    }

    public int resolveActivity(String nameOrId) {
        return resolveNamed(EntityKind.ACTIVITY, nameOrId, this::getActivities);
    }

    /**
     * Resolves a status to its numeric ID. Keywords are not accepted here.
     */
    public int resolveStatusId(String nameOrId) {
        return resolveNamed(EntityKind.STATUS, nameOrId, () -> getStatuses().stream()
                .map(s -> new Candidate(s.id(), s.name()))
                .toList());
    }

    /**
     * Resolves a status to a search filter token. {@code open}, {@code closed}
     * and {@code *} are returned lowercased and {@code all} becomes {@code *},
     * without a directory access. Numeric input is returned unchanged; a name
     * is resolved to its decimal ID.
     */
    public String resolveStatus(String nameOrId) {
        Objects.requireNonNull(nameOrId, "nameOrId is required");
        String keyword = nameOrId.toLowerCase(Locale.ROOT);
        switch (keyword) {
            case STATUS_OPEN, STATUS_CLOSED, STATUS_ANY -> {
                metricsService.recordResolution(EntityKind.STATUS, MatchOutcome.KEYWORD);
                return keyword;
            }
            case STATUS_ALL -> {
                metricsService.recordResolution(EntityKind.STATUS, MatchOutcome.KEYWORD);
                return STATUS_ANY;
            }
            default -> {
                if (parseId(EntityKind.STATUS, nameOrId).isPresent()) {
                    return nameOrId;
                }
                return String.valueOf(resolveStatusId(nameOrId));
            }
        }
    }

    /**
     * Generic dispatch for the kinds that need no context. User and custom
     * field names need a project scope and are rejected unless numeric.
     *
     * @throws ConfigurationException for a non-numeric user or custom field name
     */
    public int resolve(EntityKind kind, String nameOrId) {
        OptionalInt id = parseId(kind, nameOrId);
        if (id.isPresent()) {
            return id.getAsInt();
        }
        return switch (kind) {
            case PROJECT -> resolveProject(nameOrId);
            case TRACKER -> resolveTracker(nameOrId);
            case STATUS -> resolveStatusId(nameOrId);
            case PRIORITY -> resolvePriority(nameOrId);
            case ACTIVITY -> resolveActivity(nameOrId);
            case USER, CUSTOM_FIELD -> throw new ConfigurationException(
                    "cannot resolve " + kind.getLabel() + " '" + nameOrId + "' without project context");
        };
    }

    // ── Context-dependent kinds ───────────────────────────────

    /**
     * Resolves a user. {@code me} is the authenticated user. Names are looked
     * up among the project's members, since the global user listing requires
     * administrator privileges.
     *
     * @param projectId project scope for name lookup
     * @throws ConfigurationException for a name lookup without project scope
     */
    public int resolveUser(String nameOrId, int projectId) {
        Objects.requireNonNull(nameOrId, "nameOrId is required");
        if (CURRENT_USER.equalsIgnoreCase(nameOrId)) {
            Candidate current = client.currentUser();
            metricsService.recordResolution(EntityKind.USER, MatchOutcome.KEYWORD);
            return current.id();
        }
        OptionalInt id = parseId(EntityKind.USER, nameOrId);
        if (id.isPresent()) {
            return id.getAsInt();
        }
        if (projectId <= 0) {
            throw new ConfigurationException(
                    "cannot search users without project context, please use user ID");
        }
        List<Membership> memberships = cached(DirectoryKey.forProject(EntityKind.USER, projectId),
                () -> client.listProjectMemberships(projectId, config.getMembershipLimit()));
        List<Candidate> users = memberships.stream()
                .filter(Membership::isUser)
                .map(Membership::user)
                .toList();
        return select(EntityKind.USER, nameOrId, NameMatcher.byName(users, nameOrId));
    }

    /**
     * Resolves a custom field. The privileged field listing is preferred; if
     * it is unavailable to this identity, the definitions of a sample issue in
     * the project/tracker scope are used instead, exact match only. A single
     * call never combines both sources.
     *
     * @param projectId project scope for the sample fallback
     * @param trackerId tracker scope for the sample fallback, 0 for any
     * @throws ConfigurationException if the fallback is needed and no project scope is given
     */
    public int resolveCustomField(String nameOrId, int projectId, int trackerId) {
        OptionalInt id = parseId(EntityKind.CUSTOM_FIELD, nameOrId);
        if (id.isPresent()) {
            return id.getAsInt();
        }

        List<CustomFieldDefinitionFull> global = globalCustomFields();
        if (global != null) {
            return select(EntityKind.CUSTOM_FIELD, nameOrId, NameMatcher.match(global, nameOrId,
                    f -> new Candidate(f.id(), f.name()),
                    f -> Collections.singletonList(f.name())));
        }

        if (projectId <= 0) {
            throw new ConfigurationException("cannot look up custom field '" + nameOrId
                    + "' without project context, please use field ID");
        }
        List<CustomFieldDefinition> sampled = cached(
                DirectoryKey.forProjectTracker(EntityKind.CUSTOM_FIELD, projectId, trackerId),
                () -> client.sampleCustomFields(projectId, trackerId));
        List<Candidate> matches = NameMatcher.exactOnly(sampled, nameOrId, f -> new Candidate(f.id(), f.name()));
        return select(EntityKind.CUSTOM_FIELD, nameOrId, new NameMatcher.Result(matches, true));
    }

    // ── Directory accessors ───────────────────────────────────

    public List<Project> getProjects() {
        return cached(DirectoryKey.global(EntityKind.PROJECT),
                () -> client.listProjects(config.getProjectLimit()));
    }

    public List<Candidate> getTrackers() {
        return cached(DirectoryKey.global(EntityKind.TRACKER), client::listTrackers);
    }

    public List<IssueStatus> getStatuses() {
        return cached(DirectoryKey.global(EntityKind.STATUS), client::listStatuses);
    }

    public List<Candidate> getPriorities() {
        return cached(DirectoryKey.global(EntityKind.PRIORITY), client::listPriorities);
    }

    public List<Candidate> getActivities() {
        return cached(DirectoryKey.global(EntityKind.ACTIVITY), client::listActivities);
    }

    /**
     * Returns every custom field definition. Requires administrator privileges.
     *
     * @throws UpstreamException if the listing is unavailable
     */
    public List<CustomFieldDefinitionFull> getCustomFields() {
        return cached(DirectoryKey.global(EntityKind.CUSTOM_FIELD), client::listAllCustomFields);
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    // ── Internal helpers ──────────────────────────────────────

    private int resolveNamed(EntityKind kind, String nameOrId, Supplier<List<Candidate>> directory) {
        OptionalInt id = parseId(kind, nameOrId);
        if (id.isPresent()) {
            return id.getAsInt();
        }
        return select(kind, nameOrId, NameMatcher.byName(directory.get(), nameOrId));
    }

    private OptionalInt parseId(EntityKind kind, String nameOrId) {
        Objects.requireNonNull(nameOrId, "nameOrId is required");
        try {
            int id = Integer.parseInt(nameOrId);
            metricsService.recordResolution(kind, MatchOutcome.IDENTIFIER);
            return OptionalInt.of(id);
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private int select(EntityKind kind, String query, NameMatcher.Result result) {
        try (LogContext ctx = LogContext.forResolution(kind.name(), query)) {
            List<Candidate> candidates = result.candidates();
            if (candidates.isEmpty()) {
                metricsService.recordResolution(kind, MatchOutcome.NOT_FOUND);
                log.debug("resolve.not_found kind={} query='{}'", kind, query);
                throw new EntityNotFoundException(kind, query);
            }
            if (candidates.size() > 1) {
                metricsService.recordResolution(kind, MatchOutcome.AMBIGUOUS);
                log.debug("resolve.ambiguous kind={} query='{}' candidates={}", kind, query, candidates.size());
                throw new AmbiguousMatchException(kind, query, candidates);
            }
            Candidate match = candidates.get(0);
            metricsService.recordResolution(kind, result.exact() ? MatchOutcome.EXACT : MatchOutcome.PARTIAL);
            log.debug("resolve.matched kind={} query='{}' id={} exact={}", kind, query, match.id(), result.exact());
            return match.id();
        }
    }

    // A failed listing is not cached, so every call asks again
    private List<CustomFieldDefinitionFull> globalCustomFields() {
        try {
            return getCustomFields();
        } catch (UpstreamException e) {
            log.info("resolve.custom_fields.fallback reason='{}'", e.getMessage());
            return null;
        }
    }

    private <T> List<T> cached(DirectoryKey key, Supplier<List<T>> loader) {
        return cache.get(key, () -> {
            long start = System.nanoTime();
            List<T> loaded = loader.get();
            metricsService.recordDirectoryFetch(key.kind(), Duration.ofNanos(System.nanoTime() - start));
            return loaded;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DirectoryClient client;
        private ResolverConfig config = ResolverConfig.defaults();
        private DirectoryCache cache;
        private MetricsService metricsService;

        public Builder client(DirectoryClient client) {
            this.client = client;
            return this;
        }

        public Builder config(ResolverConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        /**
         * Sets the directory cache. The cache must not be shared with another resolver.
         */
        public Builder cache(DirectoryCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public EntityResolver build() {
            Objects.requireNonNull(client, "client is required");
            return new EntityResolver(this);
        }
    }
}
