package com.tracker.resolution.session;

import com.tracker.resolution.api.EntityResolver;
import com.tracker.resolution.api.ResolverConfig;
import com.tracker.resolution.directory.DirectoryClient;
import com.tracker.resolution.metrics.MetricsService;
import com.tracker.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Registry of one {@link EntityResolver} per caller identity.
 *
 * <p>A resolver's directory cache holds whatever the identity it was built for
 * is allowed to see, so resolvers are never shared between identities. Each
 * resolver is created on first use from a client built for that identity.</p>
 *
 * <pre>
 * ResolverSessions sessions = new ResolverSessions(apiKey -&gt; new RestDirectoryClient(baseUrl, apiKey));
 *
 * EntityResolver resolver = sessions.forIdentity(apiKey);
 * int trackerId = resolver.resolveTracker("bug");
 *
 * sessions.close(apiKey);   // drops the resolver and its cache
 * </pre>
 */
public class ResolverSessions {
    private static final Logger log = LoggerFactory.getLogger(ResolverSessions.class);

    private final Function<String, DirectoryClient> clientFactory;
    private final ResolverConfig config;
    private final MetricsService metricsService;
    private final ConcurrentMap<String, EntityResolver> resolvers = new ConcurrentHashMap<>();

    public ResolverSessions(Function<String, DirectoryClient> clientFactory) {
        this(clientFactory, ResolverConfig.defaults(), new NoOpMetricsService());
    }

    public ResolverSessions(Function<String, DirectoryClient> clientFactory, ResolverConfig config,
                            MetricsService metricsService) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Returns the resolver of an identity, creating it on first use.
     *
     * @param identity the caller identity, typically the credential the client authenticates with
     * @throws IllegalArgumentException if the identity is null or blank
     */
    public EntityResolver forIdentity(String identity) {
        requireIdentity(identity);
        return resolvers.computeIfAbsent(identity, this::createResolver);
    }

    /**
     * Returns the resolver of an identity if one has been created.
     */
    public Optional<EntityResolver> find(String identity) {
        requireIdentity(identity);
        return Optional.ofNullable(resolvers.get(identity));
    }

    /**
     * Drops the resolver of an identity along with its directory cache.
     *
     * @return true if a resolver was dropped
     */
    public boolean close(String identity) {
        requireIdentity(identity);
        boolean removed = resolvers.remove(identity) != null;
        if (removed) {
            log.info("session.closed sessions={}", resolvers.size());
        }
        return removed;
    }

    public void closeAll() {
        int count = resolvers.size();
        resolvers.clear();
        log.info("session.closed_all count={}", count);
    }

    public int size() {
        return resolvers.size();
    }

    private EntityResolver createResolver(String identity) {
        DirectoryClient client = Objects.requireNonNull(clientFactory.apply(identity),
                "clientFactory returned null");
        // Identity is a credential; never log it
        log.info("session.created sessions={}", resolvers.size() + 1);
        return EntityResolver.builder()
                .client(client)
                .config(config)
                .metricsService(metricsService)
                .build();
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be null or blank");
        }
    }
}
