package com.tracker.resolution.api;

import com.tracker.resolution.cache.CacheConfig;

import java.util.Objects;

/**
 * Configuration of an {@link EntityResolver}.
 */
public class ResolverConfig {

    private static final int DEFAULT_PROJECT_LIMIT = 1000;
    private static final int DEFAULT_MEMBERSHIP_LIMIT = 1000;

    private final int projectLimit;
    private final int membershipLimit;
    private final CacheConfig cacheConfig;

    private ResolverConfig(Builder builder) {
        this.projectLimit = builder.projectLimit;
        this.membershipLimit = builder.membershipLimit;
        this.cacheConfig = builder.cacheConfig;
    }

    /**
     * Maximum number of projects fetched for the project directory.
     */
    public int getProjectLimit() {
        return projectLimit;
    }

    /**
     * Maximum number of memberships fetched per project for user lookup.
     */
    public int getMembershipLimit() {
        return membershipLimit;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static ResolverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ResolverConfig{" +
                "projectLimit=" + projectLimit +
                ", membershipLimit=" + membershipLimit +
                ", cacheMaxSize=" + cacheConfig.maxSize() +
                '}';
    }

    public static class Builder {
        private int projectLimit = DEFAULT_PROJECT_LIMIT;
        private int membershipLimit = DEFAULT_MEMBERSHIP_LIMIT;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder projectLimit(int projectLimit) {
            if (projectLimit <= 0) {
                throw new IllegalArgumentException("projectLimit must be > 0");
            }
            this.projectLimit = projectLimit;
            return this;
        }

        public Builder membershipLimit(int membershipLimit) {
            if (membershipLimit <= 0) {
                throw new IllegalArgumentException("membershipLimit must be > 0");
            }
            this.membershipLimit = membershipLimit;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public ResolverConfig build() {
            return new ResolverConfig(this);
        }
    }
}
