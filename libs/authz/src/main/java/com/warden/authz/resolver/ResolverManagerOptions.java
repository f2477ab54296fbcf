package com.warden.authz.resolver;

import com.warden.authz.cache.CacheProvider;
import com.warden.authz.cache.InMemoryCacheProvider;
import com.warden.authz.metrics.AuthorizationMetrics;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Settings for a {@link ResolverManager}.
 *
 * @param cacheProvider   store for cacheable resolver output
 * @param defaultCacheTtl lifetime of cached output when a resolver sets none
 * @param parallel        whether resolvers of one dependency level run concurrently
 * @param resolverTimeout upper bound on one resolver invocation
 * @param strictMerge     whether two resolvers emitting the same key is an error
 * @param executor        executor resolvers are invoked on
 * @param metrics         meters for resolver timings, failures and cache lookups
 */
public record ResolverManagerOptions(
        CacheProvider cacheProvider,
        Duration defaultCacheTtl,
        boolean parallel,
        Duration resolverTimeout,
        boolean strictMerge,
        Executor executor,
        AuthorizationMetrics metrics
) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_RESOLVER_TIMEOUT = Duration.ofMillis(5000);

    public ResolverManagerOptions {
        if (cacheProvider == null) {
            cacheProvider = new InMemoryCacheProvider();
        }
        if (defaultCacheTtl == null) {
            defaultCacheTtl = DEFAULT_CACHE_TTL;
        }
        if (resolverTimeout == null) {
            resolverTimeout = DEFAULT_RESOLVER_TIMEOUT;
        }
        if (defaultCacheTtl.isZero() || defaultCacheTtl.isNegative()) {
            throw new IllegalArgumentException("defaultCacheTtl must be positive");
        }
        if (resolverTimeout.isZero() || resolverTimeout.isNegative()) {
            throw new IllegalArgumentException("resolverTimeout must be positive");
        }
        if (executor == null) {
            executor = ForkJoinPool.commonPool();
        }
        if (metrics == null) {
            metrics = AuthorizationMetrics.noop();
        }
    }

    /** In-memory cache, 300 s TTL, parallel levels, 5 s timeout, lenient merge. */
    public static ResolverManagerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ResolverManagerOptions}; unset values take the defaults.
     */
    public static final class Builder {

        private CacheProvider cacheProvider;
        private Duration defaultCacheTtl;
        private boolean parallel = true;
        private Duration resolverTimeout;
        private boolean strictMerge;
        private Executor executor;
        private AuthorizationMetrics metrics;

        private Builder() {
        }

        public Builder cacheProvider(CacheProvider cacheProvider) {
            this.cacheProvider = cacheProvider;
            return this;
        }

        public Builder defaultCacheTtl(Duration defaultCacheTtl) {
            this.defaultCacheTtl = defaultCacheTtl;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder resolverTimeout(Duration resolverTimeout) {
            this.resolverTimeout = resolverTimeout;
            return this;
        }

        public Builder strictMerge(boolean strictMerge) {
            this.strictMerge = strictMerge;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder metrics(AuthorizationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ResolverManagerOptions build() {
            return new ResolverManagerOptions(cacheProvider, defaultCacheTtl, parallel, resolverTimeout,
                    strictMerge, executor, metrics);
        }
    }
}
