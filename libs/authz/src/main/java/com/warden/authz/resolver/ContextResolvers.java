package com.warden.authz.resolver;

import com.warden.context.AuthorizationContext;
import com.warden.context.ResolvedData;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Builds {@link ContextResolver}s from functions.
 *
 * <pre>{@code
 * ContextResolver orgs = ContextResolvers.builder("org")
 *         .cacheKey(ctx -> CacheKeys.of("org", ctx.userId()))
 *         .cacheTtl(Duration.ofMinutes(5))
 *         .resolveWith(ctx -> ResolvedData.of("organizationIds", orgRepository.idsFor(ctx.userId())));
 * }</pre>
 */
public final class ContextResolvers {

    private ContextResolvers() {
        // utility class
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for function-backed resolvers. Defaults: required, priority 0, no dependencies,
     * no caching.
     */
    public static final class Builder {

        private final String name;
        private List<String> dependsOn = List.of();
        private Function<AuthorizationContext, String> cacheKey;
        private Duration cacheTtl;
        private int priority;
        private boolean required = true;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
            this.name = name;
        }

        public Builder dependsOn(String... names) {
            this.dependsOn = List.copyOf(Arrays.asList(names));
            return this;
        }

        /** Key function; returning null skips the cache for that call. */
        public Builder cacheKey(Function<AuthorizationContext, String> cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder optional() {
            this.required = false;
            return this;
        }

        /**
         * Builds a resolver around a blocking function. The manager runs it on its executor.
         */
        public ContextResolver resolveWith(Function<AuthorizationContext, ResolvedData> resolve) {
            if (resolve == null) {
                throw new IllegalArgumentException("resolve must not be null");
            }
            return resolveAsync(ctx -> CompletableFuture.completedFuture(resolve.apply(ctx)));
        }

        /** Builds a resolver around a function returning a future. */
        public ContextResolver resolveAsync(Function<AuthorizationContext, CompletableFuture<ResolvedData>> resolve) {
            if (resolve == null) {
                throw new IllegalArgumentException("resolve must not be null");
            }
            return new FunctionResolver(name, dependsOn, resolve, cacheKey, cacheTtl, priority, required);
        }
    }

    private record FunctionResolver(
            String name,
            List<String> dependsOn,
            Function<AuthorizationContext, CompletableFuture<ResolvedData>> resolveFunction,
            Function<AuthorizationContext, String> cacheKeyFunction,
            Duration ttl,
            int priority,
            boolean required
    ) implements ContextResolver {

        @Override
        public CompletableFuture<ResolvedData> resolve(AuthorizationContext base) {
            return resolveFunction.apply(base);
        }

        @Override
        public Optional<String> cacheKey(AuthorizationContext base) {
            return cacheKeyFunction == null ? Optional.empty() : Optional.ofNullable(cacheKeyFunction.apply(base));
        }

        @Override
        public Optional<Duration> cacheTtl() {
            return Optional.ofNullable(ttl);
        }

        @Override
        public String toString() {
            return "ContextResolver[" + name + "]";
        }
    }
}
