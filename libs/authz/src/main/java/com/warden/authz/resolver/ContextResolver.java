package com.warden.authz.resolver;

import com.warden.context.AuthorizationContext;
import com.warden.context.ResolvedData;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Computes one named slice of contextual data for an authorization context, such as the
 * organizations a user belongs to or the permissions granted by their plan.
 * <p>
 * The {@link ResolverManager} invokes {@link #resolve(AuthorizationContext)} on its executor
 * with the operation's context bound to the ambient scope. The base context passed in already
 * carries the output of every resolver named in {@link #dependsOn()}.
 */
public interface ContextResolver {

    /** Unique name; also the key the output is stored under in the resolved context. */
    String name();

    /** Names of resolvers whose output this resolver needs. */
    default List<String> dependsOn() {
        return List.of();
    }

    CompletableFuture<ResolvedData> resolve(AuthorizationContext base);

    /** Cache key for the output given {@code base}; empty disables caching for this call. */
    default Optional<String> cacheKey(AuthorizationContext base) {
        return Optional.empty();
    }

    /** Cache lifetime; empty uses the manager's default. */
    default Optional<Duration> cacheTtl() {
        return Optional.empty();
    }

    /** Higher priorities run first among resolvers whose dependencies are satisfied. */
    default int priority() {
        return 0;
    }

    /**
     * Whether a failure aborts the resolution. Optional resolvers that fail are logged and
     * left out of the resolved context.
     */
    default boolean required() {
        return true;
    }
}
