package com.warden.authz.resolver;

import com.warden.authz.ResolverException;
import com.warden.authz.SchemaException;
import com.warden.authz.cache.CacheKeys;
import com.warden.authz.cache.CacheProvider;
import com.warden.authz.cache.InMemoryCacheProvider;
import com.warden.authz.metrics.AuthorizationMetrics;
import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationContextValidator;
import com.warden.context.AuthorizationException;
import com.warden.context.AuthorizationScope;
import com.warden.context.ResolvedContext;
import com.warden.context.ResolvedData;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs registered {@link ContextResolver}s against a base context and merges their output into
 * an enriched context.
 * <p>
 * Resolvers are planned into dependency levels (see {@link ResolverGraph}). Levels run one
 * after another; the resolvers of one level run concurrently unless the manager is configured
 * sequential. Each resolver's output is looked up in the {@link CacheProvider} first when the
 * resolver supplies a cache key, and every invocation is bounded by the resolver timeout. A
 * timeout fails the resolver's contribution without cancelling its work.
 * <p>
 * Merging stores each output under the resolver's name and spreads its entries into the flat
 * view, where the first resolver in execution order keeps a contested key.
 */
public final class ResolverManager {

    private static final Logger log = LoggerFactory.getLogger(ResolverManager.class);

    private final ResolverManagerOptions options;
    private final CacheProvider cache;
    private final AuthorizationMetrics metrics;
    private final Map<String, ContextResolver> resolvers = new LinkedHashMap<>();

    public ResolverManager() {
        this(ResolverManagerOptions.defaults());
    }

    public ResolverManager(ResolverManagerOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.cache = options.cacheProvider();
        this.metrics = options.metrics();
    }

    /**
     * Registers a resolver.
     *
     * @throws SchemaException if the name is taken or the resolver depends on itself
     */
    public void register(ContextResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        String name = resolver.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("resolver name must not be null or blank");
        }
        if (resolver.dependsOn().contains(name)) {
            throw new SchemaException("Resolver '" + name + "' cannot depend on itself", Map.of("resolver", name));
        }
        synchronized (resolvers) {
            if (resolvers.containsKey(name)) {
                throw new SchemaException("Resolver '" + name + "' is already registered", Map.of("resolver", name));
            }
            resolvers.put(name, resolver);
        }
        log.debug("Registered context resolver '{}' (dependsOn={}, priority={}, required={})",
                name, resolver.dependsOn(), resolver.priority(), resolver.required());
    }

    /** Removes a resolver; returns whether it was registered. */
    public boolean unregister(String name) {
        synchronized (resolvers) {
            return resolvers.remove(name) != null;
        }
    }

    public boolean hasResolver(String name) {
        synchronized (resolvers) {
            return resolvers.containsKey(name);
        }
    }

    /** Names of registered resolvers in registration order. */
    public List<String> resolverNames() {
        synchronized (resolvers) {
            return List.copyOf(resolvers.keySet());
        }
    }

    /**
     * Resolves every registered resolver for {@code base} and returns the enriched context.
     *
     * @throws com.warden.context.ContextValidationException if {@code base} is invalid
     * @throws SchemaException         on an unknown dependency, a cycle, or a collision under strict merge
     * @throws ResolverException       if a required resolver fails or times out
     */
    public AuthorizationContext resolve(AuthorizationContext base) {
        return join(resolveAsync(base));
    }

    /**
     * Asynchronous form of {@link #resolve(AuthorizationContext)}. Failures complete the
     * returned future exceptionally with the same exceptions.
     */
    public CompletableFuture<AuthorizationContext> resolveAsync(AuthorizationContext base) {
        ResolverGraph graph;
        try {
            AuthorizationContextValidator.validate(base).throwIfInvalid();
            graph = ResolverGraph.plan(snapshot());
        } catch (AuthorizationException e) {
            return CompletableFuture.failedFuture(e);
        }

        Map<String, ResolvedData> results = new LinkedHashMap<>(base.resolved().byResolver());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (List<ContextResolver> level : graph.levels()) {
            chain = chain.thenCompose(ignored -> {
                AuthorizationContext levelBase = base.withResolved(ResolvedContext.of(results));
                return runLevel(level, levelBase).thenAccept(results::putAll);
            });
        }
        return chain.thenApply(ignored -> base.withResolved(merge(results)));
    }

    /**
     * Resolves a single resolver, using the cache, without running its dependencies.
     *
     * @return the output, or empty if no such resolver is registered or an optional resolver failed
     */
    public Optional<ResolvedData> resolveOne(String name, AuthorizationContext base) {
        ContextResolver resolver;
        synchronized (resolvers) {
            resolver = resolvers.get(name);
        }
        if (resolver == null) {
            log.warn("Resolver not found: {}", name);
            return Optional.empty();
        }
        return join(guarded(resolver, base));
    }

    /**
     * Drops cached output for a user: for one resolver when {@code resolverName} is given,
     * otherwise for every resolver. Keys are computed from a context holding only the user ID.
     */
    public void invalidateCache(String userId, String resolverName) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        AuthorizationContext keyContext = AuthorizationContext.of(userId);
        List<ContextResolver> targets;
        synchronized (resolvers) {
            if (resolverName != null) {
                ContextResolver resolver = resolvers.get(resolverName);
                targets = resolver == null ? List.of() : List.of(resolver);
            } else {
                targets = new ArrayList<>(resolvers.values());
            }
        }
        for (ContextResolver resolver : targets) {
            cacheKeyFor(resolver, keyContext).ifPresent(key -> {
                cache.delete(key);
                log.debug("Invalidated cache for resolver '{}': {}", resolver.name(), key);
            });
        }
        if (resolverName == null && cache.supportsPatterns()) {
            cache.deletePattern(CacheKeys.of("*", userId));
            cache.deletePattern(CacheKeys.of("*", userId, "*"));
        }
    }

    /** Drops cached output for a user across all resolvers. */
    public void invalidateCache(String userId) {
        invalidateCache(userId, null);
    }

    /** Drops all cached resolver output. */
    public void clearCache() {
        if (cache instanceof InMemoryCacheProvider inMemory) {
            inMemory.clear();
        } else if (cache.supportsPatterns()) {
            cache.deletePattern(CacheKeys.ALL);
        } else {
            log.warn("Cache provider {} cannot be cleared: pattern deletion unsupported",
                    cache.getClass().getSimpleName());
            return;
        }
        log.info("Cleared resolver cache");
    }

    public ResolverManagerOptions options() {
        return options;
    }

    private Map<String, ContextResolver> snapshot() {
        synchronized (resolvers) {
            return new LinkedHashMap<>(resolvers);
        }
    }

    private CompletableFuture<Map<String, ResolvedData>> runLevel(List<ContextResolver> level,
                                                                AuthorizationContext levelBase) {
        Map<String, ResolvedData> levelResults = new LinkedHashMap<>();
        if (!options.parallel()) {
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (ContextResolver resolver : level) {
                chain = chain.thenCompose(ignored -> guarded(resolver, levelBase)
                        .thenAccept(data -> data.ifPresent(d -> levelResults.put(resolver.name(), d))));
            }
            return chain.thenApply(ignored -> levelResults);
        }

        List<CompletableFuture<Optional<ResolvedData>>> futures = new ArrayList<>(level.size());
        for (ContextResolver resolver : level) {
            futures.add(guarded(resolver, levelBase));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    for (int i = 0; i < level.size(); i++) {
                        String name = level.get(i).name();
                        futures.get(i).join().ifPresent(data -> levelResults.put(name, data));
                    }
                    return levelResults;
                });
    }

    /** Resolves through the cache and applies the required/optional failure policy. */
    private CompletableFuture<Optional<ResolvedData>> guarded(ContextResolver resolver, AuthorizationContext base) {
        return resolveWithCache(resolver, base).handle((data, error) -> {
            if (error == null) {
                return Optional.of(data);
            }
            Throwable cause = unwrap(error);
            boolean timedOut = cause instanceof TimeoutException;
            metrics.resolverFailed(resolver.name(), timedOut);
            String message = timedOut
                    ? "Resolver '" + resolver.name() + "' timed out after " + options.resolverTimeout().toMillis() + "ms"
                    : "Resolver '" + resolver.name() + "' failed: " + cause.getMessage();
            if (resolver.required()) {
                log.error(message);
                throw new ResolverException(resolver.name(), message, timedOut, cause);
            }
            log.warn("{} (optional, continuing without it)", message);
            return Optional.<ResolvedData>empty();
        });
    }

    private CompletableFuture<ResolvedData> resolveWithCache(ContextResolver resolver, AuthorizationContext base) {
        Optional<String> key = cacheKeyFor(resolver, base);
        if (key.isPresent()) {
            Optional<ResolvedData> cached = cacheGet(key.get());
            if (cached.isPresent()) {
                metrics.cacheHit(resolver.name());
                log.debug("Cache hit for resolver '{}': {}", resolver.name(), key.get());
                return CompletableFuture.completedFuture(cached.get());
            }
            metrics.cacheMiss(resolver.name());
        }

        Timer.Sample sample = Timer.start(metrics.registry());
        return CompletableFuture
                .supplyAsync(() -> AuthorizationScope.call(base, () -> resolver.resolve(base)), options.executor())
                .thenCompose(future -> future == null
                        ? CompletableFuture.<ResolvedData>failedFuture(
                                new IllegalStateException("resolve returned no future"))
                        : future)
                .orTimeout(options.resolverTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(data -> {
                    if (data == null) {
                        throw new IllegalStateException("resolve produced no data");
                    }
                    sample.stop(metrics.resolverTimer(resolver.name()));
                    key.ifPresent(k -> cacheSet(resolver, k, data));
                    return data;
                });
    }

    private Optional<String> cacheKeyFor(ContextResolver resolver, AuthorizationContext base) {
        try {
            return resolver.cacheKey(base).filter(k -> !k.isBlank());
        } catch (RuntimeException e) {
            log.debug("Resolver '{}' produced no cache key: {}", resolver.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ResolvedData> cacheGet(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void cacheSet(ContextResolver resolver, String key, ResolvedData data) {
        Duration ttl = resolver.cacheTtl().orElse(options.defaultCacheTtl());
        try {
            cache.set(key, data, ttl);
            log.debug("Cached resolver '{}' at {} for {}", resolver.name(), key, ttl);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private ResolvedContext merge(Map<String, ResolvedData> results) {
        Map<String, String> owner = new HashMap<>();
        for (Map.Entry<String, ResolvedData> result : results.entrySet()) {
            Set<String> keys = result.getValue().values().keySet();
            for (String key : keys) {
                String first = owner.putIfAbsent(key, result.getKey());
                if (first != null) {
                    if (options.strictMerge()) {
                        throw new SchemaException(
                                "Resolvers '" + first + "' and '" + result.getKey() + "' both produce key '" + key + "'",
                                Map.of("key", key, "resolvers", List.of(first, result.getKey())));
                    }
                    log.warn("Resolved key '{}' from resolver '{}' ignored; '{}' already provided it",
                            key, result.getKey(), first);
                }
            }
        }
        return ResolvedContext.of(results);
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ResolverException(null, "Context resolution failed: " + cause.getMessage(), false, cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
