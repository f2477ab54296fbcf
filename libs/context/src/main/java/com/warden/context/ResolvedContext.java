package com.warden.context;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The merged output of all context resolvers for one logical operation.
 * <p>
 * Each resolver's output is kept under the resolver's name ({@link #of(String)}), and its
 * entries are also spread into a flat view ({@link #get(String)}). When two resolvers emit
 * the same key, the flat view keeps the value of the resolver that was merged first.
 */
public final class ResolvedContext {

    private static final ResolvedContext EMPTY = new ResolvedContext(Map.of(), Map.of());

    private final Map<String, ResolvedData> byResolver;
    private final Map<String, Object> merged;

    private ResolvedContext(Map<String, ResolvedData> byResolver, Map<String, Object> merged) {
        this.byResolver = byResolver;
        this.merged = merged;
    }

    /** A resolved context with no resolver output. */
    public static ResolvedContext empty() {
        return EMPTY;
    }

    /**
     * Builds a resolved context from per-resolver results, merged in iteration order.
     * Collisions keep the first value.
     */
    public static ResolvedContext of(Map<String, ResolvedData> results) {
        Map<String, ResolvedData> byResolver = new LinkedHashMap<>();
        Map<String, Object> merged = new LinkedHashMap<>();
        results.forEach((name, data) -> {
            byResolver.put(name, data);
            data.values().forEach(merged::putIfAbsent);
        });
        return new ResolvedContext(
                Collections.unmodifiableMap(byResolver),
                Collections.unmodifiableMap(merged));
    }

    /** Returns the output of the named resolver, if it contributed. */
    public Optional<ResolvedData> of(String resolverName) {
        return Optional.ofNullable(byResolver.get(resolverName));
    }

    /** Returns a value from the flat merged view. */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(merged.get(key));
    }

    /** Returns a value from the flat merged view cast to {@code type}. */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).map(type::cast);
    }

    /**
     * Returns a collection value from the flat view as a list, or an empty list when the key
     * is absent. Useful for end conditions such as "organization_id IN (...)".
     */
    public List<Object> getList(String key) {
        Object value = merged.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return List.copyOf(collection);
        }
        return List.of(value);
    }

    public boolean contains(String key) {
        return merged.containsKey(key);
    }

    /** Names of the resolvers that contributed, in merge order. */
    public Set<String> resolverNames() {
        return byResolver.keySet();
    }

    /** The flat merged view. */
    public Map<String, Object> asMap() {
        return merged;
    }

    /** Per-resolver results in merge order. */
    public Map<String, ResolvedData> byResolver() {
        return byResolver;
    }

    public boolean isEmpty() {
        return byResolver.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedContext other)) {
            return false;
        }
        return byResolver.equals(other.byResolver);
    }

    @Override
    public int hashCode() {
        return byResolver.hashCode();
    }

    @Override
    public String toString() {
        return "ResolvedContext" + byResolver.keySet();
    }
}
