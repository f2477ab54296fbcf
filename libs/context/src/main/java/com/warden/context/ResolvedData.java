package com.warden.context;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A named slice of contextual data produced by exactly one context resolver.
 * <p>
 * Values are kept in insertion order. Instances are immutable and safe to share between
 * concurrent operations, which is what allows them to be cached.
 *
 * @param values     the resolved key/value pairs (never null)
 * @param resolvedAt when the data was produced
 */
public record ResolvedData(Map<String, Object> values, Instant resolvedAt) {

    public ResolvedData {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        if (resolvedAt == null) {
            resolvedAt = Instant.now();
        }
    }

    /** Creates resolved data stamped with the current time. */
    public static ResolvedData of(Map<String, Object> values) {
        return new ResolvedData(values, Instant.now());
    }

    /** Creates resolved data holding a single entry. */
    public static ResolvedData of(String key, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(key, value);
        return new ResolvedData(values, Instant.now());
    }

    /** Resolved data with no entries. */
    public static ResolvedData empty() {
        return new ResolvedData(Map.of(), Instant.now());
    }

    /** Returns the value stored under {@code key}, if any. */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Returns the value stored under {@code key} cast to {@code type}.
     *
     * @throws ClassCastException if the stored value is not of the requested type
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).map(type::cast);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }
}
