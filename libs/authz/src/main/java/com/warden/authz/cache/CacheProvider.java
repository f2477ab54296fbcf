package com.warden.authz.cache;

import com.warden.context.ResolvedData;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store for resolved context data, with per-entry expiry.
 * <p>
 * Implementations must be safe for concurrent use; concurrent writes to one key resolve to
 * the last writer. Pattern deletion is optional.
 */
public interface CacheProvider {

    /** Returns the unexpired value stored under {@code key}. */
    Optional<ResolvedData> get(String key);

    /** Stores {@code value} under {@code key} for {@code ttl}. */
    void set(String key, ResolvedData value, Duration ttl);

    void delete(String key);

    /** Whether {@link #deletePattern(String)} is supported. */
    default boolean supportsPatterns() {
        return false;
    }

    /**
     * Deletes every key matching {@code glob}, where {@code *} matches any run of characters.
     *
     * @throws UnsupportedOperationException if the provider does not support patterns
     */
    default void deletePattern(String glob) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support deletePattern");
    }
}
