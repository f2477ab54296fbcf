package com.warden.authz.cache;

import java.util.StringJoiner;

/**
 * Cache key convention for resolved context: {@code authz:<part>:<part>...}.
 */
public final class CacheKeys {

    /** Prefix of every key built by {@link #of(Object...)}. */
    public static final String PREFIX = "authz";

    /** Glob matching every key built by {@link #of(Object...)}. */
    public static final String ALL = PREFIX + ":*";

    private CacheKeys() {
        // utility class
    }

    /**
     * Builds a key from the given parts, e.g. {@code of("org", userId)} gives
     * {@code authz:org:<userId>}. Null parts are rendered as empty segments.
     */
    public static String of(Object... parts) {
        var key = new StringJoiner(":").add(PREFIX);
        for (Object part : parts) {
            key.add(part == null ? "" : part.toString());
        }
        return key.toString();
    }
}
