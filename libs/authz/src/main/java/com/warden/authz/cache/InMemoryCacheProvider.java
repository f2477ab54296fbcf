package com.warden.authz.cache;

import com.warden.context.ResolvedData;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Process-local {@link CacheProvider}. Expired entries are removed when read and swept
 * every {@value #SWEEP_INTERVAL} writes.
 */
public final class InMemoryCacheProvider implements CacheProvider {

    static final int SWEEP_INTERVAL = 256;

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private final Clock clock;

    public InMemoryCacheProvider() {
        this(Clock.systemUTC());
    }

    /** Creates a provider reading time from {@code clock}; useful to drive expiry in tests. */
    public InMemoryCacheProvider(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    @Override
    public Optional<ResolvedData> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, ResolvedData value, Duration ttl) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
        if (writes.incrementAndGet() % SWEEP_INTERVAL == 0) {
            sweep();
        }
    }

    /** Removes every expired entry and returns how many were dropped. */
    public int sweep() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
        return Math.max(0, before - entries.size());
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public boolean supportsPatterns() {
        return true;
    }

    @Override
    public void deletePattern(String glob) {
        Pattern pattern = toRegex(glob);
        entries.keySet().removeIf(key -> pattern.matcher(key).matches());
    }

    /** Removes every entry. */
    public void clear() {
        entries.clear();
    }

    /** Number of stored entries, including expired ones not yet read or swept. */
    public int size() {
        return entries.size();
    }

    static Pattern toRegex(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new IllegalArgumentException("glob must not be null or empty");
        }
        var regex = new StringBuilder();
        int start = 0;
        for (int i = glob.indexOf('*'); i >= 0; i = glob.indexOf('*', start)) {
            if (i > start) {
                regex.append(Pattern.quote(glob.substring(start, i)));
            }
            regex.append(".*");
            start = i + 1;
        }
        if (start < glob.length()) {
            regex.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(regex.toString());
    }

    private record Entry(ResolvedData value, Instant expiresAt) {
    }
}
