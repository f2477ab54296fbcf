package com.warden.audit;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Configuration for an {@link AuditLogger}.
 * <p>
 * Tables without an entry in {@code tables} use {@code defaults}. A table entry replaces the
 * defaults wholesale; derive it with {@code defaults().toBuilder()} to inherit them.
 *
 * @param adapter       where events are written
 * @param enabled       master switch
 * @param defaults      settings for tables without their own entry
 * @param tables        per-table settings
 * @param bufferSize    events buffered before an automatic flush (0 disables buffering)
 * @param flushInterval period of the background flush (zero disables the timer)
 * @param async         whether {@code log*} calls return before the adapter is called
 * @param sampleRate    fraction of events kept, in [0, 1]
 * @param onError       receives adapter failures (nullable)
 * @param sampler       source of uniform random numbers in [0, 1) used for sampling
 * @param redactor      redacts sensitive keys from the event context
 */
public record AuditConfig(
        AuditAdapter adapter,
        boolean enabled,
        TableAuditConfig defaults,
        Map<String, TableAuditConfig> tables,
        int bufferSize,
        Duration flushInterval,
        boolean async,
        double sampleRate,
        AuditErrorHandler onError,
        DoubleSupplier sampler,
        AuditContextRedactor redactor
) {

    public static final int DEFAULT_BUFFER_SIZE = 100;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(5000);

    public AuditConfig {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter must not be null");
        }
        if (bufferSize < 0) {
            throw new IllegalArgumentException("bufferSize must not be negative");
        }
        if (Double.isNaN(sampleRate) || sampleRate < 0.0 || sampleRate > 1.0) {
            throw new IllegalArgumentException("sampleRate must be between 0 and 1");
        }
        if (flushInterval == null) {
            flushInterval = DEFAULT_FLUSH_INTERVAL;
        }
        if (flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must not be negative");
        }
        if (defaults == null) {
            defaults = TableAuditConfig.defaults();
        }
        tables = tables == null ? Map.of() : Map.copyOf(tables);
        if (sampler == null) {
            sampler = () -> ThreadLocalRandom.current().nextDouble();
        }
        if (redactor == null) {
            redactor = new AuditContextRedactor();
        }
    }

    /** Settings effective for {@code table}. */
    public TableAuditConfig forTable(String table) {
        return tables.getOrDefault(table, defaults);
    }

    public static Builder builder(AuditAdapter adapter) {
        return new Builder(adapter);
    }

    /**
     * Builder for {@link AuditConfig}, pre-populated with the defaults.
     */
    public static final class Builder {

        private final AuditAdapter adapter;
        private boolean enabled = true;
        private TableAuditConfig defaults = TableAuditConfig.defaults();
        private final Map<String, TableAuditConfig> tables = new LinkedHashMap<>();
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
        private boolean async = true;
        private double sampleRate = 1.0;
        private AuditErrorHandler onError;
        private DoubleSupplier sampler;
        private AuditContextRedactor redactor;

        private Builder(AuditAdapter adapter) {
            this.adapter = adapter;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder defaults(TableAuditConfig defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder table(String table, TableAuditConfig config) {
            this.tables.put(table, config);
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public Builder sampleRate(double sampleRate) {
            this.sampleRate = sampleRate;
            return this;
        }

        public Builder onError(AuditErrorHandler onError) {
            this.onError = onError;
            return this;
        }

        public Builder sampler(DoubleSupplier sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder redactor(AuditContextRedactor redactor) {
            this.redactor = redactor;
            return this;
        }

        public AuditConfig build() {
            return new AuditConfig(adapter, enabled, defaults, tables, bufferSize, flushInterval,
                    async, sampleRate, onError, sampler, redactor);
        }
    }
}
