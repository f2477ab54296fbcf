package com.warden.spring;

import com.warden.audit.AuditConfig;
import com.warden.audit.ConsoleAuditAdapter;
import com.warden.authz.query.ReBAcQueryTransformer;
import com.warden.authz.resolver.ResolverManagerOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration for the authorization engine, bound from {@code warden.*}.
 *
 * <pre>
 * warden:
 *   resolver:
 *     default-cache-ttl: 5m
 *     timeout: 2s
 *     strict-merge: true
 *   query:
 *     strategy: exists
 *     main-table-alias: t
 *   field:
 *     mask-value: "***"
 *   audit:
 *     enabled: true
 *     format: json
 *     buffer-size: 200
 *     sample-rate: 0.5
 * </pre>
 *
 * Absent sections take the library defaults.
 *
 * @param enabled  whether the engine is auto-configured (default true)
 * @param resolver context resolution settings
 * @param query    query transformation settings
 * @param field    field masking settings
 * @param audit    audit logging settings
 */
@Validated
@ConfigurationProperties(prefix = "warden")
public record WardenProperties(
        Boolean enabled,
        @Valid Resolver resolver,
        @Valid Query query,
        @Valid Field field,
        @Valid Audit audit) {

    public WardenProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (resolver == null) {
            resolver = new Resolver(null, null, null, false);
        }
        if (query == null) {
            query = new Query(null, null);
        }
        if (field == null) {
            field = new Field(null);
        }
        if (audit == null) {
            audit = new Audit(false, null, null, null, null, null, false, true, false);
        }
    }

    /**
     * @param defaultCacheTtl cache lifetime for resolvers that set none (default 300s)
     * @param timeout         per-resolver timeout (default 5s)
     * @param parallel        whether a level's resolvers run concurrently (default true)
     * @param strictMerge     whether two resolvers producing the same key is an error
     */
    public record Resolver(Duration defaultCacheTtl, Duration timeout, Boolean parallel, boolean strictMerge) {

        public Resolver {
            if (defaultCacheTtl == null) {
                defaultCacheTtl = ResolverManagerOptions.DEFAULT_CACHE_TTL;
            }
            if (timeout == null) {
                timeout = ResolverManagerOptions.DEFAULT_RESOLVER_TIMEOUT;
            }
            if (parallel == null) {
                parallel = Boolean.TRUE;
            }
        }
    }

    /**
     * @param strategy       how relationship filters reach the query (default EXISTS)
     * @param mainTableAlias alias of the accessed table in outer queries (default: the table name)
     */
    public record Query(ReBAcQueryTransformer.Strategy strategy, String mainTableAlias) {

        public Query {
            if (strategy == null) {
                strategy = ReBAcQueryTransformer.Strategy.EXISTS;
            }
        }
    }

    /**
     * @param maskValue value shown for unreadable fields whose rule sets none (default null)
     */
    public record Field(String maskValue) {
    }

    /**
     * @param enabled       whether decisions are audited (default false)
     * @param format        console output format when no {@code AuditAdapter} bean exists
     * @param bufferSize    events held before a flush (default 100, 0 writes immediately)
     * @param flushInterval timer flush period (default 5s)
     * @param async         whether writes leave the caller's thread (default true)
     * @param sampleRate    fraction of events kept (default 1.0)
     * @param logAllowed    whether allow decisions are recorded
     * @param logDenied     whether deny decisions are recorded
     * @param logFilters    whether filter decisions are recorded
     */
    public record Audit(
            boolean enabled,
            ConsoleAuditAdapter.Format format,
            @Min(0) Integer bufferSize,
            Duration flushInterval,
            Boolean async,
            @DecimalMin("0.0") @DecimalMax("1.0") Double sampleRate,
            boolean logAllowed,
            Boolean logDenied,
            boolean logFilters) {

        public Audit {
            if (format == null) {
                format = ConsoleAuditAdapter.Format.TEXT;
            }
            if (bufferSize == null) {
                bufferSize = AuditConfig.DEFAULT_BUFFER_SIZE;
            }
            if (flushInterval == null) {
                flushInterval = AuditConfig.DEFAULT_FLUSH_INTERVAL;
            }
            if (async == null) {
                async = Boolean.TRUE;
            }
            if (sampleRate == null) {
                sampleRate = 1.0;
            }
            if (logDenied == null) {
                logDenied = Boolean.TRUE;
            }
        }
    }
}
