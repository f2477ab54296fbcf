package com.warden.authz.metrics;

import com.warden.audit.AuditLogger;
import com.warden.context.Operation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Micrometer meters for the authorization engine.
 * <p>
 * Every meter carries a {@code component} tag ({@code resolver}, {@code cache},
 * {@code policy}, {@code field} or {@code audit}) so dashboards can slice by subsystem.
 */
public final class AuthorizationMetrics {

    /** Tag key for the subsystem that produced the measurement. */
    public static final String TAG_COMPONENT = "component";

    public static final String RESOLVER_DURATION = "warden.resolver.duration";
    public static final String RESOLVER_FAILURES = "warden.resolver.failures";
    public static final String CACHE_REQUESTS = "warden.cache.requests";
    public static final String POLICY_DECISIONS = "warden.policy.decisions";
    public static final String FIELDS_HIDDEN = "warden.field.hidden";
    public static final String AUDIT_EVENTS = "warden.audit.events";

    private final MeterRegistry registry;

    public AuthorizationMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Metrics backed by a private {@link SimpleMeterRegistry}, for callers without a registry. */
    public static AuthorizationMetrics noop() {
        return new AuthorizationMetrics(new SimpleMeterRegistry());
    }

    /** Timer for successful invocations of the named resolver. */
    public Timer resolverTimer(String resolver) {
        return Timer.builder(RESOLVER_DURATION)
                .description("Time spent in context resolvers")
                .tags(tags("resolver", "resolver", resolver))
                .register(registry);
    }

    public void resolverFailed(String resolver, boolean timedOut) {
        Counter.builder(RESOLVER_FAILURES)
                .description("Context resolver failures")
                .tags(tags("resolver", "resolver", resolver, "timeout", String.valueOf(timedOut)))
                .register(registry)
                .increment();
    }

    public void cacheHit(String resolver) {
        cacheRequest(resolver, "hit");
    }

    public void cacheMiss(String resolver) {
        cacheRequest(resolver, "miss");
    }

    /**
     * Counts a row-level policy decision.
     *
     * @param decision lower-case decision name (allow, deny, filter, untouched)
     */
    public void policyDecision(String table, Operation operation, String decision) {
        Counter.builder(POLICY_DECISIONS)
                .description("Row-level policy decisions")
                .tags(tags("policy", "table", table, "operation", operation.value(), "decision", decision))
                .register(registry)
                .increment();
    }

    /** Counts fields masked or omitted on the read path. */
    public void fieldsHidden(String table, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(FIELDS_HIDDEN)
                .description("Fields masked or omitted by field access rules")
                .tags(tags("field", "table", table))
                .register(registry)
                .increment(count);
    }

    /**
     * Exposes the audit logger's written, failed and sampled-out totals as function counters.
     */
    public void bindAudit(AuditLogger auditLogger) {
        FunctionCounter.builder(AUDIT_EVENTS, auditLogger, AuditLogger::writtenCount)
                .description("Audit events written to the adapter")
                .tags(tags("audit", "outcome", "written"))
                .register(registry);
        FunctionCounter.builder(AUDIT_EVENTS, auditLogger, AuditLogger::failedCount)
                .description("Audit events lost to adapter failures")
                .tags(tags("audit", "outcome", "failed"))
                .register(registry);
        FunctionCounter.builder(AUDIT_EVENTS, auditLogger, AuditLogger::sampledOutCount)
                .description("Audit events dropped by sampling")
                .tags(tags("audit", "outcome", "sampled_out"))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    private void cacheRequest(String resolver, String result) {
        Counter.builder(CACHE_REQUESTS)
                .description("Resolver cache lookups")
                .tags(tags("cache", "resolver", resolver, "result", result))
                .register(registry)
                .increment();
    }

    private static Tags tags(String component, String... keyValues) {
        return Tags.of(TAG_COMPONENT, component).and(keyValues);
    }
}
