package com.warden.audit;

import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationScope;
import com.warden.context.Operation;
import com.warden.context.RequestMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers, samples and flushes policy decisions to an {@link AuditAdapter}.
 * <p>
 * Events are enriched from the context bound to {@link AuthorizationScope} at the time of the
 * call. The buffer is flushed when it reaches {@code bufferSize}, on the background timer, on
 * {@link #flush()} and on {@link #close()}. A flush swaps the buffer for an empty one under
 * the lock and writes the swapped batch outside of it, so logging never waits on the adapter.
 * Writes are serialized on a separate lock, so batches reach the adapter one at a time and in
 * the order they were swapped out, whichever thread flushes.
 * <p>
 * Adapter failures are logged and handed to the configured {@link AuditErrorHandler}; they
 * never reach the caller.
 */
public final class AuditLogger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);
    private static final long CLOSE_TIMEOUT_MS = 5000;

    private final AuditConfig config;
    private final AuditAdapter adapter;
    private final ScheduledExecutorService executor;
    private final Object lock = new Object();
    private final Object writeLock = new Object();
    private List<AuditEvent> buffer = new ArrayList<>();

    private volatile boolean enabled;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong sampledOut = new AtomicLong();

    public AuditLogger(AuditConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
        this.adapter = config.adapter();
        this.enabled = config.enabled();
        this.executor = Executors.newSingleThreadScheduledExecutor(task -> {
            Thread thread = new Thread(task, "warden-audit-flush");
            thread.setDaemon(true);
            return thread;
        });
        if (config.async() && config.bufferSize() > 0 && !config.flushInterval().isZero()) {
            long periodMs = config.flushInterval().toMillis();
            executor.scheduleAtFixedRate(this::flush, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
    }

    public CompletableFuture<Void> logAllow(Operation operation, String table, String policyName) {
        return logDecision(operation, table, AuditDecision.ALLOW, policyName, AuditDetails.none());
    }

    public CompletableFuture<Void> logAllow(Operation operation, String table, String policyName,
                                            AuditDetails details) {
        return logDecision(operation, table, AuditDecision.ALLOW, policyName, details);
    }

    public CompletableFuture<Void> logDeny(Operation operation, String table, String policyName) {
        return logDecision(operation, table, AuditDecision.DENY, policyName, AuditDetails.none());
    }

    public CompletableFuture<Void> logDeny(Operation operation, String table, String policyName,
                                           AuditDetails details) {
        return logDecision(operation, table, AuditDecision.DENY, policyName, details);
    }

    public CompletableFuture<Void> logFilter(Operation operation, String table, String policyName) {
        return logDecision(operation, table, AuditDecision.FILTER, policyName, AuditDetails.none());
    }

    public CompletableFuture<Void> logFilter(Operation operation, String table, String policyName,
                                             AuditDetails details) {
        return logDecision(operation, table, AuditDecision.FILTER, policyName, details);
    }

    /**
     * Records a decision, subject to the enabled switch, sampling and the table's settings.
     * <p>
     * With {@code async=true} the returned future completes once the event is buffered or,
     * when the event fills the buffer, once the resulting flush has run; callers may ignore
     * it. With {@code async=false} the adapter has been called by the time this returns.
     *
     * @return completes when this call's work is done; never completes exceptionally
     */
    public CompletableFuture<Void> logDecision(Operation operation, String table, AuditDecision decision,
                                               String policyName, AuditDetails details) {
        if (!enabled || closed.get()) {
            return DONE;
        }
        if (config.sampleRate() < 1.0 && config.sampler().getAsDouble() >= config.sampleRate()) {
            sampledOut.incrementAndGet();
            return DONE;
        }
        TableAuditConfig tableConfig = config.forTable(table);
        if (!tableConfig.shouldLog(decision)) {
            return DONE;
        }

        AuditEvent event = buildEvent(operation, table, decision, policyName,
                details == null ? AuditDetails.none() : details, tableConfig);

        if (tableConfig.filter() != null) {
            try {
                if (!tableConfig.filter().test(event)) {
                    return DONE;
                }
            } catch (RuntimeException e) {
                handleError(e, List.of(event));
                return DONE;
            }
        }
        return dispatch(event);
    }

    /**
     * Writes every buffered event to the adapter now.
     */
    public void flush() {
        synchronized (writeLock) {
            List<AuditEvent> batch;
            synchronized (lock) {
                if (buffer.isEmpty()) {
                    return;
                }
                batch = buffer;
                buffer = new ArrayList<>();
            }
            write(batch);
        }
    }

    /**
     * Stops the timer, flushes the remaining events, then flushes and closes the adapter.
     * Subsequent {@code log*} calls are ignored.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        flush();
        try {
            adapter.flush();
            adapter.close();
        } catch (Exception e) {
            handleError(e, List.of());
        }
        log.debug("Audit logger closed: {} written, {} failed, {} sampled out",
                written.get(), failed.get(), sampledOut.get());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /** Number of events waiting in the buffer. */
    public int bufferedCount() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    /** Events handed to the adapter successfully. */
    public long writtenCount() {
        return written.get();
    }

    /** Events lost to adapter failures. */
    public long failedCount() {
        return failed.get();
    }

    /** Events dropped by sampling. */
    public long sampledOutCount() {
        return sampledOut.get();
    }

    private CompletableFuture<Void> dispatch(AuditEvent event) {
        if (config.async() && config.bufferSize() > 0) {
            boolean full;
            synchronized (lock) {
                buffer.add(event);
                full = buffer.size() >= config.bufferSize();
            }
            return full ? runOnExecutor(this::flush) : DONE;
        }
        if (config.async()) {
            return runOnExecutor(() -> write(List.of(event)));
        }
        write(List.of(event));
        return DONE;
    }

    private CompletableFuture<Void> runOnExecutor(Runnable task) {
        try {
            return CompletableFuture.runAsync(task, executor);
        } catch (RejectedExecutionException e) {
            // closing concurrently: run inline so nothing is lost
            task.run();
            return DONE;
        }
    }

    private void write(List<AuditEvent> events) {
        synchronized (writeLock) {
            try {
                if (events.size() == 1) {
                    adapter.log(events.get(0));
                } else {
                    adapter.logBatch(events);
                }
                written.addAndGet(events.size());
            } catch (Exception e) {
                failed.addAndGet(events.size());
                handleError(e, events);
            }
        }
    }

    private void handleError(Throwable error, List<AuditEvent> events) {
        log.warn("Audit adapter failed for {} event(s): {}", events.size(), error.getMessage());
        AuditErrorHandler handler = config.onError();
        if (handler == null) {
            return;
        }
        try {
            handler.onError(error, events);
        } catch (RuntimeException handlerError) {
            log.error("Audit error handler threw", handlerError);
        }
    }

    private AuditEvent buildEvent(Operation operation, String table, AuditDecision decision,
                                  String policyName, AuditDetails details, TableAuditConfig tableConfig) {
        AuthorizationContext ctx = AuthorizationScope.current().orElse(null);
        AuditEvent.Builder builder = AuditEvent.builder(operation, table, decision)
                .policyName(policyName)
                .reason(details.reason())
                .rowIds(details.rowIds())
                .queryHash(details.queryHash())
                .durationMs(details.durationMs());
        if (ctx != null) {
            builder.userId(ctx.userId()).tenantId(ctx.tenantId());
            RequestMeta request = ctx.requestMeta();
            if (request != null) {
                builder.requestId(request.requestId())
                        .ipAddress(request.ipAddress())
                        .userAgent(request.userAgent());
            }
        }
        builder.context(buildContext(ctx, tableConfig, details.context()));
        return builder.build();
    }

    private Map<String, Object> buildContext(AuthorizationContext ctx, TableAuditConfig tableConfig,
                                             Map<String, Object> extra) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (ctx != null) {
            if (!ctx.roles().isEmpty()) {
                context.put("roles", List.copyOf(ctx.roles()));
            }
            if (!ctx.organizationIds().isEmpty()) {
                context.put("organizationIds", ctx.organizationIds());
            }
            context.putAll(ctx.meta());
        }
        context.putAll(extra);

        Map<String, Object> filtered = context;
        if (!tableConfig.includeContext().isEmpty()) {
            filtered = new LinkedHashMap<>();
            for (String key : tableConfig.includeContext()) {
                if (context.containsKey(key)) {
                    filtered.put(key, context.get(key));
                }
            }
        }
        for (String key : tableConfig.excludeContext()) {
            filtered.remove(key);
        }
        return filtered.isEmpty() ? null : config.redactor().redact(filtered);
    }
}
