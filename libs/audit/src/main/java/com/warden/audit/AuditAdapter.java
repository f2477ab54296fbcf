package com.warden.audit;

import java.util.List;

/**
 * Destination for audit events.
 * <p>
 * Implementations may throw from any method; the {@link AuditLogger} catches the failure
 * and routes it to its error handler.
 */
public interface AuditAdapter {

    /** Writes a single event. */
    void log(AuditEvent event) throws Exception;

    /**
     * Writes a batch of events in order. Defaults to calling {@link #log(AuditEvent)} for each.
     */
    default void logBatch(List<AuditEvent> events) throws Exception {
        for (AuditEvent event : events) {
            log(event);
        }
    }

    /** Flushes any output buffered by the adapter itself. */
    default void flush() throws Exception {
    }

    /** Releases the adapter's resources. */
    default void close() throws Exception {
    }
}
