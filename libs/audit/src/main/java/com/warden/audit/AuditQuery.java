package com.warden.audit;

import com.warden.context.Operation;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Criteria for querying stored audit events. Null criteria match everything.
 *
 * @param userId    exact user ID
 * @param tenantId  exact tenant ID
 * @param table     exact table
 * @param operation exact operation
 * @param decision  exact decision
 * @param from      inclusive lower bound on the timestamp
 * @param to        exclusive upper bound on the timestamp
 * @param requestId exact request ID
 * @param offset    events to skip
 * @param limit     maximum events returned (0 for unlimited)
 */
public record AuditQuery(
        String userId,
        String tenantId,
        String table,
        Operation operation,
        AuditDecision decision,
        Instant from,
        Instant to,
        String requestId,
        int offset,
        int limit
) {

    public AuditQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }

    /** A query matching every event. */
    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null, null, null, 0, 0);
    }

    public AuditQuery forUser(String userId) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    public AuditQuery forTenant(String tenantId) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    public AuditQuery forTable(String table) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    public AuditQuery withOperation(Operation operation) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    public AuditQuery withDecision(AuditDecision decision) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    public AuditQuery between(Instant from, Instant to) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    public AuditQuery forRequest(String requestId) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    public AuditQuery page(int offset, int limit) {
        return new AuditQuery(userId, tenantId, table, operation, decision, from, to, requestId, offset, limit);
    }

    /** The criteria as a predicate, ignoring paging. */
    public Predicate<AuditEvent> asPredicate() {
        return event -> (userId == null || userId.equals(event.userId()))
                && (tenantId == null || tenantId.equals(event.tenantId()))
                && (table == null || table.equals(event.table()))
                && (operation == null || operation == event.operation())
                && (decision == null || decision == event.decision())
                && (from == null || !event.timestamp().isBefore(from))
                && (to == null || event.timestamp().isBefore(to))
                && (requestId == null || Objects.equals(requestId, event.requestId()));
    }
}
