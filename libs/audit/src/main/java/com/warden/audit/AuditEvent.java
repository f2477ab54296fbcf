package com.warden.audit;

import com.warden.context.Operation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one policy decision.
 *
 * @param timestamp  when the decision was recorded
 * @param userId     user the decision applied to ({@value #ANONYMOUS} without a bound context)
 * @param tenantId   tenant of the user (nullable)
 * @param operation  the operation being authorized
 * @param table      the table the operation targeted
 * @param policyName the policy that decided (nullable)
 * @param decision   allow, deny or filter
 * @param reason     human-readable reason (nullable)
 * @param context    filtered and redacted context snapshot (nullable when empty)
 * @param rowIds     affected row identifiers (empty when unknown)
 * @param queryHash  hash of the query, for correlating decisions (nullable)
 * @param requestId  request ID from the request metadata (nullable)
 * @param ipAddress  client address (nullable)
 * @param userAgent  client user agent (nullable)
 * @param durationMs how long the decision took (nullable)
 */
public record AuditEvent(
        Instant timestamp,
        String userId,
        String tenantId,
        Operation operation,
        String table,
        String policyName,
        AuditDecision decision,
        String reason,
        Map<String, Object> context,
        List<String> rowIds,
        String queryHash,
        String requestId,
        String ipAddress,
        String userAgent,
        Long durationMs
) {

    /** User ID recorded when no authorization context is bound. */
    public static final String ANONYMOUS = "anonymous";

    public AuditEvent {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be null or blank");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (userId == null) {
            userId = ANONYMOUS;
        }
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        rowIds = rowIds == null ? List.of() : List.copyOf(rowIds);
    }

    public static Builder builder(Operation operation, String table, AuditDecision decision) {
        return new Builder(operation, table, decision);
    }

    /**
     * Builder for {@link AuditEvent}. Unset optional fields stay null.
     */
    public static final class Builder {

        private final Operation operation;
        private final String table;
        private final AuditDecision decision;
        private Instant timestamp;
        private String userId;
        private String tenantId;
        private String policyName;
        private String reason;
        private Map<String, Object> context;
        private List<String> rowIds;
        private String queryHash;
        private String requestId;
        private String ipAddress;
        private String userAgent;
        private Long durationMs;

        private Builder(Operation operation, String table, AuditDecision decision) {
            this.operation = operation;
            this.table = table;
            this.decision = decision;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder policyName(String policyName) {
            this.policyName = policyName;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder rowIds(List<String> rowIds) {
            this.rowIds = rowIds;
            return this;
        }

        public Builder queryHash(String queryHash) {
            this.queryHash = queryHash;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(timestamp, userId, tenantId, operation, table, policyName,
                    decision, reason, context, rowIds, queryHash, requestId, ipAddress,
                    userAgent, durationMs);
        }
    }
}
