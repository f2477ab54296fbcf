package com.warden.audit;

import java.util.List;
import java.util.Map;

/**
 * Optional details attached to a logged decision.
 *
 * @param reason     why the decision was made (nullable)
 * @param rowIds     affected row identifiers
 * @param queryHash  hash of the query (nullable)
 * @param durationMs how long the decision took (nullable)
 * @param context    extra context entries merged into the event context
 */
public record AuditDetails(
        String reason,
        List<String> rowIds,
        String queryHash,
        Long durationMs,
        Map<String, Object> context
) {

    private static final AuditDetails NONE = new AuditDetails(null, null, null, null, null);

    public AuditDetails {
        rowIds = rowIds == null ? List.of() : List.copyOf(rowIds);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static AuditDetails none() {
        return NONE;
    }

    public static AuditDetails reason(String reason) {
        return new AuditDetails(reason, null, null, null, null);
    }

    public AuditDetails withReason(String reason) {
        return new AuditDetails(reason, rowIds, queryHash, durationMs, context);
    }

    public AuditDetails withRowIds(List<String> rowIds) {
        return new AuditDetails(reason, rowIds, queryHash, durationMs, context);
    }

    public AuditDetails withQueryHash(String queryHash) {
        return new AuditDetails(reason, rowIds, queryHash, durationMs, context);
    }

    public AuditDetails withDurationMs(long durationMs) {
        return new AuditDetails(reason, rowIds, queryHash, durationMs, context);
    }

    public AuditDetails withContext(Map<String, Object> context) {
        return new AuditDetails(reason, rowIds, queryHash, durationMs, context);
    }
}
