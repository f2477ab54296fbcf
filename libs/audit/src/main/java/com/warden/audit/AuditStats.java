package com.warden.audit;

import com.warden.context.Operation;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate counts over a set of audit events.
 *
 * @param totalEvents number of events
 * @param byDecision  counts per decision (every decision present, possibly zero)
 * @param byOperation counts per operation (every operation present, possibly zero)
 * @param byTable     counts per table
 * @param start       timestamp of the first event (null when there are none)
 * @param end         timestamp of the last event (null when there are none)
 */
public record AuditStats(
        long totalEvents,
        Map<AuditDecision, Long> byDecision,
        Map<Operation, Long> byOperation,
        Map<String, Long> byTable,
        Instant start,
        Instant end
) {

    public AuditStats {
        byDecision = Map.copyOf(byDecision);
        byOperation = Map.copyOf(byOperation);
        byTable = Map.copyOf(byTable);
    }
}
