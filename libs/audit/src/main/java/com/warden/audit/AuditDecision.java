package com.warden.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a policy decision as recorded in the audit trail.
 */
public enum AuditDecision {
    ALLOW("allow"),
    DENY("deny"),
    FILTER("filter");

    private final String value;

    AuditDecision(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
