package com.warden.audit;

import java.util.List;
import java.util.function.Predicate;

/**
 * Audit settings for one table (or the defaults applied to tables without their own entry).
 *
 * @param enabled        whether decisions on the table are audited at all
 * @param logAllowed     whether allow decisions are logged
 * @param logDenied      whether deny decisions are logged
 * @param logFilters     whether filter decisions are logged
 * @param includeContext when non-empty, only these context keys are kept
 * @param excludeContext context keys always dropped
 * @param filter         custom predicate; events it rejects are not logged (nullable)
 */
public record TableAuditConfig(
        boolean enabled,
        boolean logAllowed,
        boolean logDenied,
        boolean logFilters,
        List<String> includeContext,
        List<String> excludeContext,
        Predicate<AuditEvent> filter
) {

    public TableAuditConfig {
        includeContext = includeContext == null ? List.of() : List.copyOf(includeContext);
        excludeContext = excludeContext == null ? List.of() : List.copyOf(excludeContext);
    }

    /** Enabled; only deny decisions logged. */
    public static TableAuditConfig defaults() {
        return new TableAuditConfig(true, false, true, false, List.of(), List.of(), null);
    }

    /** A configuration that audits nothing. */
    public static TableAuditConfig disabled() {
        return new TableAuditConfig(false, false, false, false, List.of(), List.of(), null);
    }

    /** Whether a decision of the given kind should be logged. */
    public boolean shouldLog(AuditDecision decision) {
        if (!enabled) {
            return false;
        }
        return switch (decision) {
            case ALLOW -> logAllowed;
            case DENY -> logDenied;
            case FILTER -> logFilters;
        };
    }

    public static Builder builder() {
        return defaults().toBuilder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder for {@link TableAuditConfig}, starting from an existing configuration.
     */
    public static final class Builder {

        private boolean enabled;
        private boolean logAllowed;
        private boolean logDenied;
        private boolean logFilters;
        private List<String> includeContext;
        private List<String> excludeContext;
        private Predicate<AuditEvent> filter;

        private Builder(TableAuditConfig base) {
            this.enabled = base.enabled;
            this.logAllowed = base.logAllowed;
            this.logDenied = base.logDenied;
            this.logFilters = base.logFilters;
            this.includeContext = base.includeContext;
            this.excludeContext = base.excludeContext;
            this.filter = base.filter;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder logAllowed(boolean logAllowed) {
            this.logAllowed = logAllowed;
            return this;
        }

        public Builder logDenied(boolean logDenied) {
            this.logDenied = logDenied;
            return this;
        }

        public Builder logFilters(boolean logFilters) {
            this.logFilters = logFilters;
            return this;
        }

        public Builder includeContext(List<String> keys) {
            this.includeContext = keys;
            return this;
        }

        public Builder excludeContext(List<String> keys) {
            this.excludeContext = keys;
            return this;
        }

        public Builder filter(Predicate<AuditEvent> filter) {
            this.filter = filter;
            return this;
        }

        public TableAuditConfig build() {
            return new TableAuditConfig(enabled, logAllowed, logDenied, logFilters,
                    includeContext, excludeContext, filter);
        }
    }
}
