package com.warden.authz.rebac;

import java.util.List;

/**
 * Outcome of evaluating the row-level policies of a table for one operation.
 */
public sealed interface PolicyDecision
        permits PolicyDecision.Untouched, PolicyDecision.Allow, PolicyDecision.Deny, PolicyDecision.Filter {

    /** The table has no row-level configuration, or the caller is a system identity. */
    record Untouched() implements PolicyDecision {
    }

    /** Every row is accessible. */
    record Allow(String policyName) implements PolicyDecision {
    }

    /** No row is accessible. */
    record Deny(String policyName, String reason) implements PolicyDecision {
    }

    /** Only rows satisfying every filter are accessible. */
    record Filter(List<RowFilter> filters) implements PolicyDecision {

        public Filter {
            filters = List.copyOf(filters);
        }
    }

    static PolicyDecision untouched() {
        return new Untouched();
    }

    /** Lower-case label for logs, metrics and audit events. */
    default String label() {
        if (this instanceof Allow) {
            return "allow";
        }
        if (this instanceof Deny) {
            return "deny";
        }
        if (this instanceof Filter) {
            return "filter";
        }
        return "untouched";
    }
}
