package com.warden.authz.rebac;

import com.warden.context.Operation;

/**
 * Shorthands for common row-level policies. Each returns a builder so name, priority and
 * activation can still be set.
 *
 * <pre>{@code
 * ReBAcPolicies.allowRelation("products_shop_org_membership",
 *                 ctx -> Map.of("user_id", ctx.userId(), "status", "active"),
 *                 Operation.READ, Operation.UPDATE)
 *         .name("org-members-only")
 *         .build();
 * }</pre>
 */
public final class ReBAcPolicies {

    /** Default priority of {@link #denyRelation}, so exclusions are evaluated first. */
    public static final int DENY_RELATION_PRIORITY = 100;

    private ReBAcPolicies() {
        // utility class
    }

    /** Rows are visible only when the relationship exists. */
    public static ReBAcPolicyDefinition.Builder allowRelation(String relationshipPath, EndConditions endConditions,
                                                             Operation... operations) {
        return ReBAcPolicyDefinition.builder(PolicyType.FILTER, operations)
                .through(relationshipPath, endConditions);
    }

    /** Rows are hidden when the relationship exists. */
    public static ReBAcPolicyDefinition.Builder denyRelation(String relationshipPath, EndConditions endConditions,
                                                            Operation... operations) {
        return ReBAcPolicyDefinition.builder(PolicyType.FILTER, operations)
                .through(relationshipPath, endConditions)
                .negated(true)
                .priority(DENY_RELATION_PRIORITY);
    }

    /** Grants the operations outright (typically combined with an activation condition). */
    public static ReBAcPolicyDefinition.Builder allow(Operation... operations) {
        return ReBAcPolicyDefinition.builder(PolicyType.ALLOW, operations);
    }

    /** Denies the operations outright (typically combined with an activation condition). */
    public static ReBAcPolicyDefinition.Builder deny(Operation... operations) {
        return ReBAcPolicyDefinition.builder(PolicyType.DENY, operations);
    }
}
