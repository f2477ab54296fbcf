package com.warden.authz.rebac;

/**
 * Kind of a row-level policy.
 */
public enum PolicyType {
    /** Grants the operation unconditionally and ends evaluation. */
    ALLOW,
    /** Denies the operation and ends evaluation. */
    DENY,
    /** Restricts the operation to rows related through the policy's relationship path. */
    FILTER
}
