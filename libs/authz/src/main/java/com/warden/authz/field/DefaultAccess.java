package com.warden.authz.field;

/**
 * Access granted to fields without a rule.
 */
public enum DefaultAccess {
    ALLOW,
    /** Unconfigured fields are omitted on reads and rejected on writes. */
    DENY
}
