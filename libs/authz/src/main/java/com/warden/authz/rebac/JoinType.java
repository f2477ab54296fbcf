package com.warden.authz.rebac;

/**
 * Join used to connect one relationship step to the previous one.
 */
public enum JoinType {
    INNER,
    LEFT,
    RIGHT
}
