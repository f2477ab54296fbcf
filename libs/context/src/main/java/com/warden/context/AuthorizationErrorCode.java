package com.warden.context;

/**
 * Machine-readable codes carried by every {@link AuthorizationException}.
 */
public enum AuthorizationErrorCode {

    /** No authorization context is bound to the current operation. */
    CONTEXT_MISSING,

    /** The authorization context is malformed. */
    CONTEXT_INVALID,

    /** A registration (resolver graph, relationship path, policy) is invalid. */
    SCHEMA_INVALID,

    /** An operation was rejected by a policy. */
    POLICY_VIOLATION,

    /** A policy could not be evaluated. */
    POLICY_EVALUATION_ERROR,

    /** A required context resolver failed or timed out. */
    RESOLVER_FAILED
}
