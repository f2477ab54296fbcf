package com.warden.authz.rebac;

import com.warden.context.AuthorizationContext;
import com.warden.context.Operation;
import com.warden.context.ResolvedContext;

import java.time.Instant;

/**
 * What a policy sees when its activation condition or end conditions are evaluated.
 *
 * @param auth      the caller's authorization context
 * @param table     the table being accessed
 * @param operation the concrete operation
 * @param timestamp evaluation time
 */
public record PolicyEvaluationContext(
        AuthorizationContext auth,
        String table,
        Operation operation,
        Instant timestamp
) {

    public String userId() {
        return auth.userId();
    }

    public ResolvedContext resolved() {
        return auth.resolved();
    }
}
