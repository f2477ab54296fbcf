package com.warden.authz.rebac;

import java.util.Map;

/**
 * Computes the column constraints applied at the target end of a relationship path, e.g.
 * {@code Map.of("user_id", ctx.userId())}. A null value means IS NULL, a collection means IN,
 * and {@link java.util.Optional#empty()} leaves the column unconstrained.
 */
@FunctionalInterface
public interface EndConditions {

    Map<String, Object> apply(PolicyEvaluationContext ctx);

    /** End conditions that do not depend on the caller. */
    static EndConditions constant(Map<String, Object> conditions) {
        return ctx -> conditions;
    }
}
