package com.warden.authz.rebac;

import com.warden.context.AuthorizationContext;
import com.warden.context.AuthorizationScope;
import com.warden.context.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the compiled policies of a table for one operation.
 * <p>
 * Policies are visited in priority order, skipping inactive ones. A deny policy ends
 * evaluation with a denial. An allow policy ends evaluation too: the result is an allow, or
 * the filters already collected from higher-priority policies when there are any. Filter
 * policies accumulate and are combined with AND. A configured table where no active policy
 * covers the operation is denied. Failures while evaluating a policy deny as well.
 */
public final class ReBAcEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReBAcEvaluator.class);

    private final RelationshipRegistry registry;
    private final Clock clock;

    public ReBAcEvaluator(RelationshipRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public ReBAcEvaluator(RelationshipRegistry registry, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Evaluates against the context bound to {@link AuthorizationScope}.
     *
     * @throws com.warden.context.ContextMissingException if no context is bound
     */
    public PolicyDecision evaluate(String table, Operation operation) {
        return evaluate(AuthorizationScope.require(), table, operation);
    }

    public PolicyDecision evaluate(AuthorizationContext ctx, String table, Operation operation) {
        if (operation == null || operation == Operation.ALL) {
            throw new IllegalArgumentException("operation must be a concrete operation");
        }
        if (ctx.system() || !registry.hasTable(table)) {
            return PolicyDecision.untouched();
        }

        var evaluationContext = new PolicyEvaluationContext(ctx, table, operation, clock.instant());
        List<RowFilter> filters = new ArrayList<>();
        for (CompiledPolicy policy : registry.getPolicies(table, operation)) {
            try {
                if (!policy.isActive(evaluationContext)) {
                    continue;
                }
                switch (policy.type()) {
                    case DENY -> {
                        return new PolicyDecision.Deny(policy.name(), "denied by policy " + policy.name());
                    }
                    case ALLOW -> {
                        return filters.isEmpty()
                                ? new PolicyDecision.Allow(policy.name())
                                : new PolicyDecision.Filter(filters);
                    }
                    case FILTER -> filters.add(toRowFilter(policy, evaluationContext));
                }
            } catch (RuntimeException e) {
                log.error("Evaluation of policy '{}' on '{}' failed; denying", policy.name(), table, e);
                return new PolicyDecision.Deny(policy.name(), "policy evaluation failed: " + e.getMessage());
            }
        }

        if (filters.isEmpty()) {
            log.debug("No active policy covers {} on '{}'; denying", operation.value(), table);
            return new PolicyDecision.Deny(null, "no policy allows " + operation.value() + " on " + table);
        }
        return new PolicyDecision.Filter(filters);
    }

    private static RowFilter toRowFilter(CompiledPolicy policy, PolicyEvaluationContext ctx) {
        Map<String, Object> conditions = policy.endConditions().apply(ctx);
        return new RowFilter(policy.name(), policy.relationshipPath(), conditions, policy.negated());
    }
}
