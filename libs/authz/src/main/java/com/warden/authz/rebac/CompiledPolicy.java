package com.warden.authz.rebac;

import com.warden.context.Operation;

import java.util.Set;
import java.util.function.Predicate;

/**
 * A row-level policy ready for evaluation.
 *
 * @param name             policy name
 * @param type             allow, deny or filter
 * @param operations       concrete operations covered ({@code ALL} already expanded)
 * @param relationshipPath resolved path (null for allow/deny policies declared without one)
 * @param endConditions    constraints at the end of the path (null when there is no path)
 * @param priority         evaluation priority
 * @param negated          whether a filter requires the relationship to be absent
 * @param activeWhen       activation condition (null means always active)
 */
public record CompiledPolicy(
        String name,
        PolicyType type,
        Set<Operation> operations,
        CompiledRelationshipPath relationshipPath,
        EndConditions endConditions,
        int priority,
        boolean negated,
        Predicate<PolicyEvaluationContext> activeWhen
) {

    public boolean appliesTo(Operation operation) {
        return operations.contains(operation);
    }

    public boolean isActive(PolicyEvaluationContext ctx) {
        return activeWhen == null || activeWhen.test(ctx);
    }
}
