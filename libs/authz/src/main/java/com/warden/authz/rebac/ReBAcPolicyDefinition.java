package com.warden.authz.rebac;

import com.warden.context.Operation;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Declaration of a row-level policy, before compilation.
 * <p>
 * {@code FILTER} policies need a relationship path and end conditions; {@code ALLOW} and
 * {@code DENY} policies may omit both. A negated filter keeps only rows for which the
 * relationship does <em>not</em> exist.
 *
 * @param name             policy name (null to derive one from the table and position)
 * @param type             allow, deny or filter
 * @param operations       operations the policy covers; {@code ALL} stands for all four
 * @param relationshipPath name of the path, resolved in the table first and then globally
 * @param endConditions    constraints at the end of the path
 * @param priority         higher priorities are evaluated first
 * @param negated          for filters, whether the relationship must be absent
 * @param activeWhen       activation condition; inactive policies are skipped (null means always)
 */
public record ReBAcPolicyDefinition(
        String name,
        PolicyType type,
        Set<Operation> operations,
        String relationshipPath,
        EndConditions endConditions,
        int priority,
        boolean negated,
        Predicate<PolicyEvaluationContext> activeWhen
) {

    public ReBAcPolicyDefinition {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("operations must not be null or empty");
        }
        operations = Set.copyOf(operations);
    }

    public static Builder builder(PolicyType type, Operation... operations) {
        return new Builder(type, operations);
    }

    /**
     * Builder for {@link ReBAcPolicyDefinition}.
     */
    public static final class Builder {

        private final PolicyType type;
        private final Set<Operation> operations;
        private String name;
        private String relationshipPath;
        private EndConditions endConditions;
        private int priority;
        private boolean negated;
        private Predicate<PolicyEvaluationContext> activeWhen;

        private Builder(PolicyType type, Operation... operations) {
            this.type = type;
            this.operations = operations.length == 0
                    ? EnumSet.noneOf(Operation.class)
                    : EnumSet.copyOf(Arrays.asList(operations));
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder through(String relationshipPath, EndConditions endConditions) {
            this.relationshipPath = relationshipPath;
            this.endConditions = endConditions;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder negated(boolean negated) {
            this.negated = negated;
            return this;
        }

        /** Adds an activation condition; several conditions must all hold. */
        public Builder activeWhen(Predicate<PolicyEvaluationContext> condition) {
            this.activeWhen = activeWhen == null ? condition : activeWhen.and(condition);
            return this;
        }

        public ReBAcPolicyDefinition build() {
            return new ReBAcPolicyDefinition(name, type, operations, relationshipPath, endConditions,
                    priority, negated, activeWhen);
        }
    }
}
