package com.warden.authz.field;

/**
 * Decides whether the caller may read or write a field.
 */
@FunctionalInterface
public interface FieldCondition {

    boolean test(FieldEvaluationContext ctx);

    static FieldCondition always() {
        return ctx -> true;
    }

    static FieldCondition never() {
        return ctx -> false;
    }

    default FieldCondition or(FieldCondition other) {
        return ctx -> test(ctx) || other.test(ctx);
    }

    default FieldCondition and(FieldCondition other) {
        return ctx -> test(ctx) && other.test(ctx);
    }
}
