package com.warden.authz.field;

import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Rules for common field protection patterns.
 */
public final class FieldRules {

    /** Owner column assumed when none is given. */
    public static final String DEFAULT_OWNER_FIELD = "id";

    private FieldRules() {
        // utility class
    }

    /** Never readable or writable; omitted from results. */
    public static FieldAccessRule neverAccessible() {
        return FieldAccessRule.of(FieldCondition.never(), FieldCondition.never()).omittedWhenHidden();
    }

    /** Readable and writable only when the row's {@code ownerField} is the caller. */
    public static FieldAccessRule ownerOnly(String ownerField) {
        FieldCondition owner = ctx -> ctx.isOwner(ownerField);
        return FieldAccessRule.of(owner, owner);
    }

    public static FieldAccessRule ownerOnly() {
        return ownerOnly(DEFAULT_OWNER_FIELD);
    }

    /** Readable and writable by the owner or holders of any of {@code roles}. */
    public static FieldAccessRule ownerOrRoles(Set<String> roles, String ownerField) {
        FieldCondition condition = ((FieldCondition) ctx -> ctx.isOwner(ownerField)).or(anyRole(roles));
        return FieldAccessRule.of(condition, condition);
    }

    public static FieldAccessRule ownerOrRoles(Set<String> roles) {
        return ownerOrRoles(roles, DEFAULT_OWNER_FIELD);
    }

    /** Readable and writable only by holders of any of {@code roles}. */
    public static FieldAccessRule rolesOnly(Set<String> roles) {
        FieldCondition condition = anyRole(roles);
        return FieldAccessRule.of(condition, condition);
    }

    /** Never writable; readable when {@code readCondition} holds. */
    public static FieldAccessRule readOnly(FieldCondition readCondition) {
        return FieldAccessRule.of(readCondition, FieldCondition.never());
    }

    /** Never writable; always readable. */
    public static FieldAccessRule readOnly() {
        return readOnly(FieldCondition.always());
    }

    /** Always readable; writable when {@code writeCondition} holds. */
    public static FieldAccessRule publicReadRestrictedWrite(FieldCondition writeCondition) {
        return FieldAccessRule.of(FieldCondition.always(), writeCondition);
    }

    /**
     * Readable and writable when {@code readCondition} holds; other callers see
     * {@code maskFunction(value)}, e.g. the last four digits of a card number.
     */
    public static FieldAccessRule masked(UnaryOperator<Object> maskFunction, FieldCondition readCondition) {
        return FieldAccessRule.of(readCondition, readCondition).withMaskFunction(maskFunction);
    }

    private static FieldCondition anyRole(Set<String> roles) {
        Set<String> wanted = Set.copyOf(roles);
        return ctx -> ctx.auth().hasAnyRole(wanted);
    }
}
