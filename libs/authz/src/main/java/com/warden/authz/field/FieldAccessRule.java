package com.warden.authz.field;

import java.util.function.UnaryOperator;

/**
 * Read/write rule for one field.
 * <p>
 * When {@code canRead} fails the field is omitted if {@code omitWhenHidden} is set, otherwise
 * its value is replaced by {@code maskFunction(value)} when a mask function is given, or by
 * {@code maskedValue}.
 *
 * @param canRead        read condition (null means always)
 * @param canWrite       write condition (null means always)
 * @param maskedValue    replacement for unreadable values
 * @param omitWhenHidden whether unreadable fields are removed instead of masked
 * @param maskFunction   computes the replacement from the real value (nullable)
 */
public record FieldAccessRule(
        FieldCondition canRead,
        FieldCondition canWrite,
        Object maskedValue,
        boolean omitWhenHidden,
        UnaryOperator<Object> maskFunction
) {

    public FieldAccessRule {
        if (canRead == null) {
            canRead = FieldCondition.always();
        }
        if (canWrite == null) {
            canWrite = FieldCondition.always();
        }
    }

    public static FieldAccessRule of(FieldCondition canRead, FieldCondition canWrite) {
        return new FieldAccessRule(canRead, canWrite, null, false, null);
    }

    public FieldAccessRule withMaskedValue(Object maskedValue) {
        return new FieldAccessRule(canRead, canWrite, maskedValue, omitWhenHidden, maskFunction);
    }

    public FieldAccessRule omittedWhenHidden() {
        return new FieldAccessRule(canRead, canWrite, maskedValue, true, maskFunction);
    }

    public FieldAccessRule withMaskFunction(UnaryOperator<Object> maskFunction) {
        return new FieldAccessRule(canRead, canWrite, maskedValue, omitWhenHidden, maskFunction);
    }

    /** The value shown to a caller who may not read the field. */
    Object mask(Object value, Object fallback) {
        if (maskFunction != null) {
            return maskFunction.apply(value);
        }
        return maskedValue != null ? maskedValue : fallback;
    }
}
