package com.warden.authz.field;

import com.warden.context.AuthorizationContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a field condition sees.
 *
 * @param auth  the caller's authorization context
 * @param table the table the row belongs to
 * @param row   the stored row (the existing row on writes; empty when unknown)
 * @param data  the incoming values on writes (empty on reads)
 */
public record FieldEvaluationContext(
        AuthorizationContext auth,
        String table,
        Map<String, Object> row,
        Map<String, Object> data
) {

    public FieldEvaluationContext {
        row = row == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(row));
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public String userId() {
        return auth.userId();
    }

    /** Whether the row's {@code ownerField} holds the caller's user ID, compared as strings. */
    public boolean isOwner(String ownerField) {
        Object owner = row.get(ownerField);
        return owner != null && Objects.equals(String.valueOf(owner), auth.userId());
    }
}
