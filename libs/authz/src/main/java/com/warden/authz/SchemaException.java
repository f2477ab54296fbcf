package com.warden.authz;

import com.warden.context.AuthorizationErrorCode;
import com.warden.context.AuthorizationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a registration is structurally invalid: a resolver cycle, a broken relationship
 * chain, an unknown relationship or a duplicate name. Raised eagerly, at registration or at
 * graph validation, never per row.
 */
public class SchemaException extends AuthorizationException {

    private final Map<String, Object> details;

    public SchemaException(String message) {
        this(message, Map.of());
    }

    public SchemaException(String message, Map<String, Object> details) {
        super(message, AuthorizationErrorCode.SCHEMA_INVALID);
        this.details = details == null ? Map.of() : new LinkedHashMap<>(details);
    }

    /** Structured details about the offending registration (names, indexes). */
    public Map<String, Object> details() {
        return Map.copyOf(details);
    }
}
