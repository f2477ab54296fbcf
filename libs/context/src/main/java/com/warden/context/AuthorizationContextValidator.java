package com.warden.context;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates that an {@link AuthorizationContext} carries the fields policies rely on.
 */
public final class AuthorizationContextValidator {

    private AuthorizationContextValidator() {
        // utility class
    }

    /**
     * Validates the context and returns every error found.
     *
     * @param context the context to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(AuthorizationContext context) {
        if (context == null) {
            return ValidationResult.fail(List.of("context must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(context.userId())) {
            errors.add("userId must not be null or blank");
        }
        if (context.tenantId() != null && context.tenantId().isBlank()) {
            errors.add("tenantId must not be blank when present");
        }
        for (String role : context.roles()) {
            if (isBlank(role)) {
                errors.add("roles must not contain null or blank entries");
                break;
            }
        }
        if (context.requestMeta() != null
                && context.requestMeta().requestId() != null
                && context.requestMeta().requestId().isBlank()) {
            errors.add("requestMeta.requestId must not be blank when present");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
