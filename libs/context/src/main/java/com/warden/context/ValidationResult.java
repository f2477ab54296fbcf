package com.warden.context;

import java.util.List;

/**
 * Result of validating an {@link AuthorizationContext}: either valid (no errors) or invalid
 * with every error found.
 *
 * @param valid  whether the context passed all checks
 * @param errors validation error messages (empty if valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * Throws {@link ContextValidationException} if this result is invalid.
     */
    public void throwIfInvalid() {
        if (!valid) {
            throw new ContextValidationException(errors);
        }
    }
}
