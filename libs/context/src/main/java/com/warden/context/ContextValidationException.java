package com.warden.context;

import java.util.List;

/**
 * Thrown when a base authorization context fails validation.
 */
public class ContextValidationException extends AuthorizationException {

    private final List<String> errors;

    public ContextValidationException(List<String> errors) {
        super("Invalid authorization context: " + String.join("; ", errors),
                AuthorizationErrorCode.CONTEXT_INVALID);
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
