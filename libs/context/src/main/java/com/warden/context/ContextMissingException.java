package com.warden.context;

/**
 * Thrown when an operation that needs an authorization context runs outside of an
 * {@link AuthorizationScope}.
 */
public class ContextMissingException extends AuthorizationException {

    public ContextMissingException() {
        this("No authorization context bound. Run the operation inside AuthorizationScope.run()");
    }

    public ContextMissingException(String message) {
        super(message, AuthorizationErrorCode.CONTEXT_MISSING);
    }
}
