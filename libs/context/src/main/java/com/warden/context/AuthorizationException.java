package com.warden.context;

/**
 * Base class of all authorization failures.
 */
public class AuthorizationException extends RuntimeException {

    private final AuthorizationErrorCode code;

    public AuthorizationException(String message, AuthorizationErrorCode code) {
        super(message);
        this.code = code;
    }

    public AuthorizationException(String message, AuthorizationErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AuthorizationErrorCode code() {
        return code;
    }
}
