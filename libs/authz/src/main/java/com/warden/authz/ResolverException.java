package com.warden.authz;

import com.warden.context.AuthorizationErrorCode;
import com.warden.context.AuthorizationException;

/**
 * Thrown when a required context resolver fails or times out.
 */
public class ResolverException extends AuthorizationException {

    private final String resolverName;
    private final boolean timedOut;

    public ResolverException(String resolverName, String message, boolean timedOut, Throwable cause) {
        super(message, AuthorizationErrorCode.RESOLVER_FAILED, cause);
        this.resolverName = resolverName;
        this.timedOut = timedOut;
    }

    public String resolverName() {
        return resolverName;
    }

    /** Whether the resolver exceeded the configured timeout. */
    public boolean timedOut() {
        return timedOut;
    }
}
