package com.warden.context;

/**
 * Request metadata carried alongside the authorization identity.
 *
 * @param requestId unique ID of the inbound request (nullable)
 * @param ipAddress client address as seen by the service (nullable)
 * @param userAgent client user agent (nullable)
 */
public record RequestMeta(String requestId, String ipAddress, String userAgent) {

    /** Creates request metadata carrying only a request ID. */
    public static RequestMeta of(String requestId) {
        return new RequestMeta(requestId, null, null);
    }
}
