package com.warden.audit;

import java.util.List;

/**
 * Receives adapter failures together with the events that could not be written.
 */
@FunctionalInterface
public interface AuditErrorHandler {

    void onError(Throwable error, List<AuditEvent> events);
}
