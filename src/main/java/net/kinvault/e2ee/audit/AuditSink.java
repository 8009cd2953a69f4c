package net.kinvault.e2ee.audit;

import java.util.Map;

/**
 * Destination for audit events, supplied by the embedding application.
 */
public interface AuditSink {
    AuditSink NONE = (type, description, metadata) -> {};

    void logEvent(AuditEventType type, String description, Map<String, Object> metadata);
}
