package net.kinvault.e2ee.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Forwards events to an {@link AuditSink}. Sink failures are logged and never propagate to the caller.
 */
public class AuditLogger {
    private final static Logger logger = LoggerFactory.getLogger(AuditLogger.class);

    private final AuditSink sink;
    private final Executor executor;

    public AuditLogger(AuditSink sink) {
        this(sink, Runnable::run);
    }

    public AuditLogger(AuditSink sink, Executor executor) {
        this.sink = sink;
        this.executor = executor;
    }

    public void log(AuditEventType type, String description) {
        log(type, description, Collections.emptyMap());
    }

    public void log(AuditEventType type, String description, Map<String, Object> metadata) {
        Map<String, Object> event = new LinkedHashMap<>(metadata);
        event.putIfAbsent("severity", type.getDefaultSeverity().name());
        Map<String, Object> immutableEvent = Collections.unmodifiableMap(event);
        try {
            executor.execute(() -> deliver(type, description, immutableEvent));
        } catch (RejectedExecutionException e) {
            logger.warn("Audit event {} dropped: {}", type, e.getMessage());
        }
    }

    /**
     * Convenience for integrity failures, always reported as {@link AuditEventType#SECURITY_INCIDENT}.
     */
    public void securityWarning(String description, String sessionId, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", sessionId);
        metadata.put("reason", reason);
        log(AuditEventType.SECURITY_INCIDENT, description, metadata);
    }

    private void deliver(AuditEventType type, String description, Map<String, Object> metadata) {
        try {
            sink.logEvent(type, description, metadata);
        } catch (RuntimeException e) {
            logger.warn("Audit sink failed for {} event: {}", type, e.getMessage());
            logger.debug("Audit sink failure", e);
        }
    }
}
