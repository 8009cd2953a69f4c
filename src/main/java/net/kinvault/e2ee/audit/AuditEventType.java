package net.kinvault.e2ee.audit;

/**
 * Security-relevant events reported by the engine, each with a default severity.
 */
public enum AuditEventType {
    /**
     * Identity, pre-key or rotating key generated, rotated or exported.
     */
    ENCRYPTION_KEY_USAGE(AuditEventSeverity.HIGH),
    /**
     * Tampered or replayed messages, invalid peer bundles, identity changes.
     */
    SECURITY_INCIDENT(AuditEventSeverity.CRITICAL),
    /**
     * Device registered, session established or removed.
     */
    DEVICE_MANAGEMENT(AuditEventSeverity.MEDIUM),
    /**
     * Encryption reset for a peer or session imported from a backup.
     */
    DATA_MODIFICATION(AuditEventSeverity.MEDIUM);

    private final AuditEventSeverity defaultSeverity;

    AuditEventType(AuditEventSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public AuditEventSeverity getDefaultSeverity() {
        return defaultSeverity;
    }
}
