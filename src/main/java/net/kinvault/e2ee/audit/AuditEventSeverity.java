package net.kinvault.e2ee.audit;

public enum AuditEventSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO
}
