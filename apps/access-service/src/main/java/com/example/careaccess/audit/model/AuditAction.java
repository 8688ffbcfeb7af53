package com.example.careaccess.audit.model;

public enum AuditAction {
    ACCESS_DECISION,
    EMERGENCY_ACCESS_REQUESTED,
    EMERGENCY_ACCESS_REVOKED,
    EMERGENCY_ACCESS_EXPIRED,
    CONSENT_GRANTED,
    CONSENT_REVOKED,
    COMPLIANCE_ALERT_RESOLVED
}
