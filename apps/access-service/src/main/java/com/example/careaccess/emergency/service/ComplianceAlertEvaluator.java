package com.example.careaccess.emergency.service;

import com.example.careaccess.config.properties.EmergencyAccessProperties;
import com.example.careaccess.emergency.model.AlertSeverity;
import com.example.careaccess.emergency.model.AlertType;
import com.example.careaccess.emergency.model.ComplianceAlert;
import com.example.careaccess.emergency.model.EmergencyGrant;
import com.example.careaccess.emergency.model.EmergencyLevel;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Alert rules applied once, when a grant is issued.
 */
@Component
public class ComplianceAlertEvaluator {

    private final int maxConcurrentSessions;
    private final int suspiciousAccessThreshold;

    public ComplianceAlertEvaluator(EmergencyAccessProperties properties) {
        this.maxConcurrentSessions = properties.maxConcurrentSessions();
        this.suspiciousAccessThreshold = properties.suspiciousAccessThreshold();
    }

    /**
     * @param grant                  the grant being issued
     * @param concurrentSessions     the user's active sessions, counting this grant
     * @param priorRequestsInWindow  earlier requests by the same user for the same resource within the pattern window
     */
    @NonNull
    public List<ComplianceAlert> evaluate(@NonNull EmergencyGrant grant, int concurrentSessions,
                                          int priorRequestsInWindow, @NonNull Instant now) {
        List<ComplianceAlert> alerts = new ArrayList<>();

        if (concurrentSessions > maxConcurrentSessions) {
            alerts.add(alert(grant, AlertType.MULTIPLE_CONCURRENT_EMERGENCY_ACCESS, AlertSeverity.HIGH,
                    String.format("User %s has %d concurrent emergency access sessions",
                            grant.userId(), concurrentSessions), now));
        }

        if (grant.level() == EmergencyLevel.CRITICAL
                && (grant.supervisorId() == null || grant.supervisorId().isBlank())) {
            alerts.add(alert(grant, AlertType.CRITICAL_ACCESS_NO_SUPERVISOR, AlertSeverity.CRITICAL,
                    "Critical emergency access requested without supervisor identification", now));
        }

        if (priorRequestsInWindow > suspiciousAccessThreshold) {
            alerts.add(alert(grant, AlertType.SUSPICIOUS_ACCESS_PATTERN, AlertSeverity.MODERATE,
                    String.format("User %s accessed resource %s %d times in past hour",
                            grant.userId(), grant.resourceAccessed(), priorRequestsInWindow), now));
        }

        return alerts;
    }

    private static ComplianceAlert alert(EmergencyGrant grant, AlertType type, AlertSeverity severity,
                                         String message, Instant now) {
        return ComplianceAlert.builder()
                .id(UUID.randomUUID().toString())
                .requestId(grant.requestId())
                .userId(grant.userId())
                .resourceAccessed(grant.resourceAccessed())
                .type(type)
                .severity(severity)
                .message(message)
                .triggeredAt(now)
                .actionRequired(severity.requiresAction())
                .build();
    }
}
