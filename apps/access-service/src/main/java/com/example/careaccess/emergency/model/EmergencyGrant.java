package com.example.careaccess.emergency.model;

import lombok.Builder;
import org.springframework.lang.NonNull;

import java.time.Instant;
import java.util.List;

/**
 * An issued break-glass grant. Lives in the active-session table until it expires or is revoked;
 * its history survives in the audit trail.
 */
@Builder(toBuilder = true)
public record EmergencyGrant(
        String requestId,
        String userId,
        EmergencyAccessType accessType,
        EmergencyLevel level,
        String justification,
        String resourceAccessed,
        String requestedBy,
        String supervisorId,
        String patientId,
        Instant grantedAt,
        Instant expiresAt,
        List<String> restrictions,
        String accessToken,
        List<String> alertsTriggered,
        boolean supervisorNotified,
        String auditEntryId
) {
    public EmergencyGrant {
        restrictions = restrictions != null ? List.copyOf(restrictions) : List.of();
        alertsTriggered = alertsTriggered != null ? List.copyOf(alertsTriggered) : List.of();
    }

    /**
     * Active purely by wall clock, independent of whether the sweeper has run.
     */
    public boolean isActiveAt(@NonNull Instant now) {
        return now.isBefore(expiresAt);
    }
}
