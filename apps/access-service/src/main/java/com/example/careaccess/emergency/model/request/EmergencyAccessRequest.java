package com.example.careaccess.emergency.model.request;

import lombok.Builder;

/**
 * Break-glass request payload. Enumerated fields arrive as strings so that unrecognized values
 * are rejected and audited by the monitor rather than by request binding.
 */
@Builder(toBuilder = true)
public record EmergencyAccessRequest(
        String userId,
        String accessType,
        String emergencyLevel,
        String justification,
        String resourceAccessed,
        String requestedBy,
        String supervisorId,
        String patientId,
        String sessionId
) {
}
