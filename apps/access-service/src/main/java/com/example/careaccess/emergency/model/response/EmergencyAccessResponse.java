package com.example.careaccess.emergency.model.response;

import com.example.careaccess.emergency.model.EmergencyAccessType;
import com.example.careaccess.emergency.model.EmergencyLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmergencyAccessResponse(
        String requestId,
        boolean accessGranted,
        EmergencyLevel emergencyLevel,
        EmergencyAccessType accessType,
        Instant grantedAt,
        Instant expiresAt,
        String accessToken,
        List<String> restrictions,
        String auditTrailId,
        String complianceStatus,
        List<String> alertsTriggered,
        boolean supervisorNotified,
        List<String> errors
) {
    public static final String GRANTED_WITH_MONITORING = "granted_with_monitoring";
    public static final String GRANTED_WITH_ALERTS = "granted_with_alerts";
    public static final String REJECTED_INVALID_REQUEST = "rejected_invalid_request";
}
