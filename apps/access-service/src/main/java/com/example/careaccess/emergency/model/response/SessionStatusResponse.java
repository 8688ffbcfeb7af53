package com.example.careaccess.emergency.model.response;

import com.example.careaccess.emergency.model.EmergencyAccessType;
import com.example.careaccess.emergency.model.EmergencyLevel;

import java.time.Instant;
import java.util.List;

public record SessionStatusResponse(
        String requestId,
        String userId,
        boolean active,
        Instant expiresAt,
        long remainingSeconds,
        EmergencyLevel emergencyLevel,
        EmergencyAccessType accessType,
        List<String> restrictions
) {
}
