package com.example.careaccess.access.model;

import com.example.careaccess.rbac.Role;
import lombok.Builder;

import java.util.Set;

/**
 * One access request as seen by the decision engine. Ephemeral; never persisted directly.
 */
@Builder
public record AccessRequest(
        String actorId,
        Role actorRole,
        String subjectId,
        AccessPurpose purpose,
        Set<String> requestedDataTypes,
        String emergencyJustification
) {
    public AccessRequest {
        requestedDataTypes = requestedDataTypes != null ? Set.copyOf(requestedDataTypes) : Set.of();
    }

    public boolean isSelfAccess() {
        return actorId != null && actorId.equals(subjectId);
    }

    public boolean hasEmergencyJustification() {
        return emergencyJustification != null && !emergencyJustification.isBlank();
    }
}
