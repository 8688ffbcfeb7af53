package com.example.careaccess.access.model.request;

import java.util.List;

/**
 * Access check payload. The actor is the authenticated caller; {@code actorId}, if supplied, must match it.
 * Field validation happens in the service so that rejected requests are audited too.
 */
public record AccessCheckRequest(
        String actorId,
        String subjectId,
        String purpose,
        List<String> requestedDataTypes,
        String emergencyJustification
) {
}
