package com.example.careaccess.access.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Outcome of an access check. Persisted only through the audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessDecision(
        boolean granted,
        AccessBasis basis,
        String reason,
        String consentId,
        String ruleId,
        Instant timestamp
) {
    public static AccessDecision denied(String ruleId, String reason, Instant at) {
        return new AccessDecision(false, AccessBasis.DENIED, reason, null, ruleId, at);
    }
}
