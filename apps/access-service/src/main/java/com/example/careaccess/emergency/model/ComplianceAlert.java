package com.example.careaccess.emergency.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * Alert raised while evaluating an emergency grant. Alerts are never raised outside grant
 * evaluation; they may be resolved once.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComplianceAlert(
        String id,
        String requestId,
        String userId,
        String resourceAccessed,
        AlertType type,
        AlertSeverity severity,
        String message,
        Instant triggeredAt,
        boolean actionRequired,
        Instant resolvedAt,
        String resolvedBy
) {
    public boolean isResolved() {
        return resolvedAt != null;
    }

    public ComplianceAlert resolve(String by, Instant at) {
        return toBuilder().resolvedAt(at).resolvedBy(by).build();
    }
}
