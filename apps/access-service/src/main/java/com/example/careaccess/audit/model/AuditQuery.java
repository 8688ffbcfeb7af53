package com.example.careaccess.audit.model;

import lombok.Builder;
import org.springframework.lang.NonNull;

import java.time.Instant;

/**
 * Audit trail filter. Null fields match everything; results are newest first.
 */
@Builder(toBuilder = true)
public record AuditQuery(
        String userId,
        AuditAction action,
        String requestId,
        String subjectId,
        String resource,
        Boolean granted,
        boolean phiOnly,
        Instant from,
        Instant to,
        int page,
        int size
) {
    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }

    public boolean matches(@NonNull AuditEntry entry) {
        if (userId != null && !userId.equals(entry.userId())) {
            return false;
        }
        if (action != null && action != entry.action()) {
            return false;
        }
        if (requestId != null && !requestId.equals(entry.requestId())) {
            return false;
        }
        if (subjectId != null && !subjectId.equals(entry.subjectId())) {
            return false;
        }
        if (resource != null && !resource.equals(entry.resource())) {
            return false;
        }
        if (granted != null && granted != entry.granted()) {
            return false;
        }
        if (phiOnly && !entry.phi()) {
            return false;
        }
        if (from != null && entry.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || entry.timestamp().isBefore(to);
    }

    public long offset() {
        return (long) Math.max(page, 0) * size;
    }
}
