package com.example.careaccess.audit.model;

import lombok.Builder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable audit record. Once appended, only {@code resolvedAt} may change, and only once.
 */
@Builder(toBuilder = true)
public record AuditEntry(
        String id,
        String requestId,
        String userId,
        String actorRole,
        String subjectId,
        AuditAction action,
        String resource,
        boolean granted,
        String basis,
        String reason,
        boolean phi,
        List<String> alerts,
        Map<String, Object> details,
        Instant timestamp,
        Instant resolvedAt
) {
    public AuditEntry {
        alerts = alerts != null ? List.copyOf(alerts) : List.of();
        details = details == null ? Map.of() : details.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public AuditEntry withResolvedAt(Instant at) {
        return toBuilder().resolvedAt(at).build();
    }

    /**
     * Converts the entry to a flat map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("event_type", "access_audit");
        log.put("entry_id", id);
        log.put("timestamp", timestamp != null ? timestamp.toString() : "");
        log.put("action", action != null ? action.name() : "");
        log.put("request_id", requestId != null ? requestId : "");
        log.put("user_id", userId != null ? userId : "");
        log.put("actor_role", actorRole != null ? actorRole : "");
        log.put("subject_id", subjectId != null ? subjectId : "");
        log.put("resource", resource != null ? resource : "");
        log.put("granted", granted);
        log.put("basis", basis != null ? basis : "");
        log.put("reason", reason != null ? reason : "");
        log.put("phi", phi);
        log.put("alerts", alerts);
        log.put("details", details);
        return log;
    }
}
