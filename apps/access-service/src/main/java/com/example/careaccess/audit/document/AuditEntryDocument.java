package com.example.careaccess.audit.document;

import com.example.careaccess.audit.model.AuditAction;
import com.example.careaccess.audit.model.AuditEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "access_audit")
@CompoundIndex(name = "user_time_idx", def = "{'userId': 1, 'timestamp': -1}")
public class AuditEntryDocument {

    @Id
    private String id;

    @Indexed
    private String requestId;

    private String userId;
    private String actorRole;
    private String subjectId;
    private AuditAction action;
    private String resource;
    private boolean granted;
    private String basis;
    private String reason;
    private boolean phi;
    private List<String> alerts;
    private Map<String, Object> details;

    @Indexed
    private Instant timestamp;

    private Instant resolvedAt;

    public static AuditEntryDocument from(AuditEntry entry) {
        return AuditEntryDocument.builder()
                .id(entry.id())
                .requestId(entry.requestId())
                .userId(entry.userId())
                .actorRole(entry.actorRole())
                .subjectId(entry.subjectId())
                .action(entry.action())
                .resource(entry.resource())
                .granted(entry.granted())
                .basis(entry.basis())
                .reason(entry.reason())
                .phi(entry.phi())
                .alerts(entry.alerts())
                .details(entry.details())
                .timestamp(entry.timestamp())
                .resolvedAt(entry.resolvedAt())
                .build();
    }

    public AuditEntry toEntry() {
        return AuditEntry.builder()
                .id(id)
                .requestId(requestId)
                .userId(userId)
                .actorRole(actorRole)
                .subjectId(subjectId)
                .action(action)
                .resource(resource)
                .granted(granted)
                .basis(basis)
                .reason(reason)
                .phi(phi)
                .alerts(alerts)
                .details(details)
                .timestamp(timestamp)
                .resolvedAt(resolvedAt)
                .build();
    }
}
