package com.example.careaccess.access.service;

import com.example.careaccess.access.engine.AccessDecisionEngine;
import com.example.careaccess.access.model.AccessBasis;
import com.example.careaccess.access.model.AccessDecision;
import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.model.request.AccessCheckRequest;
import com.example.careaccess.audit.model.AuditAction;
import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.service.AuditTrail;
import com.example.careaccess.common.exception.ValidationException;
import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.observability.metrics.AccessMetrics;
import com.example.careaccess.rbac.Permission;
import com.example.careaccess.rbac.PermissionRegistry;
import com.example.careaccess.security.context.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entry point for access checks: validates the request, runs the decision engine and writes
 * exactly one audit entry per request, rejected requests included.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessDecisionService {

    private final AccessDecisionEngine engine;
    private final AuditTrail auditTrail;
    private final PermissionRegistry permissionRegistry;
    private final AccessMetrics metrics;

    public Mono<AccessDecision> checkAccess(@NonNull CallerContext caller, @NonNull AccessCheckRequest body) {
        List<String> errors = validate(caller, body);
        if (!errors.isEmpty()) {
            return auditRejected(caller, body, errors)
                    .then(Mono.error(new ValidationException(errors)));
        }

        AccessRequest request = AccessRequest.builder()
                .actorId(caller.userId())
                .actorRole(caller.role())
                .subjectId(body.subjectId().trim())
                .purpose(AccessPurpose.fromValue(body.purpose().trim()))
                .requestedDataTypes(normalizeDataTypes(body.requestedDataTypes()))
                .emergencyJustification(body.emergencyJustification())
                .build();

        return checkAccess(request);
    }

    /**
     * Decides an already-validated request and audits the decision. Fails with
     * {@link com.example.careaccess.audit.exception.AuditPersistenceException} if the decision
     * cannot be recorded.
     */
    public Mono<AccessDecision> checkAccess(@NonNull AccessRequest request) {
        return engine.checkAccess(request)
                .flatMap(decision -> auditTrail.append(toAuditEntry(request, decision))
                        .doOnNext(entry -> metrics.recordDecision(decision.basis()))
                        .thenReturn(decision));
    }

    private AuditEntry toAuditEntry(AccessRequest request, AccessDecision decision) {
        Map<String, Object> details = new HashMap<>();
        details.put("purpose", request.purpose().getValue());
        details.put("requested_data_types", new TreeSet<>(request.requestedDataTypes()));
        details.put("rule_id", decision.ruleId());
        details.put("consent_id", decision.consentId());
        details.put("sensitive", isSensitive(request, decision));
        if (request.hasEmergencyJustification()) {
            details.put("emergency_justification", request.emergencyJustification());
        }

        return AuditEntry.builder()
                .userId(request.actorId())
                .actorRole(request.actorRole() != null ? request.actorRole().getClaimValue() : null)
                .subjectId(request.subjectId())
                .action(AuditAction.ACCESS_DECISION)
                .resource(String.join(",", new TreeSet<>(request.requestedDataTypes())))
                .granted(decision.granted())
                .basis(decision.basis().name())
                .reason(decision.reason())
                .details(details)
                .timestamp(decision.timestamp())
                .build();
    }

    private boolean isSensitive(AccessRequest request, AccessDecision decision) {
        Permission exercised = switch (decision.basis()) {
            case SELF -> Permission.ACCESS_OWN_DATA;
            case EMERGENCY -> Permission.ACCESS_EMERGENCY_DATA;
            case ROLE -> Permission.ACCESS_OTHERS_DATA;
            case CONSENT, DENIED -> null;
        };
        return permissionRegistry.requiresAuditLog(request.actorRole(), exercised);
    }

    private Mono<AuditEntry> auditRejected(CallerContext caller, AccessCheckRequest body, List<String> errors) {
        log.warn("Rejected malformed access request from user={}: {}",
                StringSanitizer.forLog(caller.userId()), errors);

        Map<String, Object> details = new HashMap<>();
        details.put("validation_errors", errors);
        details.put("purpose", body.purpose());

        return auditTrail.append(AuditEntry.builder()
                .userId(caller.userId())
                .actorRole(caller.role().getClaimValue())
                .subjectId(body.subjectId())
                .action(AuditAction.ACCESS_DECISION)
                .resource(body.requestedDataTypes() != null ? String.join(",", body.requestedDataTypes()) : null)
                .granted(false)
                .basis(AccessBasis.DENIED.name())
                .reason("Invalid request")
                .details(details)
                .build())
                .doOnNext(entry -> metrics.recordDecision(AccessBasis.DENIED));
    }

    private List<String> validate(CallerContext caller, AccessCheckRequest body) {
        List<String> errors = new ArrayList<>();
        if (body.actorId() != null && !body.actorId().isBlank() && !caller.is(body.actorId().trim())) {
            errors.add("actorId does not match the authenticated caller");
        }
        if (body.subjectId() == null || body.subjectId().isBlank()) {
            errors.add("subjectId is required");
        } else if (!StringSanitizer.isValidUserId(body.subjectId().trim())) {
            errors.add("subjectId is malformed");
        }
        if (body.purpose() == null || body.purpose().isBlank()) {
            errors.add("purpose is required");
        } else {
            try {
                AccessPurpose.fromValue(body.purpose().trim());
            } catch (IllegalArgumentException e) {
                errors.add("purpose is not recognized");
            }
        }
        if (body.requestedDataTypes() == null || normalizeDataTypes(body.requestedDataTypes()).isEmpty()) {
            errors.add("requestedDataTypes must not be empty");
        }
        return errors;
    }

    private static Set<String> normalizeDataTypes(List<String> dataTypes) {
        Set<String> normalized = new LinkedHashSet<>();
        if (dataTypes == null) {
            return normalized;
        }
        for (String type : dataTypes) {
            if (type != null && !type.isBlank()) {
                normalized.add(type.trim());
            }
        }
        return normalized;
    }
}
