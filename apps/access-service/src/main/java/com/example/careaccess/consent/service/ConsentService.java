package com.example.careaccess.consent.service;

import com.example.careaccess.audit.model.AuditAction;
import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.service.AuditTrail;
import com.example.careaccess.common.exception.NotFoundException;
import com.example.careaccess.common.exception.ValidationException;
import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.consent.exception.ConsentConflictException;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.ConsentStatus;
import com.example.careaccess.consent.model.request.GrantConsentRequest;
import com.example.careaccess.consent.store.ConsentStore;
import com.example.careaccess.observability.metrics.AccessMetrics;
import com.example.careaccess.relationship.service.CareAssignmentDirectory;
import com.example.careaccess.security.context.CallerContext;
import com.example.careaccess.security.exception.AuthorizationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Grant, revoke and list patient consents.
 *
 * <p>A consent may be granted by the patient or by someone the care-assignment directory
 * confirms as related to the patient. Only the patient or the original grantor may revoke.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsentService {

    private static final String ALREADY_INACTIVE = "Consent not found or already revoked";

    private final ConsentStore consentStore;
    private final CareAssignmentDirectory assignmentDirectory;
    private final AuditTrail auditTrail;
    private final AccessMetrics metrics;
    private final Clock clock;

    public Mono<Consent> grant(@NonNull CallerContext caller, @NonNull GrantConsentRequest request) {
        Instant now = clock.instant();
        String patientId = request.patientId().trim();
        String granteeId = request.granteeId().trim();

        if (patientId.equals(granteeId)) {
            return Mono.error(new ValidationException("granteeId must differ from patientId"));
        }
        if (request.expiresAt() != null && !request.expiresAt().isAfter(now)) {
            return Mono.error(new ValidationException("expiresAt must be in the future"));
        }

        Consent consent = Consent.builder()
                .id(UUID.randomUUID().toString())
                .patientId(patientId)
                .grantorId(caller.userId())
                .granteeId(granteeId)
                .purpose(request.purpose())
                .dataTypes(new TreeSet<>(request.dataTypes()))
                .status(ConsentStatus.ACTIVE)
                .grantedAt(now)
                .expiresAt(request.expiresAt())
                .build();

        return requireGrantor(caller, patientId)
                .then(expireStale(consent))
                .then(consentStore.insertActive(consent))
                .flatMap(saved -> auditTrail.append(consentEntry(AuditAction.CONSENT_GRANTED, caller, saved, null))
                        .onErrorResume(e -> rollbackGrant(saved, e))
                        .thenReturn(saved))
                .doOnNext(saved -> {
                    metrics.recordConsentGranted();
                    log.info("Consent {} granted: patient={}, grantee={}, purpose={}, dataTypes={}",
                            saved.id(), StringSanitizer.forLog(saved.patientId()),
                            StringSanitizer.forLog(saved.granteeId()), saved.purpose(), saved.dataTypes());
                });
    }

    public Mono<Consent> revoke(@NonNull CallerContext caller, @NonNull String consentId, @Nullable String reason) {
        Instant now = clock.instant();

        return consentStore.findById(consentId)
                .switchIfEmpty(Mono.error(new NotFoundException("Consent", consentId)))
                .flatMap(consent -> {
                    if (!caller.is(consent.patientId()) && !caller.is(consent.grantorId())) {
                        return Mono.error(new AuthorizationException(caller.userId(),
                                "Only the patient or the grantor may revoke this consent"));
                    }
                    if (!consent.isEffective(now)) {
                        return markExpiredIfStale(consent, now)
                                .then(Mono.error(new ConsentConflictException(consentId, ALREADY_INACTIVE)));
                    }

                    Consent revoked = consent.toBuilder()
                            .status(ConsentStatus.REVOKED)
                            .revokedAt(now)
                            .revokedBy(caller.userId())
                            .revocationReason(reason)
                            .build();

                    return consentStore.transition(revoked, ConsentStatus.ACTIVE)
                            .switchIfEmpty(Mono.error(new ConsentConflictException(consentId, ALREADY_INACTIVE)));
                })
                .flatMap(revoked -> auditTrail.append(consentEntry(AuditAction.CONSENT_REVOKED, caller, revoked, reason))
                        .thenReturn(revoked))
                .doOnNext(revoked -> {
                    metrics.recordConsentRevoked();
                    log.info("Consent {} revoked by {}", revoked.id(), StringSanitizer.forLog(caller.userId()));
                });
    }

    public Flux<Consent> listForPatient(@NonNull CallerContext caller, @NonNull String patientId, boolean activeOnly) {
        if (!caller.is(patientId) && !caller.isAdmin()) {
            return Flux.error(new AuthorizationException(caller.userId(),
                    "Only the patient or an administrator may list consents"));
        }
        Instant now = clock.instant();
        return consentStore.findByPatient(patientId)
                .filter(consent -> !activeOnly || consent.isEffective(now));
    }

    private Mono<Void> requireGrantor(CallerContext caller, String patientId) {
        if (caller.is(patientId)) {
            return Mono.empty();
        }
        return assignmentDirectory.hasActiveAssignment(caller.userId(), patientId)
                .flatMap(related -> related
                        ? Mono.<Void>empty()
                        : Mono.error(new AuthorizationException(caller.userId(),
                                "Caller may not grant consent on behalf of this patient")));
    }

    // A stored ACTIVE consent past its expiry still occupies the tuple until it is moved to EXPIRED
    private Mono<Void> expireStale(Consent candidate) {
        Instant now = clock.instant();
        return consentStore.findActive(candidate.patientId(), candidate.granteeId(), candidate.purpose())
                .filter(existing -> !existing.isEffective(now))
                .flatMap(existing -> markExpiredIfStale(existing, now))
                .then();
    }

    private Mono<Consent> markExpiredIfStale(Consent consent, Instant now) {
        if (consent.status() != ConsentStatus.ACTIVE) {
            return Mono.empty();
        }
        log.debug("Marking consent {} as expired", consent.id());
        return consentStore.transition(consent.toBuilder().status(ConsentStatus.EXPIRED).build(), ConsentStatus.ACTIVE);
    }

    private Mono<AuditEntry> rollbackGrant(Consent saved, Throwable cause) {
        log.error("Audit write failed for consent {}, revoking it", saved.id());
        Consent rolledBack = saved.toBuilder()
                .status(ConsentStatus.REVOKED)
                .revokedAt(clock.instant())
                .revokedBy("system")
                .revocationReason("audit_write_failed")
                .build();
        return consentStore.transition(rolledBack, ConsentStatus.ACTIVE)
                .then(Mono.error(cause));
    }

    private AuditEntry consentEntry(AuditAction action, CallerContext caller, Consent consent, @Nullable String reason) {
        Map<String, Object> details = new HashMap<>();
        details.put("consent_id", consent.id());
        details.put("grantee_id", consent.granteeId());
        details.put("purpose", consent.purpose().getValue());
        details.put("data_types", new TreeSet<>(consent.dataTypes()));
        if (consent.expiresAt() != null) {
            details.put("expires_at", consent.expiresAt().toString());
        }
        return AuditEntry.builder()
                .requestId(consent.id())
                .userId(caller.userId())
                .actorRole(caller.role().getClaimValue())
                .subjectId(consent.patientId())
                .action(action)
                .resource("consent:" + consent.purpose().getValue())
                .granted(true)
                .basis(action.name())
                .reason(reason != null ? reason : action == AuditAction.CONSENT_GRANTED ? "Consent granted" : "Consent revoked")
                .details(details)
                .build();
    }
}
