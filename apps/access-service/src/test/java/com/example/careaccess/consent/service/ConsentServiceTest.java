package com.example.careaccess.consent.service;

import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.audit.exception.AuditPersistenceException;
import com.example.careaccess.audit.model.AuditAction;
import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.model.AuditQuery;
import com.example.careaccess.audit.service.AuditTrail;
import com.example.careaccess.audit.store.AuditSink;
import com.example.careaccess.common.exception.NotFoundException;
import com.example.careaccess.common.exception.ValidationException;
import com.example.careaccess.config.properties.RelationshipProperties;
import com.example.careaccess.consent.exception.ConsentConflictException;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.ConsentStatus;
import com.example.careaccess.consent.model.request.GrantConsentRequest;
import com.example.careaccess.consent.store.InMemoryConsentStore;
import com.example.careaccess.observability.metrics.AccessMetrics;
import com.example.careaccess.relationship.service.InMemoryCareAssignmentDirectory;
import com.example.careaccess.security.context.CallerContext;
import com.example.careaccess.security.exception.AuthorizationException;
import com.example.careaccess.util.AuditTrailTestFactory;
import com.example.careaccess.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static com.example.careaccess.util.CallerContextTestBuilder.aCareStaff;
import static com.example.careaccess.util.CallerContextTestBuilder.aResident;
import static com.example.careaccess.util.CallerContextTestBuilder.anAdmin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ConsentService")
class ConsentServiceTest {

    private static final String PATIENT = "patient-1";
    private static final String DOCTOR = "doctor-1";

    private MutableClock clock;
    private InMemoryConsentStore store;
    private InMemoryCareAssignmentDirectory directory;
    private AuditTrail auditTrail;
    private ConsentService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        store = new InMemoryConsentStore();
        directory = new InMemoryCareAssignmentDirectory(new RelationshipProperties(null, null, null, null));
        auditTrail = AuditTrailTestFactory.inMemory(clock);
        service = serviceWith(auditTrail);
    }

    private ConsentService serviceWith(AuditTrail trail) {
        return new ConsentService(store, directory, trail, new AccessMetrics(new SimpleMeterRegistry()), clock);
    }

    private GrantConsentRequest grantRequest(Set<String> dataTypes, Instant expiresAt) {
        return new GrantConsentRequest(PATIENT, DOCTOR, AccessPurpose.TREATMENT, dataTypes, expiresAt);
    }

    private Consent grantAsPatient() {
        return service.grant(aResident(PATIENT), grantRequest(Set.of("labs", "meds"), null)).block();
    }

    @Nested
    @DisplayName("grant")
    class Grant {

        @Test
        @DisplayName("should store an active consent and audit it")
        void shouldGrantAndAudit() {
            Instant expiry = clock.instant().plus(Duration.ofDays(30));

            StepVerifier.create(service.grant(aResident(PATIENT), grantRequest(Set.of("labs", "meds"), expiry)))
                    .assertNext(consent -> {
                        assertThat(consent.status()).isEqualTo(ConsentStatus.ACTIVE);
                        assertThat(consent.grantorId()).isEqualTo(PATIENT);
                        assertThat(consent.granteeId()).isEqualTo(DOCTOR);
                        assertThat(consent.dataTypes()).containsExactlyInAnyOrder("labs", "meds");
                        assertThat(consent.grantedAt()).isEqualTo(clock.instant());
                        assertThat(consent.expiresAt()).isEqualTo(expiry);
                    })
                    .verifyComplete();

            StepVerifier.create(auditTrail.query(AuditQuery.builder().action(AuditAction.CONSENT_GRANTED).build()))
                    .assertNext(entry -> {
                        assertThat(entry.userId()).isEqualTo(PATIENT);
                        assertThat(entry.subjectId()).isEqualTo(PATIENT);
                        assertThat(entry.details()).containsEntry("grantee_id", DOCTOR);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a second active consent for the same tuple")
        void shouldRejectDuplicateActiveConsent() {
            grantAsPatient();

            StepVerifier.create(service.grant(aResident(PATIENT), grantRequest(Set.of("notes"), null)))
                    .expectError(ConsentConflictException.class)
                    .verify();
        }

        @Test
        @DisplayName("should replace an active consent that has already expired")
        void shouldReplaceStaleConsent() {
            Consent first = service.grant(aResident(PATIENT),
                    grantRequest(Set.of("labs"), clock.instant().plus(Duration.ofHours(1)))).block();
            clock.advance(Duration.ofHours(2));

            StepVerifier.create(service.grant(aResident(PATIENT), grantRequest(Set.of("labs", "notes"), null)))
                    .assertNext(second -> assertThat(second.id()).isNotEqualTo(first.id()))
                    .verifyComplete();

            StepVerifier.create(store.findById(first.id()))
                    .assertNext(old -> assertThat(old.status()).isEqualTo(ConsentStatus.EXPIRED))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject granting consent to oneself")
        void shouldRejectSelfGrant() {
            GrantConsentRequest request = new GrantConsentRequest(PATIENT, PATIENT, AccessPurpose.TREATMENT,
                    Set.of("labs"), null);

            StepVerifier.create(service.grant(aResident(PATIENT), request))
                    .expectError(ValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject an expiry in the past")
        void shouldRejectPastExpiry() {
            StepVerifier.create(service.grant(aResident(PATIENT),
                            grantRequest(Set.of("labs"), clock.instant().minusSeconds(1))))
                    .expectError(ValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject a grantor with no relationship to the patient")
        void shouldRejectUnrelatedGrantor() {
            StepVerifier.create(service.grant(aCareStaff("stranger"), grantRequest(Set.of("labs"), null)))
                    .expectError(AuthorizationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should accept a grantor confirmed by the assignment directory")
        void shouldAcceptRelatedGrantor() {
            directory.assign("guardian-1", PATIENT);
            CallerContext guardian = aResident("guardian-1");

            StepVerifier.create(service.grant(guardian, grantRequest(Set.of("labs"), null)))
                    .assertNext(consent -> assertThat(consent.grantorId()).isEqualTo("guardian-1"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should roll the consent back when the audit write fails")
        void shouldRollBackOnAuditFailure() {
            AuditSink failingSink = mock(AuditSink.class);
            when(failingSink.append(any(AuditEntry.class))).thenReturn(Mono.error(new IllegalStateException("down")));
            ConsentService failing = serviceWith(AuditTrailTestFactory.withSink(failingSink, clock));

            StepVerifier.create(failing.grant(aResident(PATIENT), grantRequest(Set.of("labs"), null)))
                    .expectError(AuditPersistenceException.class)
                    .verify();

            StepVerifier.create(store.findByPatient(PATIENT))
                    .assertNext(consent -> {
                        assertThat(consent.status()).isEqualTo(ConsentStatus.REVOKED);
                        assertThat(consent.revocationReason()).isEqualTo("audit_write_failed");
                    })
                    .verifyComplete();
            StepVerifier.create(store.findActive(PATIENT, DOCTOR, AccessPurpose.TREATMENT))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("revoke")
    class Revoke {

        @Test
        @DisplayName("should revoke an active consent and record who did it")
        void shouldRevoke() {
            Consent consent = grantAsPatient();
            clock.advance(Duration.ofMinutes(5));

            StepVerifier.create(service.revoke(aResident(PATIENT), consent.id(), "changed my mind"))
                    .assertNext(revoked -> {
                        assertThat(revoked.status()).isEqualTo(ConsentStatus.REVOKED);
                        assertThat(revoked.revokedAt()).isEqualTo(clock.instant());
                        assertThat(revoked.revokedBy()).isEqualTo(PATIENT);
                        assertThat(revoked.revocationReason()).isEqualTo("changed my mind");
                    })
                    .verifyComplete();

            StepVerifier.create(auditTrail.query(AuditQuery.builder().action(AuditAction.CONSENT_REVOKED).build()))
                    .assertNext(entry -> assertThat(entry.reason()).isEqualTo("changed my mind"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report a conflict when revoking twice")
        void shouldRejectSecondRevoke() {
            Consent consent = grantAsPatient();
            service.revoke(aResident(PATIENT), consent.id(), null).block();

            StepVerifier.create(service.revoke(aResident(PATIENT), consent.id(), null))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(ConsentConflictException.class);
                        assertThat(e).hasMessage("Consent not found or already revoked");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should allow a new grant after revocation")
        void shouldAllowRegrantAfterRevoke() {
            Consent consent = grantAsPatient();
            service.revoke(aResident(PATIENT), consent.id(), null).block();

            StepVerifier.create(service.grant(aResident(PATIENT), grantRequest(Set.of("labs"), null)))
                    .assertNext(regranted -> assertThat(regranted.status()).isEqualTo(ConsentStatus.ACTIVE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should forbid revocation by the grantee")
        void shouldForbidGranteeRevocation() {
            Consent consent = grantAsPatient();

            StepVerifier.create(service.revoke(aCareStaff(DOCTOR), consent.id(), null))
                    .expectError(AuthorizationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should report unknown consents as not found")
        void shouldReportUnknownConsent() {
            StepVerifier.create(service.revoke(aResident(PATIENT), "missing", null))
                    .expectError(NotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("listForPatient")
    class ListForPatient {

        @Test
        @DisplayName("should filter out revoked consents when only active ones are requested")
        void shouldListActiveOnly() {
            Consent revoked = grantAsPatient();
            service.revoke(aResident(PATIENT), revoked.id(), null).block();
            clock.advance(Duration.ofMinutes(1));
            Consent active = grantAsPatient();

            StepVerifier.create(service.listForPatient(aResident(PATIENT), PATIENT, true))
                    .assertNext(consent -> assertThat(consent.id()).isEqualTo(active.id()))
                    .verifyComplete();

            StepVerifier.create(service.listForPatient(aResident(PATIENT), PATIENT, false))
                    .expectNextCount(2)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should let administrators list any patient")
        void shouldAllowAdmin() {
            grantAsPatient();

            StepVerifier.create(service.listForPatient(anAdmin("admin-1"), PATIENT, true))
                    .expectNextCount(1)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should forbid other callers")
        void shouldForbidOthers() {
            StepVerifier.create(service.listForPatient(aCareStaff(DOCTOR), PATIENT, false))
                    .expectError(AuthorizationException.class)
                    .verify();
        }
    }
}
