package com.example.careaccess.access.engine;

import com.example.careaccess.access.model.AccessBasis;
import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.rule.AccessRule;
import com.example.careaccess.access.rule.CareAssignmentAccessRule;
import com.example.careaccess.access.rule.ConsentAccessRule;
import com.example.careaccess.access.rule.EmergencyAccessRule;
import com.example.careaccess.access.rule.SelfAccessRule;
import com.example.careaccess.config.properties.RelationshipProperties;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.ConsentStatus;
import com.example.careaccess.consent.store.ConsentStore;
import com.example.careaccess.consent.store.InMemoryConsentStore;
import com.example.careaccess.rbac.Permission;
import com.example.careaccess.rbac.PermissionRegistry;
import com.example.careaccess.rbac.Role;
import com.example.careaccess.relationship.service.CareAssignmentDirectory;
import com.example.careaccess.relationship.service.InMemoryCareAssignmentDirectory;
import com.example.careaccess.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AccessDecisionEngine")
class AccessDecisionEngineTest {

    private static final String PATIENT = "patient-1";
    private static final String DOCTOR = "doctor-1";

    private MutableClock clock;
    private PermissionRegistry registry;
    private InMemoryConsentStore consentStore;
    private InMemoryCareAssignmentDirectory directory;
    private AccessDecisionEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        registry = new PermissionRegistry();
        consentStore = new InMemoryConsentStore();
        directory = new InMemoryCareAssignmentDirectory(new RelationshipProperties(null, null, null, null));
        engine = engineWith(consentStore, directory);
    }

    private AccessDecisionEngine engineWith(ConsentStore store, CareAssignmentDirectory assignments) {
        List<AccessRule> rules = List.of(
                new CareAssignmentAccessRule(registry, assignments),
                new ConsentAccessRule(store, clock),
                new SelfAccessRule(registry),
                new EmergencyAccessRule(registry));
        return new AccessDecisionEngine(rules, clock);
    }

    private void storeConsent(String id, Set<String> dataTypes, Instant expiresAt) {
        consentStore.insertActive(Consent.builder()
                .id(id)
                .patientId(PATIENT)
                .grantorId(PATIENT)
                .granteeId(DOCTOR)
                .purpose(AccessPurpose.TREATMENT)
                .dataTypes(dataTypes)
                .status(ConsentStatus.ACTIVE)
                .grantedAt(clock.instant())
                .expiresAt(expiresAt)
                .build()).block();
    }

    private static AccessRequest request(String actor, Role role, String subject, AccessPurpose purpose,
                                         Set<String> dataTypes) {
        return AccessRequest.builder()
                .actorId(actor)
                .actorRole(role)
                .subjectId(subject)
                .purpose(purpose)
                .requestedDataTypes(dataTypes)
                .build();
    }

    @Test
    @DisplayName("should order rules by descending priority")
    void shouldOrderRulesByPriority() {
        assertThat(engine.getRules())
                .extracting(AccessRule::getRuleId)
                .containsExactly("SELF_ACCESS", "EMERGENCY_ACCESS", "PATIENT_CONSENT", "CARE_ASSIGNMENT");
    }

    @Nested
    @DisplayName("Self access")
    class SelfAccess {

        @Test
        @DisplayName("should grant a resident access to their own data")
        void shouldGrantOwnData() {
            StepVerifier.create(engine.checkAccess(
                            request(PATIENT, Role.RESIDENT, PATIENT, AccessPurpose.PATIENT_REQUEST, Set.of("labs"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isTrue();
                        assertThat(decision.basis()).isEqualTo(AccessBasis.SELF);
                        assertThat(decision.reason()).isEqualTo("Access to own data");
                        assertThat(decision.ruleId()).isEqualTo("SELF_ACCESS");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should grant self access regardless of purpose")
        void shouldGrantSelfAccessForAnyPurpose() {
            StepVerifier.create(engine.checkAccess(
                            request(PATIENT, Role.RESIDENT, PATIENT, AccessPurpose.PAYMENT, Set.of("billing"))))
                    .assertNext(decision -> assertThat(decision.basis()).isEqualTo(AccessBasis.SELF))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny self access to a role lacking own-data permission without consulting consent")
        void shouldDenySelfAccessWithoutOwnDataPermission() {
            registry = new PermissionRegistry() {
                @Override
                public boolean hasPermission(Role role, Permission permission) {
                    return permission != Permission.ACCESS_OWN_DATA && super.hasPermission(role, permission);
                }
            };
            consentStore.insertActive(Consent.builder()
                    .id("consent-self")
                    .patientId(PATIENT)
                    .grantorId(PATIENT)
                    .granteeId(PATIENT)
                    .purpose(AccessPurpose.TREATMENT)
                    .dataTypes(Set.of("labs"))
                    .status(ConsentStatus.ACTIVE)
                    .grantedAt(clock.instant())
                    .build()).block();
            AccessDecisionEngine restricted = engineWith(consentStore, directory);

            StepVerifier.create(restricted.checkAccess(
                            request(PATIENT, Role.RESIDENT, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isFalse();
                        assertThat(decision.basis()).isEqualTo(AccessBasis.DENIED);
                        assertThat(decision.ruleId()).isEqualTo("SELF_ACCESS");
                        assertThat(decision.consentId()).isNull();
                        assertThat(decision.reason()).isEqualTo("resident role not authorized to access own data");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Consent")
    class ConsentBased {

        @Test
        @DisplayName("should grant when an active consent covers every requested category")
        void shouldGrantCoveredCategories() {
            storeConsent("consent-1", Set.of("labs", "meds"), clock.instant().plus(Duration.ofDays(30)));

            StepVerifier.create(engine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isTrue();
                        assertThat(decision.basis()).isEqualTo(AccessBasis.CONSENT);
                        assertThat(decision.consentId()).isEqualTo("consent-1");
                        assertThat(decision.reason()).isEqualTo("Access granted via patient consent for treatment");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when any requested category is outside the consent")
        void shouldDenyPartialCoverage() {
            storeConsent("consent-1", Set.of("labs", "meds"), clock.instant().plus(Duration.ofDays(30)));

            StepVerifier.create(engine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT,
                                    Set.of("labs", "notes"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isFalse();
                        assertThat(decision.basis()).isEqualTo(AccessBasis.DENIED);
                        assertThat(decision.ruleId()).isEqualTo(AccessDecisionEngine.DEFAULT_DENY);
                        assertThat(decision.reason()).isEqualTo(AccessDecisionEngine.NO_AUTHORIZATION_REASON);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny once the consent has expired")
        void shouldDenyExpiredConsent() {
            storeConsent("consent-1", Set.of("labs"), clock.instant().plus(Duration.ofHours(1)));
            clock.advance(Duration.ofHours(1));

            StepVerifier.create(engine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> assertThat(decision.granted()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not apply a consent granted for another purpose")
        void shouldDenyDifferentPurpose() {
            storeConsent("consent-1", Set.of("labs"), null);

            StepVerifier.create(engine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.PAYMENT, Set.of("labs"))))
                    .assertNext(decision -> assertThat(decision.granted()).isFalse())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Emergency")
    class Emergency {

        private AccessRequest emergencyRequest(Role role) {
            return AccessRequest.builder()
                    .actorId("actor-9")
                    .actorRole(role)
                    .subjectId(PATIENT)
                    .purpose(AccessPurpose.EMERGENCY)
                    .requestedDataTypes(Set.of("vitals"))
                    .emergencyJustification("Patient unresponsive, need allergy history")
                    .build();
        }

        @Test
        @DisplayName("should grant emergency roles without consulting consent")
        void shouldGrantEmergencyRole() {
            StepVerifier.create(engine.checkAccess(emergencyRequest(Role.CARE_STAFF)))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isTrue();
                        assertThat(decision.basis()).isEqualTo(AccessBasis.EMERGENCY);
                        assertThat(decision.reason()).isEqualTo("Emergency access granted with justification");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny non-emergency roles decisively")
        void shouldDenyNonEmergencyRole() {
            StepVerifier.create(engine.checkAccess(emergencyRequest(Role.FAMILY_MEMBER)))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isFalse();
                        assertThat(decision.ruleId()).isEqualTo("EMERGENCY_ACCESS");
                        assertThat(decision.reason()).isEqualTo("family role not authorized for emergency access");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fall through to default deny without a justification")
        void shouldIgnoreEmergencyWithoutJustification() {
            StepVerifier.create(engine.checkAccess(
                            request("actor-9", Role.CARE_STAFF, PATIENT, AccessPurpose.EMERGENCY, Set.of("vitals"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isFalse();
                        assertThat(decision.ruleId()).isEqualTo(AccessDecisionEngine.DEFAULT_DENY);
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Care assignment")
    class CareAssignment {

        @Test
        @DisplayName("should grant care staff with an active assignment")
        void shouldGrantAssignedStaff() {
            directory.assign(DOCTOR, PATIENT);

            StepVerifier.create(engine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT, Set.of("notes"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isTrue();
                        assertThat(decision.basis()).isEqualTo(AccessBasis.ROLE);
                        assertThat(decision.ruleId()).isEqualTo("CARE_ASSIGNMENT");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny care staff without an assignment")
        void shouldDenyUnassignedStaff() {
            StepVerifier.create(engine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT, Set.of("notes"))))
                    .assertNext(decision -> assertThat(decision.granted()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not grant a resident even with a stray assignment")
        void shouldIgnoreAssignmentForResident() {
            directory.assign("resident-2", PATIENT);

            StepVerifier.create(engine.checkAccess(
                            request("resident-2", Role.RESIDENT, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> assertThat(decision.granted()).isFalse())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("should deny with an unrecognized role")
        void shouldDenyUnknownRole() {
            StepVerifier.create(engine.checkAccess(
                            request(PATIENT, null, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isFalse();
                        assertThat(decision.ruleId()).isEqualTo(AccessDecisionEngine.UNKNOWN_ROLE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when the consent store is unavailable")
        void shouldDenyOnConsentStoreFailure() {
            ConsentStore failing = mock(ConsentStore.class);
            when(failing.findActive(anyString(), anyString(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("connection refused")));
            AccessDecisionEngine failingEngine = engineWith(failing, directory);

            StepVerifier.create(failingEngine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> {
                        assertThat(decision.granted()).isFalse();
                        assertThat(decision.ruleId()).isEqualTo(AccessDecisionEngine.BACKEND_FAILURE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when the assignment directory is unavailable")
        void shouldDenyOnDirectoryFailure() {
            CareAssignmentDirectory failing = mock(CareAssignmentDirectory.class);
            when(failing.hasActiveAssignment(anyString(), anyString()))
                    .thenReturn(Mono.error(new IllegalStateException("timeout")));
            AccessDecisionEngine failingEngine = engineWith(consentStore, failing);

            StepVerifier.create(failingEngine.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> assertThat(decision.ruleId())
                            .isEqualTo(AccessDecisionEngine.BACKEND_FAILURE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not consult the directory once consent has granted")
        void shouldStopAtFirstDecision() {
            storeConsent("consent-1", Set.of("labs"), null);
            CareAssignmentDirectory failing = mock(CareAssignmentDirectory.class);
            when(failing.hasActiveAssignment(anyString(), anyString()))
                    .thenReturn(Mono.error(new IllegalStateException("should not be called")));
            AccessDecisionEngine consentFirst = engineWith(consentStore, failing);

            StepVerifier.create(consentFirst.checkAccess(
                            request(DOCTOR, Role.CARE_STAFF, PATIENT, AccessPurpose.TREATMENT, Set.of("labs"))))
                    .assertNext(decision -> assertThat(decision.basis()).isEqualTo(AccessBasis.CONSENT))
                    .verifyComplete();
        }
    }
}
