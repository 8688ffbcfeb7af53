package com.example.careaccess.emergency.service;

import com.example.careaccess.audit.model.AuditAction;
import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.model.AuditQuery;
import com.example.careaccess.audit.service.AuditTrail;
import com.example.careaccess.common.exception.NotFoundException;
import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.config.properties.EmergencyAccessProperties;
import com.example.careaccess.emergency.model.ComplianceAlert;
import com.example.careaccess.emergency.model.EmergencyAccessType;
import com.example.careaccess.emergency.model.EmergencyGrant;
import com.example.careaccess.emergency.model.EmergencyLevel;
import com.example.careaccess.emergency.model.request.EmergencyAccessRequest;
import com.example.careaccess.emergency.model.response.EmergencyAccessResponse;
import com.example.careaccess.emergency.model.response.EmergencyStatsResponse;
import com.example.careaccess.emergency.model.response.RevokeResponse;
import com.example.careaccess.emergency.model.response.SessionStatusResponse;
import com.example.careaccess.emergency.notify.SupervisorNotifier;
import com.example.careaccess.observability.metrics.AccessMetrics;
import com.example.careaccess.security.context.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Issues, tracks and retires break-glass emergency grants.
 *
 * <p>The active-session table and the alert list share one read-write lock. The lock guards
 * in-memory map operations only; audit writes and supervisor notification always run after it is
 * released. Alert evaluation and session registration happen in the same write-locked section,
 * so concurrent requests from one user see each other's sessions.
 *
 * <p>Whether a session is active is always computed from its expiry and the injected clock.
 * The sweeper only removes sessions that are already inactive.
 */
@Slf4j
@Service
public class EmergencyAccessMonitor {

    private static final String TOKEN_PREFIX = "emergency_";

    private final EmergencyRequestValidator validator;
    private final ComplianceAlertEvaluator alertEvaluator;
    private final AuditTrail auditTrail;
    private final SupervisorNotifier supervisorNotifier;
    private final AccessMetrics metrics;
    private final Duration patternWindow;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, EmergencyGrant> activeSessions = new HashMap<>();
    private final Map<String, ComplianceAlert> alerts = new LinkedHashMap<>();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong rejectedRequests = new AtomicLong();
    private final Map<EmergencyLevel, AtomicLong> levelCounts = new EnumMap<>(EmergencyLevel.class);
    private final Map<EmergencyAccessType, AtomicLong> typeCounts = new EnumMap<>(EmergencyAccessType.class);

    public EmergencyAccessMonitor(EmergencyRequestValidator validator,
                                  ComplianceAlertEvaluator alertEvaluator,
                                  AuditTrail auditTrail,
                                  SupervisorNotifier supervisorNotifier,
                                  AccessMetrics metrics,
                                  EmergencyAccessProperties properties,
                                  Clock clock) {
        this.validator = validator;
        this.alertEvaluator = alertEvaluator;
        this.auditTrail = auditTrail;
        this.supervisorNotifier = supervisorNotifier;
        this.metrics = metrics;
        this.patternWindow = properties.suspiciousAccessWindow();
        this.clock = clock;

        for (EmergencyLevel level : EmergencyLevel.values()) {
            levelCounts.put(level, new AtomicLong());
        }
        for (EmergencyAccessType type : EmergencyAccessType.values()) {
            typeCounts.put(type, new AtomicLong());
        }
        metrics.registerActiveSessionGauge(this::getActiveSessionCount);
    }

    /**
     * Validates and, if valid, issues an emergency grant to the calling user. Invalid requests,
     * including requests naming a user other than the caller, are audited and answered with
     * {@code access_granted=false}; they do not signal an error.
     */
    public Mono<EmergencyAccessResponse> requestAccess(@NonNull CallerContext caller,
                                                       @NonNull EmergencyAccessRequest request) {
        return Mono.defer(() -> {
            totalRequests.incrementAndGet();
            String requestId = UUID.randomUUID().toString();

            List<String> errors = new ArrayList<>(validator.validate(request));
            if (request.userId() != null && !request.userId().isBlank() && !caller.is(request.userId().trim())) {
                errors.add("userId must match the authenticated caller");
            }
            if (!errors.isEmpty()) {
                return reject(requestId, caller, request, errors);
            }
            return grant(requestId, caller, request);
        });
    }

    private Mono<EmergencyAccessResponse> grant(String requestId, CallerContext caller, EmergencyAccessRequest request) {
        Instant now = clock.instant();
        EmergencyLevel level = EmergencyLevel.fromValue(request.emergencyLevel());
        EmergencyAccessType accessType = EmergencyAccessType.fromValue(request.accessType());
        String userId = request.userId().trim();
        String resource = request.resourceAccessed().trim();

        EmergencyGrant candidate = EmergencyGrant.builder()
                .requestId(requestId)
                .userId(userId)
                .accessType(accessType)
                .level(level)
                .justification(request.justification().trim())
                .resourceAccessed(resource)
                .requestedBy(request.requestedBy().trim())
                .supervisorId(blankToNull(request.supervisorId()))
                .patientId(blankToNull(request.patientId()))
                .grantedAt(now)
                .expiresAt(now.plus(level.getGrantDuration()))
                .restrictions(level.getRestrictions())
                .accessToken(accessToken(requestId, now))
                .supervisorNotified(level.requiresSupervisorNotification())
                .auditEntryId(UUID.randomUUID().toString())
                .build();

        EmergencyGrant issued;
        List<ComplianceAlert> raised;
        lock.writeLock().lock();
        try {
            int concurrent = 1 + (int) activeSessions.values().stream()
                    .filter(g -> g.userId().equals(userId) && g.isActiveAt(now))
                    .count();
            int prior = auditTrail.countRecentAccess(userId, resource, patternWindow);

            raised = alertEvaluator.evaluate(candidate, concurrent, prior, now);
            issued = candidate.toBuilder()
                    .alertsTriggered(raised.stream().map(ComplianceAlert::id).toList())
                    .build();

            activeSessions.put(requestId, issued);
            raised.forEach(alert -> alerts.put(alert.id(), alert));
            auditTrail.recordRecentAccess(userId, resource, now);
        } finally {
            lock.writeLock().unlock();
        }

        String complianceStatus = raised.isEmpty()
                ? EmergencyAccessResponse.GRANTED_WITH_MONITORING
                : EmergencyAccessResponse.GRANTED_WITH_ALERTS;

        return auditTrail.append(grantEntry(issued, caller, request, raised, complianceStatus))
                .onErrorResume(e -> {
                    log.error("Audit write failed for emergency grant {}, withdrawing it", requestId);
                    withdraw(issued, raised);
                    return Mono.error(e);
                })
                .doOnNext(entry -> recordGrant(issued, raised))
                .then(Mono.defer(() -> notifySupervisor(issued, raised)))
                .thenReturn(toResponse(issued, complianceStatus));
    }

    private Mono<EmergencyAccessResponse> reject(String requestId, CallerContext caller,
                                                 EmergencyAccessRequest request, List<String> errors) {
        rejectedRequests.incrementAndGet();
        log.warn("Rejected emergency request {} from caller={} for user={}: {}",
                requestId, caller.userId(), StringSanitizer.forLog(request.userId()), errors);

        Map<String, Object> details = new HashMap<>();
        details.put("caller_id", caller.userId());
        details.put("validation_errors", errors);
        details.put("access_type", request.accessType());
        details.put("emergency_level", request.emergencyLevel());
        details.put("requested_by", request.requestedBy());
        details.put("compliance_status", EmergencyAccessResponse.REJECTED_INVALID_REQUEST);

        AuditEntry entry = AuditEntry.builder()
                .requestId(requestId)
                .userId(request.userId() != null ? request.userId() : "unknown")
                .actorRole(caller.role().getClaimValue())
                .subjectId(blankToNull(request.patientId()))
                .action(AuditAction.EMERGENCY_ACCESS_REQUESTED)
                .resource(request.resourceAccessed())
                .granted(false)
                .basis("EMERGENCY")
                .reason("Invalid emergency access request")
                .details(details)
                .build();

        return auditTrail.append(entry)
                .doOnNext(saved -> metrics.recordEmergencyRejected())
                .map(saved -> EmergencyAccessResponse.builder()
                        .requestId(requestId)
                        .accessGranted(false)
                        .emergencyLevel(EmergencyLevel.fromValue(request.emergencyLevel()))
                        .accessType(EmergencyAccessType.fromValue(request.accessType()))
                        .restrictions(List.of())
                        .auditTrailId(saved.id())
                        .complianceStatus(EmergencyAccessResponse.REJECTED_INVALID_REQUEST)
                        .alertsTriggered(List.of())
                        .errors(errors)
                        .build());
    }

    /**
     * Reports a session's state. Sessions already retired from the table are answered from their
     * grant audit entry as inactive; ids never granted are not found.
     */
    public Mono<SessionStatusResponse> getSessionStatus(@NonNull String requestId) {
        return Mono.defer(() -> {
            EmergencyGrant grant;
            lock.readLock().lock();
            try {
                grant = activeSessions.get(requestId);
            } finally {
                lock.readLock().unlock();
            }
            if (grant == null) {
                return findGrantEntry(requestId)
                        .map(EmergencyAccessMonitor::retiredStatus)
                        .switchIfEmpty(Mono.error(new NotFoundException("Emergency session", requestId)));
            }
            Instant now = clock.instant();
            boolean active = grant.isActiveAt(now);
            long remaining = active ? Duration.between(now, grant.expiresAt()).getSeconds() : 0;
            return Mono.just(new SessionStatusResponse(
                    grant.requestId(),
                    grant.userId(),
                    active,
                    grant.expiresAt(),
                    remaining,
                    grant.level(),
                    grant.accessType(),
                    grant.restrictions()));
        });
    }

    private static SessionStatusResponse retiredStatus(AuditEntry entry) {
        Map<String, Object> details = entry.details();
        Object expiresAt = details.get("expires_at");
        List<String> restrictions = details.get("restrictions") instanceof List<?> values
                ? values.stream().map(String::valueOf).toList()
                : List.of();
        return new SessionStatusResponse(
                entry.requestId(),
                entry.userId(),
                false,
                expiresAt != null ? Instant.parse(expiresAt.toString()) : null,
                0,
                EmergencyLevel.fromValue(String.valueOf(details.get("emergency_level"))),
                EmergencyAccessType.fromValue(String.valueOf(details.get("access_type"))),
                restrictions);
    }

    /**
     * Revokes an active session. Idempotent: revoking a session that already expired or was
     * revoked reports {@code ALREADY_INACTIVE} and writes nothing. When the revocation record
     * cannot be written the session stays in the table and the error propagates.
     */
    public Mono<RevokeResponse> revoke(@NonNull String requestId, @NonNull String revokedBy, @Nullable String reason) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            EmergencyGrant revoked = null;
            boolean known;

            lock.writeLock().lock();
            try {
                EmergencyGrant grant = activeSessions.get(requestId);
                known = grant != null;
                // Expired but not yet swept: the sweeper writes its expiry record
                if (grant != null && grant.isActiveAt(now)) {
                    activeSessions.remove(requestId);
                    revoked = grant;
                }
            } finally {
                lock.writeLock().unlock();
            }

            if (revoked != null) {
                return recordRevocation(revoked, revokedBy, reason, now);
            }
            if (known) {
                return Mono.just(new RevokeResponse(requestId, RevokeResponse.Outcome.ALREADY_INACTIVE));
            }
            return findGrantEntry(requestId)
                    .map(entry -> new RevokeResponse(requestId, RevokeResponse.Outcome.ALREADY_INACTIVE))
                    .switchIfEmpty(Mono.error(new NotFoundException("Emergency session", requestId)));
        });
    }

    private Mono<RevokeResponse> recordRevocation(EmergencyGrant grant, String revokedBy,
                                                  @Nullable String reason, Instant now) {
        Map<String, Object> details = new HashMap<>();
        details.put("revoked_by", revokedBy);
        details.put("original_expires_at", grant.expiresAt().toString());
        details.put("grant_audit_id", grant.auditEntryId());

        AuditEntry entry = AuditEntry.builder()
                .requestId(grant.requestId())
                .userId(grant.userId())
                .subjectId(grant.patientId())
                .action(AuditAction.EMERGENCY_ACCESS_REVOKED)
                .resource(grant.resourceAccessed())
                .granted(false)
                .basis("EMERGENCY")
                .reason(reason != null && !reason.isBlank() ? reason : "Emergency access revoked")
                .details(details)
                .timestamp(now)
                .build();

        return auditTrail.append(entry)
                .then(Mono.defer(() -> auditTrail.markResolved(grant.auditEntryId(), now)))
                .onErrorResume(e -> {
                    // Back into the table so a retried revoke or the sweeper records the transition
                    log.error("Failed to record revocation of emergency session {}: {}",
                            grant.requestId(), StringSanitizer.forLog(e.getMessage(), 200));
                    restore(grant);
                    return Mono.error(e);
                })
                .doOnNext(resolved -> {
                    metrics.recordSessionRevoked();
                    log.info("Emergency session {} revoked by {}",
                            grant.requestId(), StringSanitizer.forLog(revokedBy));
                })
                .thenReturn(new RevokeResponse(grant.requestId(), RevokeResponse.Outcome.REVOKED));
    }

    private Mono<AuditEntry> findGrantEntry(String requestId) {
        AuditQuery query = AuditQuery.builder()
                .requestId(requestId)
                .action(AuditAction.EMERGENCY_ACCESS_REQUESTED)
                .granted(true)
                .size(1)
                .build();
        return auditTrail.query(query).next();
    }

    /**
     * Removes every session whose expiry has passed and records its expiration.
     *
     * @return number of sessions retired
     */
    public Mono<Long> expireSessions() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            List<EmergencyGrant> expired = new ArrayList<>();

            lock.writeLock().lock();
            try {
                activeSessions.values().removeIf(grant -> {
                    if (grant.isActiveAt(now)) {
                        return false;
                    }
                    expired.add(grant);
                    return true;
                });
            } finally {
                lock.writeLock().unlock();
            }

            if (expired.isEmpty()) {
                return Mono.just(0L);
            }

            return Flux.fromIterable(expired)
                    .concatMap(grant -> recordExpiration(grant, now)
                            .thenReturn(grant)
                            .onErrorResume(e -> {
                                // Put it back so the next sweep retries the expiry record
                                log.error("Failed to record expiry of emergency session {}: {}",
                                        grant.requestId(), StringSanitizer.forLog(e.getMessage(), 200));
                                restore(grant);
                                return Mono.empty();
                            }))
                    .count()
                    .doOnNext(count -> {
                        metrics.recordSessionExpired(count.intValue());
                        log.info("Expired {} emergency sessions", count);
                    });
        });
    }

    @Scheduled(fixedRateString = "${app.emergency.sweep-interval-ms:300000}",
            initialDelayString = "${app.emergency.sweep-interval-ms:300000}")
    public void sweepExpiredSessions() {
        expireSessions().subscribe(
                count -> log.debug("Emergency session sweep complete, {} expired", count),
                e -> log.error("Emergency session sweep failed: {}", StringSanitizer.forLog(e.getMessage(), 200)));
    }

    private Mono<Boolean> recordExpiration(EmergencyGrant grant, Instant now) {
        Map<String, Object> details = new HashMap<>();
        details.put("expired_at", grant.expiresAt().toString());
        details.put("duration_seconds", Duration.between(grant.grantedAt(), grant.expiresAt()).getSeconds());
        details.put("grant_audit_id", grant.auditEntryId());

        AuditEntry entry = AuditEntry.builder()
                .requestId(grant.requestId())
                .userId(grant.userId())
                .subjectId(grant.patientId())
                .action(AuditAction.EMERGENCY_ACCESS_EXPIRED)
                .resource(grant.resourceAccessed())
                .granted(false)
                .basis("EMERGENCY")
                .reason("Emergency access expired")
                .details(details)
                .timestamp(now)
                .build();

        return auditTrail.append(entry)
                .then(Mono.defer(() -> auditTrail.markResolved(grant.auditEntryId(), now)));
    }

    public List<ComplianceAlert> getUnresolvedAlerts() {
        lock.readLock().lock();
        try {
            return alerts.values().stream()
                    .filter(alert -> !alert.isResolved())
                    .sorted(Comparator.comparing(ComplianceAlert::triggeredAt).reversed())
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Marks an alert resolved. Resolving an already-resolved alert returns it unchanged.
     */
    public Mono<ComplianceAlert> resolveAlert(@NonNull String alertId, @NonNull String resolvedBy) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            ComplianceAlert resolved;

            lock.writeLock().lock();
            try {
                ComplianceAlert alert = alerts.get(alertId);
                if (alert == null) {
                    return Mono.error(new NotFoundException("Compliance alert", alertId));
                }
                if (alert.isResolved()) {
                    return Mono.just(alert);
                }
                resolved = alert.resolve(resolvedBy, now);
                alerts.put(alertId, resolved);
            } finally {
                lock.writeLock().unlock();
            }

            Map<String, Object> details = new HashMap<>();
            details.put("alert_id", alertId);
            details.put("alert_type", resolved.type().name());
            details.put("severity", resolved.severity().getValue());

            return auditTrail.append(AuditEntry.builder()
                            .requestId(resolved.requestId())
                            .userId(resolvedBy)
                            .subjectId(resolved.userId())
                            .action(AuditAction.COMPLIANCE_ALERT_RESOLVED)
                            .resource(resolved.resourceAccessed())
                            .granted(true)
                            .basis("COMPLIANCE")
                            .reason("Compliance alert resolved")
                            .details(details)
                            .timestamp(now)
                            .build())
                    .thenReturn(resolved);
        });
    }

    public EmergencyStatsResponse getStats() {
        int active;
        int totalAlerts;
        int unresolved;
        Instant now = clock.instant();

        lock.readLock().lock();
        try {
            active = (int) activeSessions.values().stream().filter(g -> g.isActiveAt(now)).count();
            totalAlerts = alerts.size();
            unresolved = (int) alerts.values().stream().filter(a -> !a.isResolved()).count();
        } finally {
            lock.readLock().unlock();
        }

        Map<String, Long> levels = new LinkedHashMap<>();
        levelCounts.forEach((level, count) -> levels.put(level.getValue(), count.get()));
        Map<String, Long> types = new LinkedHashMap<>();
        typeCounts.forEach((type, count) -> types.put(type.getValue(), count.get()));

        return new EmergencyStatsResponse(active, totalRequests.get(), rejectedRequests.get(),
                totalAlerts, unresolved, levels, types);
    }

    public int getActiveSessionCount() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            return (int) activeSessions.values().stream().filter(g -> g.isActiveAt(now)).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getUnresolvedAlertCount() {
        lock.readLock().lock();
        try {
            return (int) alerts.values().stream().filter(a -> !a.isResolved()).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Mono<Void> notifySupervisor(EmergencyGrant grant, List<ComplianceAlert> raised) {
        if (!grant.supervisorNotified()) {
            return Mono.empty();
        }
        return supervisorNotifier.notifySupervisor(grant, raised)
                .onErrorResume(e -> {
                    // A failed notification never withdraws the grant
                    log.error("Supervisor notification failed for emergency session {}: {}",
                            grant.requestId(), StringSanitizer.forLog(e.getMessage(), 200));
                    return Mono.empty();
                });
    }

    private void recordGrant(EmergencyGrant grant, List<ComplianceAlert> raised) {
        levelCounts.get(grant.level()).incrementAndGet();
        typeCounts.get(grant.accessType()).incrementAndGet();
        metrics.recordEmergencyGranted();
        raised.forEach(alert -> metrics.recordAlert(alert.type()));

        log.info("Emergency access {} granted: user={}, level={}, type={}, expires={}, alerts={}",
                grant.requestId(), StringSanitizer.forLog(grant.userId()), grant.level().getValue(),
                grant.accessType().getValue(), grant.expiresAt(), raised.size());
        raised.forEach(alert -> log.warn("Compliance alert {} [{}]: {}",
                alert.type(), alert.severity().getValue(), StringSanitizer.forLog(alert.message(), 200)));
    }

    private void withdraw(EmergencyGrant grant, List<ComplianceAlert> raised) {
        lock.writeLock().lock();
        try {
            activeSessions.remove(grant.requestId());
            raised.forEach(alert -> alerts.remove(alert.id()));
            auditTrail.forgetRecentAccess(grant.userId(), grant.resourceAccessed(), grant.grantedAt());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void restore(EmergencyGrant grant) {
        lock.writeLock().lock();
        try {
            activeSessions.putIfAbsent(grant.requestId(), grant);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private AuditEntry grantEntry(EmergencyGrant grant, CallerContext caller, EmergencyAccessRequest request,
                                  List<ComplianceAlert> raised, String complianceStatus) {
        Map<String, Object> details = new HashMap<>();
        details.put("caller_id", caller.userId());
        details.put("access_type", grant.accessType().getValue());
        details.put("emergency_level", grant.level().getValue());
        details.put("justification", grant.justification());
        details.put("requested_by", grant.requestedBy());
        details.put("supervisor_id", grant.supervisorId());
        details.put("session_id", blankToNull(request.sessionId()));
        details.put("expires_at", grant.expiresAt().toString());
        details.put("restrictions", grant.restrictions());
        details.put("supervisor_notified", grant.supervisorNotified());
        details.put("compliance_status", complianceStatus);

        return AuditEntry.builder()
                .id(grant.auditEntryId())
                .requestId(grant.requestId())
                .userId(grant.userId())
                .actorRole(caller.role().getClaimValue())
                .subjectId(grant.patientId())
                .action(AuditAction.EMERGENCY_ACCESS_REQUESTED)
                .resource(grant.resourceAccessed())
                .granted(true)
                .basis("EMERGENCY")
                .reason(grant.justification())
                .alerts(raised.stream().map(alert -> alert.type().name()).toList())
                .details(details)
                .timestamp(grant.grantedAt())
                .build();
    }

    private static EmergencyAccessResponse toResponse(EmergencyGrant grant, String complianceStatus) {
        return EmergencyAccessResponse.builder()
                .requestId(grant.requestId())
                .accessGranted(true)
                .emergencyLevel(grant.level())
                .accessType(grant.accessType())
                .grantedAt(grant.grantedAt())
                .expiresAt(grant.expiresAt())
                .accessToken(grant.accessToken())
                .restrictions(grant.restrictions())
                .auditTrailId(grant.auditEntryId())
                .complianceStatus(complianceStatus)
                .alertsTriggered(grant.alertsTriggered())
                .supervisorNotified(grant.supervisorNotified())
                .build();
    }

    private static String accessToken(String requestId, Instant issuedAt) {
        return TOKEN_PREFIX + requestId.substring(0, 8) + "_" + issuedAt.getEpochSecond();
    }

    @Nullable
    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
