package com.example.careaccess.audit.service;

import com.example.careaccess.audit.exception.AuditPersistenceException;
import com.example.careaccess.audit.model.AuditAction;
import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.model.AuditQuery;
import com.example.careaccess.audit.store.AuditSink;
import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.config.properties.AuditProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit trail for access decisions and emergency/consent transitions.
 *
 * <p>Every appended entry is persisted to the {@link AuditSink} and then written as one JSON line
 * to the {@code ACCESS_AUDIT} logger. A persistence failure is surfaced as
 * {@link AuditPersistenceException}; callers must not treat an unaudited action as complete.
 */
@Slf4j
@Service
public class AuditTrail {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ACCESS_AUDIT");

    private final AuditSink sink;
    private final RecentAccessCache recentAccessCache;
    private final PhiClassifier phiClassifier;
    private final ObjectMapper objectMapper;
    private final AuditProperties properties;
    private final Clock clock;

    public AuditTrail(AuditSink sink,
                      RecentAccessCache recentAccessCache,
                      PhiClassifier phiClassifier,
                      ObjectMapper objectMapper,
                      AuditProperties properties,
                      Clock clock) {
        this.sink = sink;
        this.recentAccessCache = recentAccessCache;
        this.phiClassifier = phiClassifier;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Assigns id, timestamp and PHI flag (when absent) and persists the entry.
     */
    public Mono<AuditEntry> append(@NonNull AuditEntry draft) {
        AuditEntry entry = complete(draft);
        return sink.append(entry)
                .onErrorMap(e -> !(e instanceof AuditPersistenceException),
                        e -> new AuditPersistenceException("Failed to persist audit entry " + entry.id(), e))
                .doOnError(e -> AUDIT_LOG.error("Audit append failed: action={}, user={}, reason={}",
                        entry.action(), StringSanitizer.forLog(entry.userId()),
                        StringSanitizer.forLog(e.getMessage(), 200)))
                .doOnNext(this::logEntry);
    }

    public Flux<AuditEntry> query(@NonNull AuditQuery query) {
        return sink.query(normalize(query));
    }

    public Mono<AuditEntry> findById(@NonNull String entryId) {
        return sink.findById(entryId);
    }

    /**
     * Sets the entry's resolved timestamp once. Later calls for the same entry report false.
     */
    public Mono<Boolean> markResolved(@NonNull String entryId, @NonNull Instant at) {
        return sink.markResolved(entryId, at)
                .onErrorMap(e -> new AuditPersistenceException("Failed to resolve audit entry " + entryId, e))
                .doOnNext(updated -> {
                    if (!updated) {
                        log.debug("Audit entry {} already resolved or missing", StringSanitizer.forLog(entryId));
                    }
                });
    }

    /**
     * Remembers an emergency request for access-pattern detection.
     */
    public void recordRecentAccess(@NonNull String userId, @NonNull String resource, @NonNull Instant at) {
        recentAccessCache.record(userId, resource, at);
    }

    /**
     * Drops a remembered request whose grant was withdrawn before it was audited.
     */
    public void forgetRecentAccess(@NonNull String userId, @NonNull String resource, @NonNull Instant at) {
        recentAccessCache.remove(userId, resource, at);
    }

    public int countRecentAccess(@NonNull String userId, @NonNull String resource, @NonNull Duration lookback) {
        return recentAccessCache.count(userId, resource, lookback, clock.instant());
    }

    public boolean involvesPhi(String resource) {
        return phiClassifier.involvesPhi(resource);
    }

    private AuditEntry complete(AuditEntry draft) {
        AuditEntry.AuditEntryBuilder builder = draft.toBuilder();
        if (draft.id() == null) {
            builder.id(UUID.randomUUID().toString());
        }
        if (draft.timestamp() == null) {
            builder.timestamp(clock.instant());
        }
        if (!draft.phi() && phiClassifier.involvesPhi(draft.resource())) {
            builder.phi(true);
        }
        return builder.build();
    }

    private AuditQuery normalize(AuditQuery query) {
        int size = query.size() <= 0 ? properties.defaultPageSize() : Math.min(query.size(), properties.maxPageSize());
        return query.toBuilder()
                .page(Math.max(query.page(), 0))
                .size(size)
                .build();
    }

    private void logEntry(AuditEntry entry) {
        try {
            String json = objectMapper.writeValueAsString(entry.toStructuredLog());
            if (isWarning(entry)) {
                AUDIT_LOG.warn(json);
            } else {
                AUDIT_LOG.info(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit entry: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(entry);
        }
    }

    private boolean isWarning(AuditEntry entry) {
        if (!entry.alerts().isEmpty()) {
            return true;
        }
        boolean decision = entry.action() == AuditAction.ACCESS_DECISION
                || entry.action() == AuditAction.EMERGENCY_ACCESS_REQUESTED;
        return decision && !entry.granted();
    }

    private void logFallback(AuditEntry entry) {
        AUDIT_LOG.warn("Audit {} - id={}, user={}, subject={}, resource={}, granted={}, basis={}, reason={}",
                entry.action(),
                entry.id(),
                StringSanitizer.forLog(entry.userId()),
                StringSanitizer.forLog(entry.subjectId()),
                StringSanitizer.forLog(entry.resource()),
                entry.granted(),
                entry.basis(),
                StringSanitizer.forLog(entry.reason(), 200));
    }
}
