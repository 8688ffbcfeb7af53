package com.example.careaccess.audit.store;

import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.model.AuditQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local audit sink for single-instance deployments and tests. Unbounded: entries are
 * never evicted.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryAuditSink implements AuditSink {

    private final Map<String, AuditEntry> entriesById = new ConcurrentHashMap<>();
    private final List<String> insertionOrder = Collections.synchronizedList(new ArrayList<>());

    public InMemoryAuditSink() {
        log.info("Using in-memory audit sink");
    }

    @Override
    public Mono<AuditEntry> append(@NonNull AuditEntry entry) {
        return Mono.fromCallable(() -> {
            if (entriesById.putIfAbsent(entry.id(), entry) != null) {
                throw new IllegalStateException("Audit entry already exists: " + entry.id());
            }
            insertionOrder.add(entry.id());
            return entry;
        });
    }

    @Override
    public Flux<AuditEntry> query(@NonNull AuditQuery query) {
        return Flux.defer(() -> {
            List<String> snapshot;
            synchronized (insertionOrder) {
                snapshot = new ArrayList<>(insertionOrder);
            }
            Collections.reverse(snapshot);
            return Flux.fromIterable(snapshot)
                    .map(entriesById::get)
                    .filter(query::matches)
                    .skip(query.offset())
                    .take(query.size());
        });
    }

    @Override
    public Mono<AuditEntry> findById(@NonNull String entryId) {
        return Mono.justOrEmpty(entriesById.get(entryId));
    }

    @Override
    public Mono<Boolean> markResolved(@NonNull String entryId, @NonNull Instant at) {
        return Mono.fromCallable(() -> {
            AtomicBoolean updated = new AtomicBoolean(false);
            entriesById.computeIfPresent(entryId, (id, existing) -> {
                if (existing.isResolved()) {
                    return existing;
                }
                updated.set(true);
                return existing.withResolvedAt(at);
            });
            return updated.get();
        });
    }

    public int size() {
        return entriesById.size();
    }
}
