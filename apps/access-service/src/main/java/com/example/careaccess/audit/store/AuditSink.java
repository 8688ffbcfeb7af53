package com.example.careaccess.audit.store;

import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.model.AuditQuery;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable, append-only store of audit entries. Implementations expose no update or delete path
 * other than setting {@code resolvedAt} once.
 */
public interface AuditSink {

    /**
     * Persists a new entry. Errors must be signalled, never dropped.
     */
    Mono<AuditEntry> append(@NonNull AuditEntry entry);

    /**
     * Entries matching the query, newest first, paged by {@link AuditQuery#page()} / {@link AuditQuery#size()}.
     */
    Flux<AuditEntry> query(@NonNull AuditQuery query);

    Mono<AuditEntry> findById(@NonNull String entryId);

    /**
     * Sets {@code resolvedAt} if it has not been set yet.
     *
     * @return true when this call set the value, false when the entry was missing or already resolved
     */
    Mono<Boolean> markResolved(@NonNull String entryId, @NonNull Instant at);
}
