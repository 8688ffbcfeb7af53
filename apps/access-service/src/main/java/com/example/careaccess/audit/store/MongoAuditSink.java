package com.example.careaccess.audit.store;

import com.example.careaccess.audit.document.AuditEntryDocument;
import com.example.careaccess.audit.model.AuditEntry;
import com.example.careaccess.audit.model.AuditQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB-backed audit sink. Entries are inserted, never replaced; {@code resolvedAt} is set with a
 * conditional update so it can only be written once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
public class MongoAuditSink implements AuditSink {

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    public Mono<AuditEntry> append(@NonNull AuditEntry entry) {
        return mongoTemplate.insert(AuditEntryDocument.from(entry))
                .map(AuditEntryDocument::toEntry);
    }

    @Override
    public Flux<AuditEntry> query(@NonNull AuditQuery query) {
        Query mongoQuery = new Query(toCriteria(query))
                .with(Sort.by(Sort.Direction.DESC, "timestamp"))
                .skip(query.offset())
                .limit(query.size());
        return mongoTemplate.find(mongoQuery, AuditEntryDocument.class)
                .map(AuditEntryDocument::toEntry);
    }

    @Override
    public Mono<AuditEntry> findById(@NonNull String entryId) {
        return mongoTemplate.findById(entryId, AuditEntryDocument.class)
                .map(AuditEntryDocument::toEntry);
    }

    @Override
    public Mono<Boolean> markResolved(@NonNull String entryId, @NonNull Instant at) {
        Query unresolved = new Query(Criteria.where("_id").is(entryId).and("resolvedAt").is(null));
        return mongoTemplate.updateFirst(unresolved, new Update().set("resolvedAt", at), AuditEntryDocument.class)
                .map(result -> result.getModifiedCount() > 0);
    }

    private Criteria toCriteria(AuditQuery query) {
        List<Criteria> parts = new ArrayList<>();
        if (query.userId() != null) {
            parts.add(Criteria.where("userId").is(query.userId()));
        }
        if (query.action() != null) {
            parts.add(Criteria.where("action").is(query.action()));
        }
        if (query.requestId() != null) {
            parts.add(Criteria.where("requestId").is(query.requestId()));
        }
        if (query.subjectId() != null) {
            parts.add(Criteria.where("subjectId").is(query.subjectId()));
        }
        if (query.resource() != null) {
            parts.add(Criteria.where("resource").is(query.resource()));
        }
        if (query.granted() != null) {
            parts.add(Criteria.where("granted").is(query.granted()));
        }
        if (query.phiOnly()) {
            parts.add(Criteria.where("phi").is(true));
        }
        if (query.from() != null || query.to() != null) {
            Criteria range = Criteria.where("timestamp");
            if (query.from() != null) {
                range = range.gte(query.from());
            }
            if (query.to() != null) {
                range = range.lt(query.to());
            }
            parts.add(range);
        }
        return parts.isEmpty() ? new Criteria() : new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }
}
