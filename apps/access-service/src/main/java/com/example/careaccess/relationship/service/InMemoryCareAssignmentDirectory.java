package com.example.careaccess.relationship.service;

import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.config.properties.RelationshipProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
@ConditionalOnProperty(name = "app.relationship.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCareAssignmentDirectory implements CareAssignmentDirectory {

    private final Set<Assignment> assignments = ConcurrentHashMap.newKeySet();

    public InMemoryCareAssignmentDirectory(RelationshipProperties properties) {
        properties.assignments().forEach(a -> assign(a.actorId(), a.subjectId()));
        log.info("In-memory care assignment directory seeded with {} assignments", assignments.size());
    }

    @Override
    public Mono<Boolean> hasActiveAssignment(@NonNull String actorId, @NonNull String subjectId) {
        return Mono.fromCallable(() -> assignments.contains(new Assignment(actorId, subjectId)));
    }

    public void assign(@NonNull String actorId, @NonNull String subjectId) {
        assignments.add(new Assignment(actorId, subjectId));
        log.debug("Assigned {} to {}", StringSanitizer.forLog(actorId), StringSanitizer.forLog(subjectId));
    }

    public void unassign(@NonNull String actorId, @NonNull String subjectId) {
        assignments.remove(new Assignment(actorId, subjectId));
    }

    private record Assignment(String actorId, String subjectId) {
    }
}
