package com.example.careaccess.relationship.service;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Answers whether an actor currently has an active care relationship with a subject
 * (assigned caregiver, case manager or family member).
 *
 * <p>Implementations signal {@link com.example.careaccess.common.exception.BackendUnavailableException}
 * when they cannot answer; they never guess.
 */
public interface CareAssignmentDirectory {

    Mono<Boolean> hasActiveAssignment(@NonNull String actorId, @NonNull String subjectId);
}
