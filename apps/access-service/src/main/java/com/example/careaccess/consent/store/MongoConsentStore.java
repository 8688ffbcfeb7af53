package com.example.careaccess.consent.store;

import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.consent.document.ConsentDocument;
import com.example.careaccess.consent.exception.ConsentConflictException;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.ConsentStatus;
import com.example.careaccess.consent.repository.ConsentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * MongoDB consent store. Uniqueness of ACTIVE consents is enforced by a partial unique index, so
 * a concurrent duplicate insert surfaces as {@link DuplicateKeyException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "mongo")
public class MongoConsentStore implements ConsentStore {

    private final ConsentRepository repository;
    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    public Mono<Consent> findActive(@NonNull String patientId, @NonNull String granteeId,
                                    @NonNull AccessPurpose purpose) {
        return repository.findFirstByPatientIdAndGranteeIdAndPurposeAndStatus(
                        patientId, granteeId, purpose, ConsentStatus.ACTIVE)
                .map(ConsentDocument::toConsent);
    }

    @Override
    public Mono<Consent> findById(@NonNull String consentId) {
        return repository.findById(consentId).map(ConsentDocument::toConsent);
    }

    @Override
    public Flux<Consent> findByPatient(@NonNull String patientId) {
        return repository.findByPatientIdOrderByGrantedAtDesc(patientId).map(ConsentDocument::toConsent);
    }

    @Override
    public Mono<Consent> insertActive(@NonNull Consent consent) {
        return mongoTemplate.insert(ConsentDocument.from(consent))
                .map(ConsentDocument::toConsent)
                .onErrorMap(DuplicateKeyException.class, e -> new ConsentConflictException(null,
                        "An active consent already exists for this patient, grantee and purpose"));
    }

    @Override
    public Mono<Consent> transition(@NonNull Consent updated, @NonNull ConsentStatus expected) {
        Query query = new Query(Criteria.where("_id").is(updated.id()).and("status").is(expected));
        return mongoTemplate.findAndReplace(query, ConsentDocument.from(updated),
                        FindAndReplaceOptions.options().returnNew())
                .map(ConsentDocument::toConsent);
    }
}
