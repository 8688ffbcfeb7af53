package com.example.careaccess.consent.repository;

import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.consent.document.ConsentDocument;
import com.example.careaccess.consent.model.ConsentStatus;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ConsentRepository extends ReactiveMongoRepository<ConsentDocument, String> {

    Mono<ConsentDocument> findFirstByPatientIdAndGranteeIdAndPurposeAndStatus(
            String patientId, String granteeId, AccessPurpose purpose, ConsentStatus status);

    Flux<ConsentDocument> findByPatientIdOrderByGrantedAtDesc(String patientId);
}
