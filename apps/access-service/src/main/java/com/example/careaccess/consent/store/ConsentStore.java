package com.example.careaccess.consent.store;

import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.ConsentStatus;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for consent records.
 */
public interface ConsentStore {

    /**
     * The stored ACTIVE consent for the tuple, if any. The result may already be past its expiry;
     * callers check {@link Consent#isEffective}.
     */
    Mono<Consent> findActive(@NonNull String patientId, @NonNull String granteeId, @NonNull AccessPurpose purpose);

    Mono<Consent> findById(@NonNull String consentId);

    Flux<Consent> findByPatient(@NonNull String patientId);

    /**
     * Inserts an ACTIVE consent. Fails with
     * {@link com.example.careaccess.consent.exception.ConsentConflictException} if another ACTIVE
     * consent exists for the same tuple, including one inserted concurrently.
     */
    Mono<Consent> insertActive(@NonNull Consent consent);

    /**
     * Replaces a consent that still has status {@code expected}. Completes empty when the stored
     * status changed in the meantime.
     */
    Mono<Consent> transition(@NonNull Consent updated, @NonNull ConsentStatus expected);
}
