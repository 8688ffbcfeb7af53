package com.example.careaccess.consent.store;

import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.consent.exception.ConsentConflictException;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.ConsentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryConsentStore implements ConsentStore {

    private final Map<String, Consent> consentsById = new ConcurrentHashMap<>();
    // (patient, grantee, purpose) -> id of the ACTIVE consent
    private final Map<Consent.ConsentKey, String> activeIndex = new ConcurrentHashMap<>();

    public InMemoryConsentStore() {
        log.info("Using in-memory consent store");
    }

    @Override
    public Mono<Consent> findActive(@NonNull String patientId, @NonNull String granteeId,
                                    @NonNull AccessPurpose purpose) {
        return Mono.fromCallable(() -> {
            String id = activeIndex.get(new Consent.ConsentKey(patientId, granteeId, purpose));
            if (id == null) {
                return null;
            }
            Consent consent = consentsById.get(id);
            return consent != null && consent.status() == ConsentStatus.ACTIVE ? consent : null;
        });
    }

    @Override
    public Mono<Consent> findById(@NonNull String consentId) {
        return Mono.justOrEmpty(consentsById.get(consentId));
    }

    @Override
    public Flux<Consent> findByPatient(@NonNull String patientId) {
        return Flux.defer(() -> Flux.fromStream(consentsById.values().stream()
                .filter(c -> patientId.equals(c.patientId()))
                .sorted(Comparator.comparing(Consent::grantedAt).reversed())));
    }

    @Override
    public Mono<Consent> insertActive(@NonNull Consent consent) {
        return Mono.fromCallable(() -> {
            consentsById.put(consent.id(), consent);
            String existing = activeIndex.putIfAbsent(consent.key(), consent.id());
            if (existing != null) {
                consentsById.remove(consent.id());
                throw new ConsentConflictException(existing,
                        "An active consent already exists for this patient, grantee and purpose");
            }
            return consent;
        });
    }

    @Override
    public Mono<Consent> transition(@NonNull Consent updated, @NonNull ConsentStatus expected) {
        return Mono.fromCallable(() -> {
            AtomicBoolean applied = new AtomicBoolean(false);
            consentsById.computeIfPresent(updated.id(), (id, current) -> {
                if (current.status() != expected) {
                    return current;
                }
                applied.set(true);
                return updated;
            });
            if (!applied.get()) {
                return null;
            }
            if (updated.status() != ConsentStatus.ACTIVE) {
                activeIndex.remove(updated.key(), updated.id());
            }
            return updated;
        });
    }
}
