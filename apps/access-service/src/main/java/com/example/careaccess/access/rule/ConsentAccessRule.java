package com.example.careaccess.access.rule;

import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.model.RuleDecision;
import com.example.careaccess.common.exception.BackendUnavailableException;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.store.ConsentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Grants access when the subject has an effective consent for this grantee and purpose that covers
 * every requested data category. The consent is read once and the decision is made on that snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsentAccessRule implements AccessRule {

    private final ConsentStore consentStore;
    private final Clock clock;

    @Override
    public String getRuleId() {
        return "PATIENT_CONSENT";
    }

    @Override
    public String getDescription() {
        return "Active patient consent covering all requested data types";
    }

    @Override
    public int getPriority() {
        return 200;
    }

    @Override
    public boolean appliesTo(AccessRequest request) {
        return request.purpose() != null && !request.isSelfAccess();
    }

    @Override
    public Mono<RuleDecision> evaluate(AccessRequest request) {
        return consentStore.findActive(request.subjectId(), request.actorId(), request.purpose())
                .onErrorMap(e -> !(e instanceof BackendUnavailableException),
                        e -> new BackendUnavailableException("ConsentStore", "Consent lookup failed", e))
                .map(consent -> decide(consent, request))
                .defaultIfEmpty(RuleDecision.notApplicable(getRuleId()));
    }

    private RuleDecision decide(Consent consent, AccessRequest request) {
        if (!consent.isEffective(clock.instant())) {
            log.debug("Consent {} is no longer effective", consent.id());
            return RuleDecision.notApplicable(getRuleId());
        }
        if (!consent.covers(request.requestedDataTypes())) {
            log.debug("Consent {} does not cover requested data types {}", consent.id(), request.requestedDataTypes());
            return RuleDecision.notApplicable(getRuleId());
        }
        return RuleDecision.grantByConsent(getRuleId(), consent.id(),
                String.format("Access granted via patient consent for %s", request.purpose().getValue()));
    }
}
