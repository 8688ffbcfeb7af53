package com.example.careaccess.access.engine;

import com.example.careaccess.access.model.AccessDecision;
import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.model.RuleDecision;
import com.example.careaccess.access.rule.AccessRule;
import com.example.careaccess.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves an access request into a decision.
 *
 * <p>Combining algorithm: first applicable, deny-biased
 * - Rules run one at a time in priority order (self, emergency, consent, care assignment)
 * - The first GRANT or DENY wins; later rules are never evaluated
 * - If no rule decides, access is denied
 * - If a rule's collaborator fails, access is denied
 *
 * <p>Rules are discovered via component scanning.
 */
@Slf4j
@Component
public class AccessDecisionEngine {

    public static final String DEFAULT_DENY = "DEFAULT_DENY";
    public static final String BACKEND_FAILURE = "BACKEND_FAILURE";
    public static final String UNKNOWN_ROLE = "UNKNOWN_ROLE";
    public static final String NO_AUTHORIZATION_REASON = "No valid authorization found for requested access";

    private final List<AccessRule> rules;
    private final Clock clock;

    public AccessDecisionEngine(List<AccessRule> rules, Clock clock) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(AccessRule::getPriority).reversed())
                .toList();
        this.clock = clock;

        log.info("Access decision engine initialized with {} rules", this.rules.size());
        this.rules.forEach(r -> log.debug("  - {} (priority={}): {}",
                r.getRuleId(), r.getPriority(), r.getDescription()));
    }

    public Mono<AccessDecision> checkAccess(AccessRequest request) {
        if (request.actorRole() == null) {
            return Mono.fromSupplier(() -> AccessDecision.denied(UNKNOWN_ROLE, "Unrecognized role", clock.instant()));
        }

        return Flux.fromIterable(rules)
                .filter(rule -> rule.appliesTo(request))
                .concatMap(rule -> rule.evaluate(request))
                .filter(decision -> !decision.isNotApplicable())
                .next()
                .map(decision -> toAccessDecision(decision, request))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Access DENIED (no applicable rule): actor={}, subject={}, purpose={}",
                            StringSanitizer.forLog(request.actorId()),
                            StringSanitizer.forLog(request.subjectId()), request.purpose());
                    return AccessDecision.denied(DEFAULT_DENY, NO_AUTHORIZATION_REASON, clock.instant());
                }))
                .onErrorResume(e -> {
                    log.error("Access DENIED (backend failure): actor={}, subject={}, error={}",
                            StringSanitizer.forLog(request.actorId()),
                            StringSanitizer.forLog(request.subjectId()),
                            StringSanitizer.forLog(e.getMessage(), 200));
                    return Mono.just(AccessDecision.denied(BACKEND_FAILURE,
                            "Authorization backend unavailable; access denied", clock.instant()));
                });
    }

    public List<AccessRule> getRules() {
        return rules;
    }

    private AccessDecision toAccessDecision(RuleDecision decision, AccessRequest request) {
        if (decision.isGranted()) {
            log.info("Access GRANTED by rule {}: {} (actor={}, subject={})",
                    decision.ruleId(), decision.reason(),
                    StringSanitizer.forLog(request.actorId()), StringSanitizer.forLog(request.subjectId()));
            return new AccessDecision(true, decision.basis(), decision.reason(),
                    decision.consentId(), decision.ruleId(), clock.instant());
        }
        log.warn("Access DENIED by rule {}: {} (actor={}, subject={})",
                decision.ruleId(), decision.reason(),
                StringSanitizer.forLog(request.actorId()), StringSanitizer.forLog(request.subjectId()));
        return AccessDecision.denied(decision.ruleId(), decision.reason(), clock.instant());
    }
}
