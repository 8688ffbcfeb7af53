package com.example.careaccess.access.rule;

import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.model.RuleDecision;
import reactor.core.publisher.Mono;

/**
 * A single step of the access precedence chain.
 */
public interface AccessRule {

    String getRuleId();

    String getDescription();

    /**
     * Higher runs first. The first rule returning GRANT or DENY decides the request.
     */
    int getPriority();

    /**
     * Evaluate the rule. Completes with NOT_APPLICABLE when the rule has no opinion; signals an
     * error when a collaborator it depends on is unavailable.
     */
    Mono<RuleDecision> evaluate(AccessRequest request);

    /**
     * Cheap pre-check before {@link #evaluate}.
     */
    default boolean appliesTo(AccessRequest request) {
        return true;
    }
}
