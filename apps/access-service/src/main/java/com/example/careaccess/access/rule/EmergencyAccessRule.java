package com.example.careaccess.access.rule;

import com.example.careaccess.access.model.AccessBasis;
import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.model.RuleDecision;
import com.example.careaccess.rbac.PermissionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Emergency-purpose requests carrying a justification. Consent is not consulted; only
 * emergency-capable roles are granted and everyone else is denied here.
 */
@Component
@RequiredArgsConstructor
public class EmergencyAccessRule implements AccessRule {

    private final PermissionRegistry permissionRegistry;

    @Override
    public String getRuleId() {
        return "EMERGENCY_ACCESS";
    }

    @Override
    public String getDescription() {
        return "Emergency purpose with justification, restricted to emergency roles";
    }

    @Override
    public int getPriority() {
        return 300;
    }

    @Override
    public boolean appliesTo(AccessRequest request) {
        return request.purpose() == AccessPurpose.EMERGENCY && request.hasEmergencyJustification();
    }

    @Override
    public Mono<RuleDecision> evaluate(AccessRequest request) {
        if (permissionRegistry.isEmergencyRole(request.actorRole())) {
            return Mono.just(RuleDecision.grant(getRuleId(), AccessBasis.EMERGENCY,
                    "Emergency access granted with justification"));
        }
        String role = request.actorRole() != null ? request.actorRole().getClaimValue() : "unknown";
        return Mono.just(RuleDecision.deny(getRuleId(),
                String.format("%s role not authorized for emergency access", role)));
    }
}
