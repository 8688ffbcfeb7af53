package com.example.careaccess.access.rule;

import com.example.careaccess.access.model.AccessBasis;
import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.model.RuleDecision;
import com.example.careaccess.rbac.Permission;
import com.example.careaccess.rbac.PermissionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Actors reading their own record. Decisive: a role without own-data permission is denied
 * outright rather than falling through to consent.
 */
@Component
@RequiredArgsConstructor
public class SelfAccessRule implements AccessRule {

    private final PermissionRegistry permissionRegistry;

    @Override
    public String getRuleId() {
        return "SELF_ACCESS";
    }

    @Override
    public String getDescription() {
        return "Actor accessing their own data";
    }

    @Override
    public int getPriority() {
        return 400;
    }

    @Override
    public boolean appliesTo(AccessRequest request) {
        return request.isSelfAccess();
    }

    @Override
    public Mono<RuleDecision> evaluate(AccessRequest request) {
        if (permissionRegistry.hasPermission(request.actorRole(), Permission.ACCESS_OWN_DATA)) {
            return Mono.just(RuleDecision.grant(getRuleId(), AccessBasis.SELF, "Access to own data"));
        }
        return Mono.just(RuleDecision.deny(getRuleId(),
                String.format("%s role not authorized to access own data", roleName(request))));
    }

    private static String roleName(AccessRequest request) {
        return request.actorRole() != null ? request.actorRole().getClaimValue() : "unknown";
    }
}
