package com.example.careaccess.access.rule;

import com.example.careaccess.access.model.AccessBasis;
import com.example.careaccess.access.model.AccessRequest;
import com.example.careaccess.access.model.RuleDecision;
import com.example.careaccess.rbac.Permission;
import com.example.careaccess.rbac.PermissionRegistry;
import com.example.careaccess.relationship.service.CareAssignmentDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.Set;

/**
 * Role-based access to another person's data. Holding a cross-subject permission is not enough:
 * the care-assignment directory must confirm an active relationship with the subject.
 */
@Component
@RequiredArgsConstructor
public class CareAssignmentAccessRule implements AccessRule {

    private static final Set<Permission> CROSS_SUBJECT_PERMISSIONS = EnumSet.of(
            Permission.ACCESS_ASSIGNED_PATIENTS,
            Permission.ACCESS_OTHERS_DATA,
            Permission.ACCESS_FAMILY_MEMBER_DATA);

    private final PermissionRegistry permissionRegistry;
    private final CareAssignmentDirectory assignmentDirectory;

    @Override
    public String getRuleId() {
        return "CARE_ASSIGNMENT";
    }

    @Override
    public String getDescription() {
        return "Role permission plus active care assignment";
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean appliesTo(AccessRequest request) {
        return !request.isSelfAccess()
                && CROSS_SUBJECT_PERMISSIONS.stream()
                .anyMatch(p -> permissionRegistry.hasPermission(request.actorRole(), p));
    }

    @Override
    public Mono<RuleDecision> evaluate(AccessRequest request) {
        return assignmentDirectory.hasActiveAssignment(request.actorId(), request.subjectId())
                .map(assigned -> assigned
                        ? RuleDecision.grant(getRuleId(), AccessBasis.ROLE, String.format(
                                "Access granted via %s role with active care assignment",
                                request.actorRole().getClaimValue()))
                        : RuleDecision.notApplicable(getRuleId()));
    }
}
