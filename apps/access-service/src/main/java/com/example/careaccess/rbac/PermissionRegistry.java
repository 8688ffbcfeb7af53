package com.example.careaccess.rbac;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.example.careaccess.rbac.Permission.*;

/**
 * Static role to permission matrix.
 *
 * <p>Lookups are pure and fail closed: an unknown or null role or permission is never granted.
 */
@Slf4j
@Component
public class PermissionRegistry {

    private static final Set<Role> EMERGENCY_ROLES =
            Collections.unmodifiableSet(EnumSet.of(Role.CARE_STAFF, Role.CARE_MANAGER, Role.ADMIN));

    private static final Set<Permission> SENSITIVE_PERMISSIONS = Collections.unmodifiableSet(EnumSet.of(
            ACCESS_OTHERS_DATA,
            ACCESS_EMERGENCY_DATA,
            OVERRIDE_CONSENT,
            MODIFY_SYSTEM_SETTINGS,
            MANAGE_USERS));

    private final Map<Role, Set<Permission>> matrix;

    public PermissionRegistry() {
        this.matrix = buildMatrix();
        log.info("Permission registry initialized with {} roles", matrix.size());
    }

    public boolean hasPermission(@Nullable Role role, @Nullable Permission permission) {
        if (role == null || permission == null) {
            return false;
        }
        Set<Permission> granted = matrix.get(role);
        return granted != null && granted.contains(permission);
    }

    /**
     * Returns a copy of the permissions held by a role. Mutating the result has no effect on the registry.
     */
    @NonNull
    public Set<Permission> getRolePermissions(@Nullable Role role) {
        if (role == null || !matrix.containsKey(role)) {
            return EnumSet.noneOf(Permission.class);
        }
        return EnumSet.copyOf(matrix.get(role));
    }

    public boolean requiresAuditLog(@Nullable Role role, @Nullable Permission permission) {
        if (role == Role.ADMIN) {
            return true;
        }
        return permission != null && SENSITIVE_PERMISSIONS.contains(permission);
    }

    public boolean isEmergencyRole(@Nullable Role role) {
        return role != null && EMERGENCY_ROLES.contains(role);
    }

    @NonNull
    public Set<Role> getEmergencyRoles() {
        return EMERGENCY_ROLES;
    }

    private static Map<Role, Set<Permission>> buildMatrix() {
        Map<Role, Set<Permission>> m = new EnumMap<>(Role.class);

        m.put(Role.RESIDENT, EnumSet.of(ACCESS_OWN_DATA, ACCESS_CHAT_HISTORY));

        m.put(Role.FAMILY_MEMBER, EnumSet.of(
                ACCESS_OWN_DATA, ACCESS_FAMILY_MEMBER_DATA, ESCALATE_CRISIS, ACCESS_CHAT_HISTORY));

        m.put(Role.HEALTH_PLAN_MEMBER, EnumSet.of(ACCESS_OWN_DATA, ESCALATE_CRISIS, ACCESS_CHAT_HISTORY));

        EnumSet<Permission> careStaff = EnumSet.of(
                ACCESS_OWN_DATA, ACCESS_ASSIGNED_PATIENTS, ESCALATE_CRISIS, ACCESS_EMERGENCY_DATA,
                COORDINATE_CARE, VIEW_CARE_NOTES, EDIT_CARE_NOTES, ACCESS_CHAT_HISTORY, SEND_SYSTEM_MESSAGES);
        m.put(Role.CARE_STAFF, careStaff);

        EnumSet<Permission> caseManager = EnumSet.copyOf(careStaff);
        caseManager.addAll(EnumSet.of(ACCESS_OTHERS_DATA, VIEW_AUDIT_LOGS, MANAGE_TREATMENT_PLANS));
        m.put(Role.CASE_MANAGER, caseManager);

        EnumSet<Permission> careManager = EnumSet.copyOf(caseManager);
        careManager.addAll(EnumSet.of(MODIFY_SYSTEM_SETTINGS, MANAGE_USERS, OVERRIDE_CONSENT, MODERATE_CONTENT));
        m.put(Role.CARE_MANAGER, careManager);

        m.put(Role.ADMIN, EnumSet.allOf(Permission.class));

        m.replaceAll((role, perms) -> Collections.unmodifiableSet(perms));
        return Collections.unmodifiableMap(m);
    }
}
