package com.example.careaccess.rbac;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionRegistry")
class PermissionRegistryTest {

    private PermissionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PermissionRegistry();
    }

    @Nested
    @DisplayName("hasPermission")
    class HasPermission {

        @Test
        @DisplayName("should grant residents own data and chat history only")
        void shouldGrantResidentsOwnDataOnly() {
            assertThat(registry.getRolePermissions(Role.RESIDENT))
                    .containsExactlyInAnyOrder(Permission.ACCESS_OWN_DATA, Permission.ACCESS_CHAT_HISTORY);
        }

        @Test
        @DisplayName("should not grant residents access to others' data")
        void shouldDenyResidentOthersData() {
            assertThat(registry.hasPermission(Role.RESIDENT, Permission.ACCESS_OTHERS_DATA)).isFalse();
        }

        @Test
        @DisplayName("should grant family members family-member data and crisis escalation")
        void shouldGrantFamilyMemberData() {
            assertThat(registry.hasPermission(Role.FAMILY_MEMBER, Permission.ACCESS_FAMILY_MEMBER_DATA)).isTrue();
            assertThat(registry.hasPermission(Role.FAMILY_MEMBER, Permission.ESCALATE_CRISIS)).isTrue();
            assertThat(registry.hasPermission(Role.FAMILY_MEMBER, Permission.ACCESS_ASSIGNED_PATIENTS)).isFalse();
        }

        @Test
        @DisplayName("should grant care staff assigned patients and emergency data but not others' data")
        void shouldGrantCareStaffClinicalPermissions() {
            assertThat(registry.hasPermission(Role.CARE_STAFF, Permission.ACCESS_ASSIGNED_PATIENTS)).isTrue();
            assertThat(registry.hasPermission(Role.CARE_STAFF, Permission.ACCESS_EMERGENCY_DATA)).isTrue();
            assertThat(registry.hasPermission(Role.CARE_STAFF, Permission.EDIT_CARE_NOTES)).isTrue();
            assertThat(registry.hasPermission(Role.CARE_STAFF, Permission.ACCESS_OTHERS_DATA)).isFalse();
            assertThat(registry.hasPermission(Role.CARE_STAFF, Permission.VIEW_AUDIT_LOGS)).isFalse();
        }

        @Test
        @DisplayName("should give case managers care staff permissions plus audit and treatment plans")
        void shouldExtendCareStaffForCaseManager() {
            Set<Permission> careStaff = registry.getRolePermissions(Role.CARE_STAFF);
            Set<Permission> caseManager = registry.getRolePermissions(Role.CASE_MANAGER);

            assertThat(caseManager).containsAll(careStaff);
            assertThat(caseManager).contains(
                    Permission.ACCESS_OTHERS_DATA, Permission.VIEW_AUDIT_LOGS, Permission.MANAGE_TREATMENT_PLANS);
            assertThat(caseManager).doesNotContain(Permission.OVERRIDE_CONSENT);
        }

        @Test
        @DisplayName("should give care managers consent override and user management")
        void shouldGrantCareManagerAdministration() {
            assertThat(registry.hasPermission(Role.CARE_MANAGER, Permission.OVERRIDE_CONSENT)).isTrue();
            assertThat(registry.hasPermission(Role.CARE_MANAGER, Permission.MANAGE_USERS)).isTrue();
            assertThat(registry.hasPermission(Role.CARE_MANAGER, Permission.MANAGE_BILLING)).isFalse();
        }

        @ParameterizedTest
        @EnumSource(Permission.class)
        @DisplayName("should grant admin every permission")
        void shouldGrantAdminEverything(Permission permission) {
            assertThat(registry.hasPermission(Role.ADMIN, permission)).isTrue();
        }

        @Test
        @DisplayName("should fail closed for null role or permission")
        void shouldFailClosedForNulls() {
            assertThat(registry.hasPermission(null, Permission.ACCESS_OWN_DATA)).isFalse();
            assertThat(registry.hasPermission(Role.ADMIN, null)).isFalse();
            assertThat(registry.getRolePermissions(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("getRolePermissions")
    class GetRolePermissions {

        @Test
        @DisplayName("should return a copy that does not affect the registry")
        void shouldReturnDefensiveCopy() {
            Set<Permission> permissions = registry.getRolePermissions(Role.RESIDENT);
            permissions.add(Permission.MANAGE_USERS);

            assertThat(registry.hasPermission(Role.RESIDENT, Permission.MANAGE_USERS)).isFalse();
        }
    }

    @Nested
    @DisplayName("requiresAuditLog")
    class RequiresAuditLog {

        @Test
        @DisplayName("should always audit admin actions")
        void shouldAuditAdmin() {
            assertThat(registry.requiresAuditLog(Role.ADMIN, Permission.ACCESS_CHAT_HISTORY)).isTrue();
        }

        @Test
        @DisplayName("should audit sensitive permissions for any role")
        void shouldAuditSensitivePermissions() {
            assertThat(registry.requiresAuditLog(Role.CARE_STAFF, Permission.ACCESS_EMERGENCY_DATA)).isTrue();
            assertThat(registry.requiresAuditLog(Role.CASE_MANAGER, Permission.ACCESS_OTHERS_DATA)).isTrue();
            assertThat(registry.requiresAuditLog(Role.RESIDENT, Permission.OVERRIDE_CONSENT)).isTrue();
        }

        @Test
        @DisplayName("should not require audit for routine permissions")
        void shouldNotAuditRoutinePermissions() {
            assertThat(registry.requiresAuditLog(Role.RESIDENT, Permission.ACCESS_OWN_DATA)).isFalse();
            assertThat(registry.requiresAuditLog(Role.CARE_STAFF, null)).isFalse();
        }
    }

    @Nested
    @DisplayName("isEmergencyRole")
    class IsEmergencyRole {

        @Test
        @DisplayName("should recognize care staff, care managers and admins only")
        void shouldRecognizeEmergencyRoles() {
            assertThat(registry.getEmergencyRoles())
                    .containsExactlyInAnyOrder(Role.CARE_STAFF, Role.CARE_MANAGER, Role.ADMIN);
            assertThat(registry.isEmergencyRole(Role.CASE_MANAGER)).isFalse();
            assertThat(registry.isEmergencyRole(Role.FAMILY_MEMBER)).isFalse();
            assertThat(registry.isEmergencyRole(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Role.fromClaim")
    class RoleFromClaim {

        @Test
        @DisplayName("should resolve claim values and enum names case-insensitively")
        void shouldResolveClaims() {
            assertThat(Role.fromClaim("family")).isEqualTo(Role.FAMILY_MEMBER);
            assertThat(Role.fromClaim("HP_MEMBER")).isEqualTo(Role.HEALTH_PLAN_MEMBER);
            assertThat(Role.fromClaim("care_staff")).isEqualTo(Role.CARE_STAFF);
            assertThat(Role.fromClaim("CARE_MANAGER")).isEqualTo(Role.CARE_MANAGER);
        }

        @Test
        @DisplayName("should return null for unknown or blank claims")
        void shouldRejectUnknownClaims() {
            assertThat(Role.fromClaim("superuser")).isNull();
            assertThat(Role.fromClaim(" ")).isNull();
            assertThat(Role.fromClaim(null)).isNull();
        }
    }
}
