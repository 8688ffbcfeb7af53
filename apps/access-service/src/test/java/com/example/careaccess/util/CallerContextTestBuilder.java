package com.example.careaccess.util;

import com.example.careaccess.rbac.Role;
import com.example.careaccess.security.context.CallerContext;

/**
 * Test builder for CallerContext.
 */
public class CallerContextTestBuilder {

    private String userId = "user-1";
    private Role role = Role.RESIDENT;

    public static CallerContextTestBuilder aCaller() {
        return new CallerContextTestBuilder();
    }

    public static CallerContext aResident(String userId) {
        return aCaller().withUserId(userId).withRole(Role.RESIDENT).build();
    }

    public static CallerContext aCareStaff(String userId) {
        return aCaller().withUserId(userId).withRole(Role.CARE_STAFF).build();
    }

    public static CallerContext anAdmin(String userId) {
        return aCaller().withUserId(userId).withRole(Role.ADMIN).build();
    }

    public CallerContextTestBuilder withUserId(String userId) {
        this.userId = userId;
        return this;
    }

    public CallerContextTestBuilder withRole(Role role) {
        this.role = role;
        return this;
    }

    public CallerContext build() {
        return new CallerContext(userId, role);
    }
}
