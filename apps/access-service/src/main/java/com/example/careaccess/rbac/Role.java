package com.example.careaccess.rbac;

import org.springframework.lang.Nullable;

import java.util.Arrays;

/**
 * Caller roles recognized by the authorization engine.
 *
 * <p>Each role carries the claim value the upstream authentication layer sends.
 */
public enum Role {
    RESIDENT("resident"),
    FAMILY_MEMBER("family"),
    HEALTH_PLAN_MEMBER("hp_member"),
    CARE_STAFF("care_staff"),
    CASE_MANAGER("case_manager"),
    CARE_MANAGER("care_manager"),
    ADMIN("admin");

    private final String claimValue;

    Role(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }

    /**
     * Resolves a claim value (or enum name) to a role.
     *
     * @return the role, or null when the value is not recognized
     */
    @Nullable
    public static Role fromClaim(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.claimValue.equalsIgnoreCase(normalized) || r.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(null);
    }
}
