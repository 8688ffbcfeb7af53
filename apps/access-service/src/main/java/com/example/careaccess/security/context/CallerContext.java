package com.example.careaccess.security.context;

import com.example.careaccess.rbac.Role;
import org.springframework.lang.NonNull;

import java.util.Objects;

/**
 * Verified caller claim supplied by the upstream authentication layer.
 */
public record CallerContext(
        @NonNull String userId,
        @NonNull Role role
) {
    public CallerContext {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(role, "role is required");
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean is(String otherUserId) {
        return userId.equals(otherUserId);
    }
}
