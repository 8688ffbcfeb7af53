package com.example.careaccess.emergency.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Severity of an emergency access request. The level alone determines how long the grant lasts
 * and which restrictions apply.
 */
public enum EmergencyLevel {
    LOW("low", Duration.ofMinutes(30),
            List.of("requires_supervisor_approval", "read_only_access", "no_phi_access")),
    MODERATE("moderate", Duration.ofHours(1),
            List.of("requires_supervisor_review_within_4_hours", "limited_phi_access", "read_only_access")),
    HIGH("high", Duration.ofHours(2),
            List.of("requires_supervisor_review_within_2_hours", "limited_phi_access")),
    CRITICAL("critical", Duration.ofHours(4),
            List.of("requires_supervisor_review_within_1_hour"));

    private final String value;
    private final Duration grantDuration;
    private final List<String> restrictions;

    EmergencyLevel(String value, Duration grantDuration, List<String> restrictions) {
        this.value = value;
        this.grantDuration = grantDuration;
        this.restrictions = restrictions;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration getGrantDuration() {
        return grantDuration;
    }

    public List<String> getRestrictions() {
        return restrictions;
    }

    public boolean requiresSupervisorNotification() {
        return this == HIGH || this == CRITICAL;
    }

    @Nullable
    public static EmergencyLevel fromValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(l -> l.value.equalsIgnoreCase(normalized) || l.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(null);
    }
}
