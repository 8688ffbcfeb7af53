package com.example.careaccess.emergency.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Arrays;

public enum EmergencyAccessType {
    CRISIS_INTERVENTION("crisis_intervention"),
    MEDICAL_EMERGENCY("medical_emergency"),
    SAFETY_OVERRIDE("safety_override"),
    THERAPEUTIC_URGENT("therapeutic_urgent"),
    SYSTEM_MAINTENANCE("system_maintenance"),
    COMPLIANCE_AUDIT("compliance_audit");

    private final String value;

    EmergencyAccessType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Nullable
    public static EmergencyAccessType fromValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(null);
    }
}
