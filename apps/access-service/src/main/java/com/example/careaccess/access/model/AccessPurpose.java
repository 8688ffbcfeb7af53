package com.example.careaccess.access.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Arrays;

/**
 * Declared purpose of an access request.
 */
public enum AccessPurpose {
    TREATMENT("treatment"),
    PAYMENT("payment"),
    OPERATIONS("operations"),
    EMERGENCY("emergency"),
    PATIENT_REQUEST("patient_request"),
    LEGAL_REQUIREMENT("legal_requirement"),
    FAMILY_CARE("family_care");

    private final String value;

    AccessPurpose(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    @Nullable
    public static AccessPurpose fromValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown access purpose: " + value));
    }
}
