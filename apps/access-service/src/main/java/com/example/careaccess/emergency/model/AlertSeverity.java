package com.example.careaccess.emergency.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertSeverity {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL;

    public boolean requiresAction() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
