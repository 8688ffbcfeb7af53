package com.example.careaccess.emergency.model;

public enum AlertType {
    MULTIPLE_CONCURRENT_EMERGENCY_ACCESS,
    CRITICAL_ACCESS_NO_SUPERVISOR,
    SUSPICIOUS_ACCESS_PATTERN
}
