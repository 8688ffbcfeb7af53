package com.example.careaccess.consent.model;

public enum ConsentStatus {
    ACTIVE,
    REVOKED,
    EXPIRED
}
