package com.example.careaccess.access.model;

public enum AccessBasis {
    SELF,
    EMERGENCY,
    CONSENT,
    ROLE,
    DENIED
}
