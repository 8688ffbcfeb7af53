package com.example.careaccess.consent.exception;

import lombok.Getter;

@Getter
public class ConsentConflictException extends RuntimeException {

    private final String consentId;

    public ConsentConflictException(String consentId, String message) {
        super(message);
        this.consentId = consentId;
    }
}
