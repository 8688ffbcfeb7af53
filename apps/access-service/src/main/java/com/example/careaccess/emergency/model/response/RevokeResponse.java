package com.example.careaccess.emergency.model.response;

public record RevokeResponse(
        String requestId,
        Outcome outcome
) {
    public enum Outcome {
        REVOKED,
        ALREADY_INACTIVE
    }
}
