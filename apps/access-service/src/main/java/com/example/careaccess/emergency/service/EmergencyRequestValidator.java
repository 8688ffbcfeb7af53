package com.example.careaccess.emergency.service;

import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.config.properties.EmergencyAccessProperties;
import com.example.careaccess.emergency.model.EmergencyAccessType;
import com.example.careaccess.emergency.model.EmergencyLevel;
import com.example.careaccess.emergency.model.request.EmergencyAccessRequest;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks for emergency requests. The justification length is an input-quality
 * heuristic, not a judgement of the justification itself.
 */
@Component
public class EmergencyRequestValidator {

    private final int minJustificationLength;

    public EmergencyRequestValidator(EmergencyAccessProperties properties) {
        this.minJustificationLength = properties.minJustificationLength();
    }

    @NonNull
    public List<String> validate(@NonNull EmergencyAccessRequest request) {
        List<String> errors = new ArrayList<>();

        if (request.userId() == null || request.userId().isBlank()) {
            errors.add("userId is required");
        } else if (!StringSanitizer.isValidUserId(request.userId().trim())) {
            errors.add("userId is malformed");
        }

        if (request.accessType() == null || request.accessType().isBlank()) {
            errors.add("accessType is required");
        } else if (EmergencyAccessType.fromValue(request.accessType()) == null) {
            errors.add("accessType is not recognized");
        }

        if (request.emergencyLevel() == null || request.emergencyLevel().isBlank()) {
            errors.add("emergencyLevel is required");
        } else if (EmergencyLevel.fromValue(request.emergencyLevel()) == null) {
            errors.add("emergencyLevel is not recognized");
        }

        if (request.justification() == null || request.justification().isBlank()) {
            errors.add("justification is required");
        } else if (request.justification().trim().length() < minJustificationLength) {
            errors.add("justification must be at least " + minJustificationLength + " characters");
        }

        if (request.resourceAccessed() == null || request.resourceAccessed().isBlank()) {
            errors.add("resourceAccessed is required");
        }

        if (request.requestedBy() == null || request.requestedBy().isBlank()) {
            errors.add("requestedBy is required");
        }

        return errors;
    }
}
