package com.example.careaccess.audit.service;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristic that tags audit entries touching protected health information.
 * Reporting only; access decisions never consult it.
 */
@Component
public class PhiClassifier {

    private static final List<String> PHI_KEYWORDS = List.of(
            "patient", "medical", "health", "phi", "therapy", "clinical", "diagnosis", "treatment");

    public boolean involvesPhi(@Nullable String resource) {
        if (resource == null || resource.isBlank()) {
            return false;
        }
        String lower = resource.toLowerCase(Locale.ROOT);
        return PHI_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
