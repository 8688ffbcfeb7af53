package com.example.careaccess.consent.model;

import com.example.careaccess.access.model.AccessPurpose;
import lombok.Builder;
import org.springframework.lang.NonNull;

import java.time.Instant;
import java.util.Set;

/**
 * Patient-granted permission for a grantee to read specific data categories for one purpose.
 *
 * <p>Records are never deleted. A consent is effective only while it is ACTIVE, not revoked,
 * and its expiry (if any) lies in the future.
 */
@Builder(toBuilder = true)
public record Consent(
        String id,
        String patientId,
        String grantorId,
        String granteeId,
        AccessPurpose purpose,
        Set<String> dataTypes,
        ConsentStatus status,
        Instant grantedAt,
        Instant expiresAt,
        Instant revokedAt,
        String revokedBy,
        String revocationReason
) {
    public Consent {
        dataTypes = dataTypes != null ? Set.copyOf(dataTypes) : Set.of();
    }

    public boolean isEffective(@NonNull Instant now) {
        return status == ConsentStatus.ACTIVE
                && revokedAt == null
                && (expiresAt == null || expiresAt.isAfter(now));
    }

    /**
     * True only when every requested category is covered. Partial overlap does not count.
     */
    public boolean covers(@NonNull Set<String> requested) {
        return dataTypes.containsAll(requested);
    }

    public ConsentKey key() {
        return new ConsentKey(patientId, granteeId, purpose);
    }

    /**
     * Identifies the (patient, grantee, purpose) tuple of which at most one consent may be ACTIVE.
     */
    public record ConsentKey(String patientId, String granteeId, AccessPurpose purpose) {
    }
}
