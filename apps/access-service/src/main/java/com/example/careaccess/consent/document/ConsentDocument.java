package com.example.careaccess.consent.document;

import com.example.careaccess.access.model.AccessPurpose;
import com.example.careaccess.consent.model.Consent;
import com.example.careaccess.consent.model.ConsentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Set;

/**
 * MongoDB document for consents. The partial unique index on (patientId, granteeId, purpose)
 * for ACTIVE consents is created by {@code MongoConfig}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "consents")
public class ConsentDocument {

    @Id
    private String id;

    @Indexed
    private String patientId;

    private String grantorId;
    private String granteeId;
    private AccessPurpose purpose;
    private Set<String> dataTypes;
    private ConsentStatus status;
    private Instant grantedAt;
    private Instant expiresAt;
    private Instant revokedAt;
    private String revokedBy;
    private String revocationReason;

    public static ConsentDocument from(Consent consent) {
        return ConsentDocument.builder()
                .id(consent.id())
                .patientId(consent.patientId())
                .grantorId(consent.grantorId())
                .granteeId(consent.granteeId())
                .purpose(consent.purpose())
                .dataTypes(consent.dataTypes())
                .status(consent.status())
                .grantedAt(consent.grantedAt())
                .expiresAt(consent.expiresAt())
                .revokedAt(consent.revokedAt())
                .revokedBy(consent.revokedBy())
                .revocationReason(consent.revocationReason())
                .build();
    }

    public Consent toConsent() {
        return Consent.builder()
                .id(id)
                .patientId(patientId)
                .grantorId(grantorId)
                .granteeId(granteeId)
                .purpose(purpose)
                .dataTypes(dataTypes)
                .status(status)
                .grantedAt(grantedAt)
                .expiresAt(expiresAt)
                .revokedAt(revokedAt)
                .revokedBy(revokedBy)
                .revocationReason(revocationReason)
                .build();
    }
}
