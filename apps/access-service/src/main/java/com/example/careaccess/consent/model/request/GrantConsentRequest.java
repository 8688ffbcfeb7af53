package com.example.careaccess.consent.model.request;

import com.example.careaccess.access.model.AccessPurpose;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Set;

public record GrantConsentRequest(
        @NotBlank @Size(max = 128) String patientId,
        @NotBlank @Size(max = 128) String granteeId,
        @NotNull AccessPurpose purpose,
        @NotEmpty Set<@NotBlank String> dataTypes,
        @Future Instant expiresAt
) {
}
