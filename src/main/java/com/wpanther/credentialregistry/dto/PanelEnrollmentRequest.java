package com.wpanther.credentialregistry.dto;

import com.wpanther.credentialregistry.entity.RecordAttributes;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Insurance panel membership of a provider in one network.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PanelEnrollmentRequest {

    @NotBlank(message = "Subject ID is required")
    @Size(max = 100, message = "Subject ID must be at most 100 characters")
    private String subjectId;

    @NotBlank(message = "Network name is required")
    @Size(max = 100, message = "Network name must be at most 100 characters")
    private String networkName;

    @NotBlank(message = "Network tier is required")
    @Size(max = 20, message = "Network tier must be at most 20 characters")
    private String networkTier;

    @Size(max = 500, message = "Specialties must be at most 500 characters")
    private String specialties;

    @PositiveOrZero(message = "Expiration height must not be negative")
    private long expiresAt;

    public RecordPayload toPayload() {
        RecordPayload.RecordPayloadBuilder builder = RecordPayload.builder()
                .attribute(RecordAttributes.NETWORK_NAME, networkName)
                .attribute(RecordAttributes.NETWORK_TIER, networkTier)
                .expiresAt(expiresAt);
        if (specialties != null) {
            builder.attribute(RecordAttributes.SPECIALTIES, specialties);
        }
        return builder.build();
    }
}
