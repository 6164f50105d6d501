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
 * Qualification issued by a verified issuer. {@code expiresAt} is a ledger height, 0 for no expiry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualificationIssueRequest {

    @NotBlank(message = "Subject ID is required")
    @Size(max = 100, message = "Subject ID must be at most 100 characters")
    private String subjectId;

    @NotBlank(message = "Qualification type is required")
    @Size(max = 50, message = "Qualification type must be at most 50 characters")
    private String qualificationType;

    @NotBlank(message = "Qualification name is required")
    @Size(max = 100, message = "Qualification name must be at most 100 characters")
    private String qualificationName;

    @PositiveOrZero(message = "Expiration height must not be negative")
    private long expiresAt;

    @Size(max = 500, message = "Metadata must be at most 500 characters")
    private String metadata;

    public RecordPayload toPayload() {
        return RecordPayload.builder()
                .attribute(RecordAttributes.QUALIFICATION_TYPE, qualificationType)
                .attribute(RecordAttributes.QUALIFICATION_NAME, qualificationName)
                .notes(metadata)
                .expiresAt(expiresAt)
                .build();
    }
}
