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
 * Hospital privilege granted to a provider for one procedure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrivilegeGrantRequest {

    @NotBlank(message = "Subject ID is required")
    @Size(max = 100, message = "Subject ID must be at most 100 characters")
    private String subjectId;

    @NotBlank(message = "Procedure code is required")
    @Size(max = 20, message = "Procedure code must be at most 20 characters")
    private String procedureCode;

    @NotBlank(message = "Procedure name is required")
    @Size(max = 100, message = "Procedure name must be at most 100 characters")
    private String procedureName;

    @PositiveOrZero(message = "Expiration height must not be negative")
    private long expiresAt;

    @Size(max = 500, message = "Restrictions must be at most 500 characters")
    private String restrictions;

    public RecordPayload toPayload() {
        return RecordPayload.builder()
                .attribute(RecordAttributes.PROCEDURE_CODE, procedureCode)
                .attribute(RecordAttributes.PROCEDURE_NAME, procedureName)
                .notes(restrictions)
                .expiresAt(expiresAt)
                .build();
    }
}
