package com.wpanther.credentialregistry.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New status tag for a privilege or panel membership. Only "active" makes a record valid;
 * other tags ("suspended", "revoked", "terminated") are conventions, not enforced.
 * A null {@code restrictions} keeps the stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {

    @NotBlank(message = "Status is required")
    @Size(max = 20, message = "Status must be at most 20 characters")
    private String status;

    @Size(max = 500, message = "Restrictions must be at most 500 characters")
    private String restrictions;
}
