package com.wpanther.credentialregistry.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorityVerificationRequest {

    @NotNull(message = "Verified flag is required")
    private Boolean verified;
}
