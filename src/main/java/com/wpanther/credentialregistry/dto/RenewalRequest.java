package com.wpanther.credentialregistry.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenewalRequest {

    @PositiveOrZero(message = "Expiration height must not be negative")
    private long expiresAt;
}
