package com.wpanther.credentialregistry.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Self-registration of an issuer, hospital or insurer. The registering account becomes the authority ID.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorityRegistrationRequest {

    @NotBlank(message = "Authority name is required")
    @Size(max = 100, message = "Authority name must be at most 100 characters")
    private String name;

    // Issuer or insurer type, left empty by hospitals
    @Size(max = 50, message = "Category must be at most 50 characters")
    private String category;

    @Size(max = 100, message = "Website must be at most 100 characters")
    private String website;

    @Size(max = 100, message = "Location must be at most 100 characters")
    private String location;
}
