package com.wpanther.credentialregistry.dto;

import com.wpanther.credentialregistry.entity.RegistryType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * The calling account and its standing in each registry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountProfileResponse {
    private String clientId;
    private String clientName;
    private Instant createdAt;
    private boolean owner;
    @Singular
    private List<Membership> memberships;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Membership {
        private RegistryType registry;
        private boolean admin;
        // Registered as an authority in this registry
        private boolean authority;
        private boolean authorityVerified;
    }
}
