package com.wpanther.credentialregistry.dto;

import com.wpanther.credentialregistry.entity.Authority;
import com.wpanther.credentialregistry.entity.RegistryType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorityResponse {
    private RegistryType registry;
    private String authorityId;
    private String name;
    private String category;
    private String website;
    private String location;
    private boolean verified;
    private boolean active;
    private long registeredAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static AuthorityResponse from(Authority authority) {
        return AuthorityResponse.builder()
                .registry(authority.getId().getRegistry())
                .authorityId(authority.getId().getAccountId())
                .name(authority.getName())
                .category(authority.getCategory())
                .website(authority.getWebsite())
                .location(authority.getLocation())
                .verified(authority.isVerified())
                .active(authority.isActive())
                .registeredAt(authority.getRegisteredAt())
                .createdAt(authority.getCreatedAt())
                .updatedAt(authority.getUpdatedAt())
                .build();
    }
}
