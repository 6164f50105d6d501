package com.wpanther.credentialregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An issuer, hospital or insurer registered in one registry.
 * Keyed by the account that registered it; never deleted.
 */
@Entity
@Table(name = "authorities")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Authority {

    @EmbeddedId
    private RegistryAccountKey id;

    @Column(nullable = false, length = 100)
    private String name;

    // Issuer or insurer type; empty for hospitals
    @Column(length = 50)
    private String category;

    @Column(length = 100)
    private String website;

    @Column(length = 100)
    private String location;

    @Column(nullable = false)
    private boolean verified;

    // Set at registration, no operation clears it yet
    @Column(nullable = false)
    private boolean active;

    @Column(name = "registered_at", nullable = false)
    private long registeredAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant updatedAt;

    @Version
    private Long version;
}
