package com.wpanther.credentialregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * An authenticated participant. Its clientId is the identity every registry keys on.
 */
@Entity
@Table(name = "registry_accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistryAccount {

    @Id
    private String id;

    @Column(name = "client_id", nullable = false, unique = true, length = 100)
    private String clientId;

    @Column(nullable = false, length = 1000)
    private String clientSecret;

    @Column(nullable = false, length = 100)
    private String clientName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "registry_account_scopes", joinColumns = @JoinColumn(name = "account_id"))
    @Column(name = "scope")
    private Set<String> scopes;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "registry_account_grant_types", joinColumns = @JoinColumn(name = "account_id"))
    @Column(name = "grant_type")
    private Set<String> grantTypes;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private Instant createdAt;
}
