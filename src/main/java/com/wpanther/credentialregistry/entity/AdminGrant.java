package com.wpanther.credentialregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Admin-set entry of a registry. Removing an admin clears the flag rather than deleting the row.
 */
@Entity
@Table(name = "admin_grants")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AdminGrant {

    @EmbeddedId
    private RegistryAccountKey id;

    @Column(nullable = false)
    private boolean authorized;

    @Column(name = "granted_by", nullable = false, length = 100)
    private String grantedBy;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
