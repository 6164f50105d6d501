package com.wpanther.credentialregistry.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Identity of an account inside one registry. Keys both authorities and admin grants.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistryAccountKey implements Serializable {

    @Enumerated(EnumType.STRING)
    @Column(name = "registry", nullable = false, length = 20)
    private RegistryType registry;

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;
}
