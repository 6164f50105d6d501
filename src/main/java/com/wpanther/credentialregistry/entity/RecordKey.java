package com.wpanther.credentialregistry.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordKey implements Serializable {

    @Enumerated(EnumType.STRING)
    @Column(name = "registry", nullable = false, length = 20)
    private RegistryType registry;

    @Column(name = "record_id", nullable = false)
    private Long recordId;
}
