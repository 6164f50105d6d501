package com.wpanther.credentialregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-registry record ID counter. Holds the last ID handed out; IDs are never reused.
 */
@Entity
@Table(name = "record_sequences")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordSequence {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private RegistryType registry;

    @Column(name = "last_id", nullable = false)
    private long lastId;

    public long next() {
        lastId = lastId + 1;
        return lastId;
    }
}
