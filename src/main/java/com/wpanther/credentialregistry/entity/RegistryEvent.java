package com.wpanther.credentialregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail entry for a successful registry mutation.
 * Written in the same transaction as the mutation, so failed calls leave none.
 */
@Entity
@Table(name = "registry_events", indexes = {
        @Index(name = "idx_events_actor", columnList = "registry, actor_id"),
        @Index(name = "idx_events_target", columnList = "registry, target_type, target_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistryEvent {

    public static final String TARGET_ADMIN = "ADMIN";
    public static final String TARGET_AUTHORITY = "AUTHORITY";
    public static final String TARGET_RECORD = "RECORD";

    @Id
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RegistryType registry;

    @Column(nullable = false, length = 30)
    private String action;

    @Column(name = "actor_id", nullable = false, length = 100)
    private String actorId;

    @Column(name = "target_type", nullable = false, length = 20)
    private String targetType;

    @Column(name = "target_id", nullable = false, length = 100)
    private String targetId;

    @Column(length = 500)
    private String details;

    @Column(name = "ledger_height", nullable = false)
    private long ledgerHeight;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
