package com.wpanther.credentialregistry.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A qualification, privilege or panel membership held by a subject and owned by an authority.
 * All timestamps except createdAt/updatedAt are ledger heights.
 */
@Entity
@Table(name = "credential_records", indexes = {
        @Index(name = "idx_records_subject", columnList = "registry, subject_id"),
        @Index(name = "idx_records_authority", columnList = "registry, authority_id")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CredentialRecord {

    /** Expiration sentinel meaning the record never expires. */
    public static final long NEVER_EXPIRES = 0L;

    /** Status tag that makes a privilege or panel membership usable. */
    public static final String STATUS_ACTIVE = "active";

    @EmbeddedId
    private RecordKey id;

    @Column(name = "subject_id", nullable = false, length = 100)
    private String subjectId;

    // Fixed at creation
    @Column(name = "authority_id", nullable = false, length = 100, updatable = false)
    private String authorityId;

    // Registry-specific descriptive fields (qualification type, procedure code, network tier...)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "credential_record_attributes", joinColumns = {
            @JoinColumn(name = "registry", referencedColumnName = "registry"),
            @JoinColumn(name = "record_id", referencedColumnName = "record_id")
    })
    @MapKeyColumn(name = "attribute_name", length = 50)
    @Column(name = "attribute_value", length = 500)
    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();

    // Free text: qualification metadata or privilege restrictions
    @Column(length = 500)
    private String notes;

    @Column(name = "issued_at", nullable = false)
    private long issuedAt;

    @Column(name = "expires_at", nullable = false)
    private long expiresAt;

    // Qualification registry only
    @Column(nullable = false)
    private boolean verified;

    @Column(name = "verified_at")
    private Long verifiedAt;

    // Privilege and panel registries only
    @Column(length = 20)
    private String status;

    @Column(name = "last_updated_at", nullable = false)
    private long lastUpdatedAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant updatedAt;

    @Version
    private Long version;

    public RegistryType getRegistry() {
        return id.getRegistry();
    }

    public long getRecordId() {
        return id.getRecordId();
    }
}
