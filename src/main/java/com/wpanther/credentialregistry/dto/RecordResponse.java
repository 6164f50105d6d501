package com.wpanther.credentialregistry.dto;

import com.wpanther.credentialregistry.entity.CredentialRecord;
import com.wpanther.credentialregistry.entity.RegistryType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordResponse {
    private RegistryType registry;
    private long recordId;
    private String subjectId;
    private String authorityId;
    private Map<String, String> attributes;
    private String notes;
    private long issuedAt;
    private long expiresAt;
    private boolean verified;
    private Long verifiedAt;
    private String status;
    private long lastUpdatedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static RecordResponse from(CredentialRecord record) {
        return RecordResponse.builder()
                .registry(record.getRegistry())
                .recordId(record.getRecordId())
                .subjectId(record.getSubjectId())
                .authorityId(record.getAuthorityId())
                .attributes(new HashMap<>(record.getAttributes()))
                .notes(record.getNotes())
                .issuedAt(record.getIssuedAt())
                .expiresAt(record.getExpiresAt())
                .verified(record.isVerified())
                .verifiedAt(record.getVerifiedAt())
                .status(record.getStatus())
                .lastUpdatedAt(record.getLastUpdatedAt())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
