package com.wpanther.credentialregistry.dto;

import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Registry-specific content of a new record. The ledger stores it without interpreting it.
 */
@Value
@Builder
public class RecordPayload {
    @Singular
    Map<String, String> attributes;
    String notes;
    long expiresAt;
}
