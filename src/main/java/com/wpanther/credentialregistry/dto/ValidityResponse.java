package com.wpanther.credentialregistry.dto;

import com.wpanther.credentialregistry.entity.RegistryType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidityResponse {
    private RegistryType registry;
    private long recordId;
    private boolean valid;
}
