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
public class RecordCreatedResponse {
    private RegistryType registry;
    private long recordId;
}
