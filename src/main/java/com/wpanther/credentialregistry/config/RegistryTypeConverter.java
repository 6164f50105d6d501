package com.wpanther.credentialregistry.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

import com.wpanther.credentialregistry.entity.RegistryType;

/**
 * Binds {registry} path variables ("qualifications", "privileges", "panels")
 */
@Component
public class RegistryTypeConverter implements Converter<String, RegistryType> {

    @Override
    public RegistryType convert(String source) {
        return RegistryType.fromPathSegment(source)
                .orElseThrow(() -> new IllegalArgumentException("Unknown registry: " + source));
    }
}
