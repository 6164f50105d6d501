package com.wpanther.credentialregistry.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * The three registries sharing the credential engine.
 * Each one owns its own authorities, admins, records and ID counter.
 */
public enum RegistryType {

    QUALIFICATION("qualifications"),
    PRIVILEGE("privileges"),
    PANEL("panels");

    private final String pathSegment;

    RegistryType(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    public String getPathSegment() {
        return pathSegment;
    }

    /**
     * Qualifications carry a verified flag; privileges and panel memberships carry a free-text status tag.
     */
    public boolean usesVerificationFlag() {
        return this == QUALIFICATION;
    }

    public boolean usesStatusTag() {
        return !usesVerificationFlag();
    }

    public static Optional<RegistryType> fromPathSegment(String value) {
        return Arrays.stream(values())
                .filter(type -> type.pathSegment.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
