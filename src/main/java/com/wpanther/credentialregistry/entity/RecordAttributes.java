package com.wpanther.credentialregistry.entity;

/**
 * Attribute names used by each registry in {@link CredentialRecord#getAttributes()}.
 */
public final class RecordAttributes {

    public static final String QUALIFICATION_TYPE = "qualificationType";
    public static final String QUALIFICATION_NAME = "qualificationName";

    public static final String PROCEDURE_CODE = "procedureCode";
    public static final String PROCEDURE_NAME = "procedureName";

    public static final String NETWORK_NAME = "networkName";
    public static final String NETWORK_TIER = "networkTier";
    public static final String SPECIALTIES = "specialties";

    private RecordAttributes() {
    }
}
