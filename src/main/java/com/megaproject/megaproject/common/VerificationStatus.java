package com.megaproject.megaproject.common;

/**
 * Verified/unverified partition applied to every schema in the system.
 */
public enum VerificationStatus {

    VERIFIED("verified"),
    UNVERIFIED("unverified");

    public static final String PROD_SCHEMA = "prod";

    private final String label;

    VerificationStatus(String label) {
        this.label = label;
    }

    public static VerificationStatus of(boolean verified) {
        return verified ? VERIFIED : UNVERIFIED;
    }

    public String label() {
        return label;
    }

    public String rawSchema() {
        return "raw_" + label;
    }

    public String stageSchema() {
        return "stage_" + label;
    }

    public String prodTable() {
        return label + "_projects";
    }
}
