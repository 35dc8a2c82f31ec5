package com.trust.network.core.model;

import java.util.Objects;

/**
 * Display metadata for an actor, attached from the auxiliary identity source.
 * Nodes without an identity entry carry {@code Optional.empty()}; the exporter
 * substitutes {@link #placeholder()}.
 *
 * @param name  display name
 * @param job   occupation
 * @param email contact email
 * @param phone contact phone
 */
public record IdentityMetadata(String name, String job, String email, String phone) {

    public static final String UNKNOWN_NAME = "Unknown";
    public static final String NOT_AVAILABLE = "N/A";

    public IdentityMetadata {
        name = blankToDefault(name, UNKNOWN_NAME);
        job = blankToDefault(job, NOT_AVAILABLE);
        email = blankToDefault(email, NOT_AVAILABLE);
        phone = blankToDefault(phone, NOT_AVAILABLE);
    }

    /**
     * Metadata used for nodes absent from the identity source.
     */
    public static IdentityMetadata placeholder() {
        return new IdentityMetadata(UNKNOWN_NAME, NOT_AVAILABLE, NOT_AVAILABLE, NOT_AVAILABLE);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    public boolean isPlaceholder() {
        return Objects.equals(this, placeholder());
    }
}
