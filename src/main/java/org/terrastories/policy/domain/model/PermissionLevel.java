package org.terrastories.policy.domain.model;

import org.owasp.encoder.Encode;

import java.util.Locale;

/**
 * Visibility tier of a piece of community content.
 */
public enum PermissionLevel {

    /** Visible on the unauthenticated public path. */
    PUBLIC("public"),

    /** Visible to any member of the owning community. */
    COMMUNITY("community"),

    /** Culturally restricted, hidden from listings for non-custodians. */
    RESTRICTED("restricted"),

    /** Readable by elders and community admins only. */
    ELDER_ONLY("elder_only");

    private final String value;

    PermissionLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return true if this tier alone makes a resource restricted
     */
    public boolean isRestrictedTier() {
        return this == RESTRICTED || this == ELDER_ONLY;
    }

    public static PermissionLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Permission level cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PermissionLevel level : values()) {
            if (level.value.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown permission level: " + Encode.forJava(value));
    }
}
