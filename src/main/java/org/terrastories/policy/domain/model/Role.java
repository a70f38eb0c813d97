package org.terrastories.policy.domain.model;

import org.owasp.encoder.Encode;

import java.util.Locale;
import java.util.Objects;

/**
 * Platform roles with their hierarchy rank.
 *
 * <p>Rank is only meaningful between members of the same community. {@link #SUPER_ADMIN}
 * outranks every other role numerically but holds no community-content rights at all;
 * it is stopped by the data sovereignty guard before any rank comparison happens.
 *
 * @since 1.0.0
 */
public enum Role {

    /** Read-only community member. */
    VIEWER("viewer", 1),

    /** Cultural knowledge keeper. */
    ELDER("elder", 2),

    /** Content contributor, may modify what they created. */
    EDITOR("editor", 3),

    /** Community-appointed data steward. */
    ADMIN("admin", 4),

    /** Platform operator, system-level only. */
    SUPER_ADMIN("super_admin", 5);

    private final String value;
    private final int rank;

    Role(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String getValue() {
        return value;
    }

    public int rank() {
        return rank;
    }

    /**
     * Whether this role can do at least as much as {@code other} inside a community.
     *
     * @param other role to compare against
     * @return {@code rank() >= other.rank()}
     */
    public boolean atLeast(Role other) {
        Objects.requireNonNull(other, "Role to compare must not be null");
        return this.rank >= other.rank;
    }

    /**
     * @return true for every role that belongs to a community
     */
    public boolean isCommunityRole() {
        return this != SUPER_ADMIN;
    }

    /**
     * Parse the stored lower-case value (e.g. {@code "super_admin"}).
     *
     * @throws IllegalArgumentException for any unknown value
     */
    public static Role fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + Encode.forJava(value));
    }
}
