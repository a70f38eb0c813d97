package org.terrastories.policy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;

/**
 * Cultural protocol descriptor attached to stories, places, speakers and themes.
 *
 * <p>Immutable value object. The {@code restricted} flag is derived from the permission
 * level and the ceremonial flag every time a descriptor is built, so the two can never
 * drift apart:
 * <pre>
 *   restricted == permissionLevel in {RESTRICTED, ELDER_ONLY} || ceremonialContent
 * </pre>
 * Updates go through the {@code with*} methods, which return a new descriptor with the flag
 * recomputed.
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class CulturalProtocol implements Serializable {

    private static final long serialVersionUID = 1L;

    private final PermissionLevel permissionLevel;

    /** Ceremonial content is readable by elders and community admins only. */
    private final boolean ceremonialContent;

    /** Writes need an elder; reads are unaffected. */
    private final boolean elderApprovalRequired;

    private final boolean restricted;

    /**
     * @param permissionLevel visibility tier (required)
     * @param ceremonialContent ceremonial flag
     * @param elderApprovalRequired elder approval flag for modifications
     * @throws NullPointerException if permissionLevel is null
     */
    public CulturalProtocol(
            PermissionLevel permissionLevel,
            boolean ceremonialContent,
            boolean elderApprovalRequired) {

        this.permissionLevel = Objects.requireNonNull(
            permissionLevel,
            "Permission level must not be null"
        );
        this.ceremonialContent = ceremonialContent;
        this.elderApprovalRequired = elderApprovalRequired;
        this.restricted = permissionLevel.isRestrictedTier() || ceremonialContent;
    }

    /**
     * Openly shareable content.
     */
    public static CulturalProtocol publicContent() {
        return new CulturalProtocol(PermissionLevel.PUBLIC, false, false);
    }

    /**
     * Default tier for member content with no explicit protocol.
     */
    public static CulturalProtocol communityContent() {
        return new CulturalProtocol(PermissionLevel.COMMUNITY, false, false);
    }

    public static CulturalProtocol restrictedContent() {
        return new CulturalProtocol(PermissionLevel.RESTRICTED, false, false);
    }

    public static CulturalProtocol elderOnly() {
        return new CulturalProtocol(PermissionLevel.ELDER_ONLY, false, false);
    }

    /**
     * Null-tolerant accessor used where a stored record may carry no protocol.
     */
    public static CulturalProtocol orDefault(CulturalProtocol protocol) {
        return protocol != null ? protocol : communityContent();
    }

    public CulturalProtocol withPermissionLevel(PermissionLevel level) {
        return new CulturalProtocol(level, ceremonialContent, elderApprovalRequired);
    }

    public CulturalProtocol withCeremonialContent(boolean ceremonial) {
        return new CulturalProtocol(permissionLevel, ceremonial, elderApprovalRequired);
    }

    public CulturalProtocol withElderApprovalRequired(boolean approvalRequired) {
        return new CulturalProtocol(permissionLevel, ceremonialContent, approvalRequired);
    }

    @Override
    public String toString() {
        return String.format(
            "CulturalProtocol[level=%s, ceremonial=%s, elderApproval=%s, restricted=%s]",
            permissionLevel.getValue(),
            ceremonialContent,
            elderApprovalRequired,
            restricted
        );
    }
}
