package org.terrastories.policy.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Policy view of a story, place, speaker or theme.
 *
 * <p>Loaded by the caller before evaluation. For {@link Operation#CREATE} the caller passes a
 * proposed resource: no id yet, the target community, the acting user as creator and the
 * protocol requested in the input.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class CommunityResource {

    /** Null for a proposed resource. */
    Long id;

    @NonNull ResourceType type;

    Long communityId;

    Long creatorId;

    @NonNull CulturalProtocol protocol;

    public static CommunityResource proposed(
            ResourceType type,
            long communityId,
            long creatorId,
            CulturalProtocol protocol) {

        return CommunityResource.builder()
            .type(type)
            .communityId(communityId)
            .creatorId(creatorId)
            .protocol(CulturalProtocol.orDefault(protocol))
            .build();
    }

    public boolean isCreatedBy(long actorId) {
        return creatorId != null && creatorId == actorId;
    }

    /**
     * @return true if the derived restricted flag is set on the protocol
     */
    public boolean isRestricted() {
        return protocol.isRestricted();
    }
}
