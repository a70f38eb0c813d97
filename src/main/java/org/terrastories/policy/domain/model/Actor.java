package org.terrastories.policy.domain.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Resolved identity attempting an operation.
 *
 * <p>Immutable for the duration of a request. {@code communityId} is expected to be null only
 * for {@link Role#SUPER_ADMIN}; the policy engine treats a community-less member as belonging
 * to no community rather than rejecting it.
 *
 * @since 1.0.0
 */
@Value
public class Actor {
    long id;
    @NonNull Role role;
    Long communityId;

    public static Actor member(long id, Role role, long communityId) {
        return new Actor(id, role, communityId);
    }

    public static Actor superAdmin(long id) {
        return new Actor(id, Role.SUPER_ADMIN, null);
    }

    public boolean belongsTo(Long otherCommunityId) {
        return communityId != null && communityId.equals(otherCommunityId);
    }
}
