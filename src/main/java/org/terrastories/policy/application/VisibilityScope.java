package org.terrastories.policy.application;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.terrastories.policy.domain.model.CommunityResource;

/**
 * Query-level form of the read rules, used to build listing and search filters.
 *
 * <p>A blocked scope matches nothing. Otherwise results are pinned to one community, and
 * restricted content is included only for cultural custodians.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VisibilityScope {
    boolean blocked;
    Long communityId;
    boolean includeRestricted;

    public static VisibilityScope blocked() {
        return new VisibilityScope(true, null, false);
    }

    public static VisibilityScope community(long communityId, boolean includeRestricted) {
        return new VisibilityScope(false, communityId, includeRestricted);
    }

    public boolean permits(CommunityResource resource) {
        if (blocked || !communityId.equals(resource.getCommunityId())) {
            return false;
        }
        return includeRestricted || !resource.isRestricted();
    }
}
