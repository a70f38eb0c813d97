package org.terrastories.policy.infrastructure.security;

import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.ReasonCode;

/**
 * Tenant isolation: actor and resource must belong to the same community.
 *
 * <p>Applies to every operation including reads. Community ids are compared for exact
 * equality; communities do not nest. An actor or resource without a community never matches.
 * Public visibility is served by a separate actor-free path and is not a relaxation of this
 * check.
 */
@Component
public class CommunityScopeGuard {

    static final String MISMATCH_DETAIL = "Content can only be accessed within the same community";

    public Decision check(Actor actor, CommunityResource resource) {
        if (!actor.belongsTo(resource.getCommunityId())) {
            return Decision.deny(ReasonCode.COMMUNITY_MISMATCH, MISMATCH_DETAIL);
        }
        return Decision.allow();
    }
}
