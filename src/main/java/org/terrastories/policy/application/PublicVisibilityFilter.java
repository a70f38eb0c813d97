package org.terrastories.policy.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.PermissionLevel;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Unauthenticated read path.
 *
 * <p>Exposes only content that is public and carries no cultural restriction. There is no
 * actor here and the policy engine is never called: anonymous requests have no identity to
 * evaluate.
 */
@Component
@Slf4j
public class PublicVisibilityFilter {

    public boolean isPubliclyVisible(CommunityResource resource) {
        return resource.getProtocol().getPermissionLevel() == PermissionLevel.PUBLIC
            && !resource.getProtocol().isRestricted();
    }

    /**
     * Public resources of one community, in input order.
     */
    public List<CommunityResource> filter(long communityId, List<CommunityResource> resources) {
        Objects.requireNonNull(resources, "Resources must not be null");

        List<CommunityResource> visible = resources.stream()
            .filter(r -> Objects.equals(r.getCommunityId(), communityId))
            .filter(this::isPubliclyVisible)
            .collect(Collectors.toList());

        log.info("PUBLIC_API_ACCESS community={} requested={} returned={}",
            communityId, resources.size(), visible.size());

        return visible;
    }
}
