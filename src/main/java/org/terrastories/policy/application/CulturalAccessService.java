package org.terrastories.policy.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.terrastories.policy.application.exceptions.CulturalAccessException;
import org.terrastories.policy.application.exceptions.DataSovereigntyViolationException;
import org.terrastories.policy.application.exceptions.InsufficientPermissionsException;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.AuditRecord;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.CulturalProtocol;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.domain.model.Permission;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.ResourceType;
import org.terrastories.policy.domain.model.Role;
import org.terrastories.policy.infrastructure.audit.AuditSink;
import org.terrastories.policy.infrastructure.security.CulturalProtocolEvaluator;
import org.terrastories.policy.infrastructure.security.DataSovereigntyGuard;
import org.terrastories.policy.infrastructure.security.PolicyEngine;
import org.terrastories.policy.infrastructure.security.RolePermissions;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Enforcement point used by the story, place, speaker and theme services.
 *
 * <p>Evaluates through the {@link PolicyEngine}, hands every decision to the {@link AuditSink}
 * and translates denials into boundary exceptions. It never alters a decision.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CulturalAccessService {

    private final PolicyEngine policyEngine;
    private final AuditSink auditSink;
    private final DataSovereigntyGuard sovereigntyGuard;
    private final RolePermissions rolePermissions;
    private final ActorContextProvider actorContextProvider;

    /**
     * Evaluate and audit. Grants and denials are both audited.
     */
    public Decision check(Actor actor, CommunityResource resource, Operation operation) {
        Decision decision = policyEngine.evaluate(actor, resource, operation);
        AuditRecord record = policyEngine.auditRecordFor(actor, resource, operation, decision);
        auditSink.record(record);
        return decision;
    }

    /**
     * Evaluate, audit and enforce.
     *
     * @throws CulturalAccessException if the decision is a denial
     */
    public void authorize(Actor actor, CommunityResource resource, Operation operation) {
        Decision decision = check(actor, resource, operation);
        if (decision.isDenied()) {
            throw CulturalAccessException.from(decision, resource.getType(), resource.getId());
        }
    }

    /**
     * {@link #authorize} for the actor of the current security context.
     */
    public Actor authorizeCurrent(CommunityResource resource, Operation operation) {
        Actor actor = actorContextProvider.getCurrentActor();
        authorize(actor, resource, operation);
        return actor;
    }

    /**
     * Authorize creation of new content in {@code communityId} with the proposed protocol.
     *
     * <p>A missing protocol means community-level content.
     */
    public CommunityResource authorizeCreate(
            Actor actor,
            ResourceType type,
            long communityId,
            CulturalProtocol proposedProtocol) {

        CommunityResource proposed = CommunityResource.proposed(type, communityId, actor.getId(), proposedProtocol);
        authorize(actor, proposed, Operation.CREATE);
        return proposed;
    }

    /**
     * Keep the resources the actor may list, in input order.
     *
     * <p>An item must pass the read decision and the actor's {@link #visibilityScope}, so
     * restricted content is listed for cultural custodians only, as in query-built listings.
     * Items are not audited one by one; a single summary line is logged.
     */
    public List<CommunityResource> filterReadable(Actor actor, List<CommunityResource> resources) {
        Objects.requireNonNull(resources, "Resources must not be null");
        VisibilityScope scope = visibilityScope(actor);

        List<CommunityResource> readable = resources.stream()
            .filter(r -> policyEngine.evaluate(actor, r, Operation.READ).isAllowed())
            .filter(scope::permits)
            .collect(Collectors.toList());

        log.info("CULTURAL_ACCESS_AUDIT list actor={} role={} community={} requested={} returned={}",
            actor.getId(), actor.getRole().getValue(), actor.getCommunityId(), resources.size(), readable.size());

        return readable;
    }

    /**
     * Listing scope for the actor.
     */
    public VisibilityScope visibilityScope(Actor actor) {
        if (sovereigntyGuard.check(actor).isDenied()) {
            log.warn("Data sovereignty protection: super admin blocked from community listings, actor={}",
                actor.getId());
            return VisibilityScope.blocked();
        }
        if (actor.getCommunityId() == null) {
            log.warn("Actor without community blocked from listings: actor={}, role={}",
                actor.getId(), actor.getRole().getValue());
            return VisibilityScope.blocked();
        }
        return VisibilityScope.community(
            actor.getCommunityId(),
            CulturalProtocolEvaluator.isCulturalCustodian(actor.getRole())
        );
    }

    /**
     * Operational hierarchy gate for same-community actions that are not tied to one resource.
     *
     * @throws CulturalAccessException if the actor is a super admin or ranks below {@code minimum}
     */
    public void requireRoleAtLeast(Actor actor, Role minimum) {
        Decision sovereignty = sovereigntyGuard.check(actor);
        if (sovereignty.isDenied()) {
            throw new DataSovereigntyViolationException(sovereignty);
        }
        if (!actor.getRole().atLeast(minimum)) {
            throw new InsufficientPermissionsException(Decision.deny(
                ReasonCode.ROLE_INSUFFICIENT,
                "Requires " + minimum.getValue() + " level or higher"
            ));
        }
    }

    public boolean hasPermission(Actor actor, Permission permission) {
        return rolePermissions.hasPermission(actor.getRole(), permission);
    }
}
