package org.terrastories.policy.infrastructure.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.AuditRecord;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.infrastructure.audit.AuditRecordFactory;

import java.util.Objects;

/**
 * Cultural Policy Engine - composes the guards into one decision.
 *
 * <p>Fixed pipeline, short-circuiting on the first denial:
 * <ol>
 *   <li>Data sovereignty (super admins never see community content)</li>
 *   <li>Community scope (tenant isolation)</li>
 *   <li>Cultural protocol tier (on the stored protocol, or the proposed one for create)</li>
 *   <li>Role-operation eligibility</li>
 * </ol>
 *
 * <p>Every content service goes through this class. Story, place, speaker and theme access
 * must not grow their own variants of these checks.
 *
 * <p>This class is security-critical and must be reviewed by the cultural protocol owners
 * before any modification.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CulturalPolicyEngine implements PolicyEngine {

    private final DataSovereigntyGuard sovereigntyGuard;
    private final CommunityScopeGuard communityScopeGuard;
    private final CulturalProtocolEvaluator protocolEvaluator;
    private final RoleOperationEligibility roleOperationEligibility;
    private final AuditRecordFactory auditRecordFactory;

    @Override
    public Decision evaluate(Actor actor, CommunityResource resource, Operation operation) {
        Objects.requireNonNull(actor, "Actor must not be null");
        Objects.requireNonNull(resource, "Resource must not be null");
        Objects.requireNonNull(operation, "Operation must not be null");

        log.debug("Policy check: actor={}, role={}, operation={}, type={}, resource={}",
            actor.getId(), actor.getRole().getValue(), operation, resource.getType().getValue(), resource.getId());

        Decision decision = sovereigntyGuard.check(actor);

        if (decision.isAllowed()) {
            decision = communityScopeGuard.check(actor, resource);
        }
        if (decision.isAllowed()) {
            decision = protocolEvaluator.check(resource.getProtocol(), actor.getRole(), operation);
        }
        if (decision.isAllowed()) {
            decision = roleOperationEligibility.check(resource, actor, operation);
        }

        if (decision.isDenied()) {
            log.warn("POLICY DENIED: actor={}, role={}, operation={}, type={}, resource={}, reason={}",
                actor.getId(), actor.getRole().getValue(), operation,
                resource.getType().getValue(), resource.getId(), decision.getReasonCode());
        } else {
            log.debug("POLICY GRANTED: actor={}, operation={}, type={}, resource={}",
                actor.getId(), operation, resource.getType().getValue(), resource.getId());
        }

        return decision;
    }

    @Override
    public AuditRecord auditRecordFor(
            Actor actor,
            CommunityResource resource,
            Operation operation,
            Decision decision) {

        return auditRecordFactory.create(actor, resource, operation, decision);
    }
}
