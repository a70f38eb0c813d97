package org.terrastories.policy.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.AuditRecord;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;

import java.time.Clock;

/**
 * Builds {@link AuditRecord} values, stamped from the injected clock.
 */
@Component
@RequiredArgsConstructor
public class AuditRecordFactory {

    private final Clock clock;

    public AuditRecord create(Actor actor, CommunityResource resource, Operation operation, Decision decision) {
        return AuditRecord.builder()
            .timestamp(clock.instant())
            .actorId(actor.getId())
            .actorRole(actor.getRole())
            .actorCommunityId(actor.getCommunityId())
            .resourceId(resource.getId())
            .resourceType(resource.getType())
            .communityId(resource.getCommunityId())
            .operation(operation)
            .decision(decision)
            .build();
    }
}
