package org.terrastories.policy.infrastructure.security;

import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.AuditRecord;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;

/**
 * Policy Engine - single decision point for community content access.
 *
 * <p>Implementations are stateless and synchronous: no I/O, no locks, no caching. They may be
 * called concurrently from any number of threads.
 */
public interface PolicyEngine {

    /**
     * Decide whether {@code actor} may perform {@code operation} on {@code resource}.
     *
     * <p>Never throws for a well-formed input; a denial is a regular result.
     */
    Decision evaluate(Actor actor, CommunityResource resource, Operation operation);

    /**
     * Build the audit record for a decision. The caller hands it to an audit sink.
     */
    AuditRecord auditRecordFor(Actor actor, CommunityResource resource, Operation operation, Decision decision);
}
