package org.terrastories.policy.infrastructure.audit;

import org.terrastories.policy.domain.model.AuditRecord;

/**
 * Destination for policy audit records.
 *
 * <p>Called after every evaluation, grant or denial. Implementations must not throw back into
 * the caller: an audit failure never changes an access decision.
 */
public interface AuditSink {
    void record(AuditRecord record);
}
