package org.terrastories.policy.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.terrastories.policy.domain.model.AuditRecord;

/**
 * Writes one log line per audit record. Default sink when no outbox is configured.
 */
@Slf4j
public class LoggingAuditSink implements AuditSink {

    @Override
    public void record(AuditRecord record) {
        if (record.isDenial()) {
            log.warn("CULTURAL_ACCESS_AUDIT allowed=false reason={} actor={} role={} actorCommunity={} " +
                    "operation={} type={} resource={} community={} timestamp={}",
                record.getDecision().getReasonCode(),
                record.getActorId(),
                record.getActorRole().getValue(),
                record.getActorCommunityId(),
                record.getOperation(),
                record.getResourceType().getValue(),
                record.getResourceId(),
                record.getCommunityId(),
                record.getTimestamp());
        } else if (log.isInfoEnabled()) {
            log.info("CULTURAL_ACCESS_AUDIT allowed=true actor={} role={} operation={} type={} " +
                    "resource={} community={} timestamp={}",
                record.getActorId(),
                record.getActorRole().getValue(),
                record.getOperation(),
                record.getResourceType().getValue(),
                record.getResourceId(),
                record.getCommunityId(),
                record.getTimestamp());
        }
    }
}
