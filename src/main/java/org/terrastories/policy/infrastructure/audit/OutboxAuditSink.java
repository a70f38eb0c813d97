package org.terrastories.policy.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.terrastories.policy.domain.model.AuditRecord;

/**
 * Logs each record and appends it to the {@code audit_outbox} table.
 *
 * <p>Writes run in their own transaction so a denial is still recorded when the caller's
 * transaction rolls back on the resulting exception.
 */
@Slf4j
public class OutboxAuditSink implements AuditSink {

    private final AuditOutboxRepository outbox;
    private final TransactionTemplate requiresNew;
    private final LoggingAuditSink logSink = new LoggingAuditSink();

    public OutboxAuditSink(AuditOutboxRepository outbox, PlatformTransactionManager transactionManager) {
        this.outbox = outbox;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void record(AuditRecord record) {
        logSink.record(record);
        try {
            requiresNew.executeWithoutResult(status -> outbox.save(AuditOutboxEvent.from(record)));
        } catch (RuntimeException e) {
            // audit persistence must not alter the access decision
            log.error("Failed to persist audit record: actor={}, operation={}, type={}, resource={}, reason={}",
                record.getActorId(),
                record.getOperation(),
                record.getResourceType().getValue(),
                record.getResourceId(),
                record.getDecision().getReasonCode(),
                e);
        }
    }
}
