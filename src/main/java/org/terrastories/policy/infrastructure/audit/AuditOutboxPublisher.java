package org.terrastories.policy.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Drains unprocessed outbox rows in id order and marks them processed.
 *
 * <p>Publishing is a structured log line for now; the downstream consumer is the community
 * oversight log shipper.
 */
@RequiredArgsConstructor
@Slf4j
public class AuditOutboxPublisher {

    private final AuditOutboxRepository repository;
    private final int batchSize;

    @Scheduled(fixedDelayString = "${terrastories.policy.audit.publish-interval-ms:10000}")
    @Transactional
    public void publish() {
        drain();
    }

    int drain() {
        List<AuditOutboxEvent> pending = repository.findByProcessedFalseOrderByIdAsc(PageRequest.of(0, batchSize));

        for (AuditOutboxEvent e : pending) {
            if (log.isInfoEnabled()) {
                log.info("OUTBOX publish id={} allowed={} reason={} actor={} role={} operation={} type={} " +
                        "resource={} community={} occurredAt={}",
                    e.getId(), e.isAllowed(), e.getReasonCode(), e.getActorId(), e.getActorRole().getValue(),
                    e.getOperation(), e.getResourceType().getValue(), e.getResourceId(), e.getCommunityId(),
                    e.getOccurredAt());
            }
            e.markProcessed();
        }
        repository.saveAll(pending);

        if (!pending.isEmpty()) {
            log.debug("Published {} audit outbox events", pending.size());
        }
        return pending.size();
    }
}
