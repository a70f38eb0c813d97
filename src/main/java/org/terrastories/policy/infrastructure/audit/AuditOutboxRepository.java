package org.terrastories.policy.infrastructure.audit;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.terrastories.policy.domain.model.ReasonCode;

import java.util.List;

@Repository
public interface AuditOutboxRepository extends JpaRepository<AuditOutboxEvent, Long> {

    List<AuditOutboxEvent> findByProcessedFalseOrderByIdAsc(Pageable pageable);

    long countByAllowedFalseAndReasonCode(ReasonCode reasonCode);
}
