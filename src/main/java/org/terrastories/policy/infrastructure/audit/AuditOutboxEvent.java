package org.terrastories.policy.infrastructure.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.terrastories.policy.domain.model.AuditRecord;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.ResourceType;
import org.terrastories.policy.domain.model.Role;

import java.time.Instant;

/**
 * Outbox row for one audit record.
 *
 * <p>Record columns are written once; only {@code processed} changes after insert.
 */
@Entity
@Table(name = "audit_outbox", indexes = @Index(name = "idx_audit_outbox_processed", columnList = "processed, id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class AuditOutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, name = "occurred_at", updatable = false)
    private Instant occurredAt;

    @Column(nullable = false, name = "actor_id", updatable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, name = "actor_role", updatable = false, length = 16)
    private Role actorRole;

    @Column(name = "actor_community_id", updatable = false)
    private Long actorCommunityId;

    @Column(name = "resource_id", updatable = false)
    private Long resourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, name = "resource_type", updatable = false, length = 16)
    private ResourceType resourceType;

    @Column(name = "community_id", updatable = false)
    private Long communityId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 8)
    private Operation operation;

    @Column(nullable = false, updatable = false)
    private boolean allowed;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, name = "reason_code", updatable = false, length = 32)
    private ReasonCode reasonCode;

    @Column(nullable = false, updatable = false)
    private String detail;

    @Column(nullable = false)
    private boolean processed;

    public static AuditOutboxEvent from(AuditRecord record) {
        return AuditOutboxEvent.builder()
            .occurredAt(record.getTimestamp())
            .actorId(record.getActorId())
            .actorRole(record.getActorRole())
            .actorCommunityId(record.getActorCommunityId())
            .resourceId(record.getResourceId())
            .resourceType(record.getResourceType())
            .communityId(record.getCommunityId())
            .operation(record.getOperation())
            .allowed(record.getDecision().isAllowed())
            .reasonCode(record.getDecision().getReasonCode())
            .detail(record.getDecision().getDetail())
            .processed(false)
            .build();
    }

    public void markProcessed() {
        this.processed = true;
    }
}
