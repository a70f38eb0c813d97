package org.terrastories.policy.infrastructure.audit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.terrastories.policy.PolicyFixtures;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.CulturalProtocol;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.domain.model.Role;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.terrastories.policy.PolicyFixtures.COMMUNITY_1;
import static org.terrastories.policy.PolicyFixtures.story;

@ExtendWith(MockitoExtension.class)
class AuditOutboxPublisherTest {

    @Mock
    AuditOutboxRepository repository;

    private AuditOutboxEvent grant() {
        return AuditOutboxEvent.from(new AuditRecordFactory(PolicyFixtures.fixedClock()).create(
            Actor.member(3L, Role.ELDER, COMMUNITY_1),
            story(5L, COMMUNITY_1, CulturalProtocol.elderOnly()),
            Operation.READ,
            Decision.allow()));
    }

    @Test
    void drainMarksBatchProcessed() {
        List<AuditOutboxEvent> pending = List.of(grant(), grant());
        when(repository.findByProcessedFalseOrderByIdAsc(any(Pageable.class))).thenReturn(pending);

        int published = new AuditOutboxPublisher(repository, 25).drain();

        assertEquals(2, published);
        assertTrue(pending.stream().allMatch(AuditOutboxEvent::isProcessed));
        verify(repository).findByProcessedFalseOrderByIdAsc(argThat(p -> p.getPageSize() == 25 && p.getPageNumber() == 0));
        verify(repository).saveAll(pending);
    }

    @Test
    void drainWithNothingPending() {
        when(repository.findByProcessedFalseOrderByIdAsc(any(Pageable.class))).thenReturn(List.of());

        assertEquals(0, new AuditOutboxPublisher(repository, 25).drain());
    }
}
