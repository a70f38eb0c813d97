package org.terrastories.policy.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;
import org.terrastories.policy.infrastructure.audit.AuditOutboxPublisher;
import org.terrastories.policy.infrastructure.audit.AuditOutboxRepository;
import org.terrastories.policy.infrastructure.audit.AuditSink;
import org.terrastories.policy.infrastructure.audit.LoggingAuditSink;
import org.terrastories.policy.infrastructure.audit.OutboxAuditSink;

import java.time.Clock;

/**
 * Audit sink selection.
 *
 * <ul>
 *   <li>{@code terrastories.policy.audit.sink=log} (default): one log line per decision</li>
 *   <li>{@code terrastories.policy.audit.sink=outbox}: log line plus a transactional outbox row,
 *       drained by {@link AuditOutboxPublisher}</li>
 * </ul>
 */
@Configuration
@EnableScheduling
@Slf4j
public class AuditConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "terrastories.policy.audit", name = "sink", havingValue = "outbox")
    public AuditSink outboxAuditSink(AuditOutboxRepository repository, PlatformTransactionManager transactionManager) {
        log.info("Policy audit records go to the audit_outbox table");
        return new OutboxAuditSink(repository, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "terrastories.policy.audit", name = "sink", havingValue = "outbox")
    public AuditOutboxPublisher auditOutboxPublisher(AuditOutboxRepository repository, PolicyProperties properties) {
        return new AuditOutboxPublisher(repository, properties.getAudit().getBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean(AuditSink.class)
    public AuditSink loggingAuditSink() {
        log.info("Policy audit records go to the application log");
        return new LoggingAuditSink();
    }
}
