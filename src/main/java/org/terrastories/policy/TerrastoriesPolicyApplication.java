package org.terrastories.policy;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Cultural access policy service for Terrastories.
 *
 * <p>Decides, for every read, write, delete and create on community-owned stories, places,
 * speakers and themes, whether an actor may proceed:
 *
 * <ul>
 *   <li><strong>Data sovereignty</strong>: platform super admins never see community content</li>
 *   <li><strong>Community isolation</strong>: members act only inside their own community</li>
 *   <li><strong>Cultural protocols</strong>: elder-only, ceremonial and elder-approval content</li>
 *   <li><strong>Role eligibility</strong>: who may create, modify and delete</li>
 *   <li><strong>Audit</strong>: every grant and denial is recorded for community oversight</li>
 * </ul>
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class TerrastoriesPolicyApplication {

    public static void main(String[] args) {
        SpringApplication.run(TerrastoriesPolicyApplication.class, args);

        log.info("Terrastories cultural access policy started (data sovereignty enforcement: ON)");
    }
}
