package org.terrastories.policy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code terrastories.policy}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "terrastories.policy")
public class PolicyProperties {

    @Valid
    private Audit audit = new Audit();

    @Data
    public static class Audit {

        /** Where audit records go. */
        @NotNull
        private SinkType sink = SinkType.LOG;

        /** Delay between outbox drains, in milliseconds. */
        @Min(100)
        private long publishIntervalMs = 10_000;

        /** Maximum outbox rows published per drain. */
        @Min(1)
        @Max(10_000)
        private int batchSize = 500;
    }

    public enum SinkType {
        LOG,
        OUTBOX
    }
}
