package org.terrastories.policy.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;

/**
 * Policy evaluation metrics.
 *
 * <ul>
 *   <li>{@code policy.evaluation} timer tagged by operation, outcome and reason</li>
 *   <li>{@code policy.denials} counter per reason code, the main signal for attempted
 *       protocol violations</li>
 * </ul>
 *
 * No actor, resource or community identifiers are used as tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing policy evaluations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class PolicyEvaluationAspect {

        private final MeterRegistry meterRegistry;

        public PolicyEvaluationAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* org.terrastories.policy.infrastructure.security.PolicyEngine.evaluate(..))")
        public Object timeEvaluation(ProceedingJoinPoint joinPoint) throws Throwable {
            String operation = operationTag(joinPoint.getArgs());

            Timer.Sample sample = Timer.start(meterRegistry);

            try {
                Object result = joinPoint.proceed();

                Decision decision = (Decision) result;
                sample.stop(Timer.builder("policy.evaluation")
                    .tag("operation", operation)
                    .tag("outcome", decision.isAllowed() ? "allowed" : "denied")
                    .tag("reason", decision.getReasonCode().name())
                    .description("Policy evaluation timing")
                    .register(meterRegistry));

                if (decision.isDenied()) {
                    meterRegistry.counter("policy.denials",
                        "reason", decision.getReasonCode().name(),
                        "operation", operation).increment();
                }

                return result;

            } catch (Exception e) {
                sample.stop(Timer.builder("policy.evaluation")
                    .tag("operation", operation)
                    .tag("outcome", "error")
                    .tag("reason", "none")
                    .description("Policy evaluation timing")
                    .register(meterRegistry));

                throw e;
            }
        }

        private static String operationTag(Object[] args) {
            if (args.length >= 3 && args[2] instanceof Operation) {
                return ((Operation) args[2]).name();
            }
            return "unknown";
        }
    }
}
