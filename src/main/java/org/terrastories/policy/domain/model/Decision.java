package org.terrastories.policy.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Outcome of a policy evaluation.
 *
 * <p>Pure value, built fresh for every call and never cached. Two evaluations over equal
 * inputs produce equal decisions, so the detail text must stay deterministic (no ids,
 * timestamps or request data).
 *
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Decision {
    boolean allowed;
    ReasonCode reasonCode;
    String detail;

    public static Decision allow() {
        return new Decision(true, ReasonCode.OK, "Access granted");
    }

    public static Decision deny(ReasonCode reasonCode, String detail) {
        Objects.requireNonNull(reasonCode, "Reason code must not be null");
        if (reasonCode == ReasonCode.OK) {
            throw new IllegalArgumentException("A denial cannot carry reason code OK");
        }
        return new Decision(false, reasonCode, Objects.requireNonNull(detail, "Detail must not be null"));
    }

    public boolean isDenied() {
        return !allowed;
    }
}
