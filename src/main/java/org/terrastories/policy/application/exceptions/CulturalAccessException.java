package org.terrastories.policy.application.exceptions;

import org.springframework.http.HttpStatus;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.ResourceType;

import java.util.Objects;

/**
 * Base class for a denied policy decision surfaced at a service boundary.
 *
 * <p>Carries the original {@link Decision} for logging and auditing. The message is safe to
 * show to the caller; the decision detail is not.
 */
public abstract class CulturalAccessException extends RuntimeException {

    private final transient Decision decision;

    protected CulturalAccessException(String message, Decision decision) {
        super(message);
        this.decision = Objects.requireNonNull(decision, "Decision must not be null");
    }

    public Decision getDecision() {
        return decision;
    }

    public ReasonCode getReasonCode() {
        return decision.getReasonCode();
    }

    public abstract HttpStatus getStatus();

    /**
     * Translate a denial into its boundary exception.
     *
     * <p>A community mismatch becomes "not found" so that other communities cannot probe for
     * the existence of content.
     *
     * @throws IllegalArgumentException if the decision is an allow
     */
    public static CulturalAccessException from(Decision decision, ResourceType type, Long resourceId) {
        switch (decision.getReasonCode()) {
            case SOVEREIGNTY_BLOCK:
                return new DataSovereigntyViolationException(decision);
            case COMMUNITY_MISMATCH:
                return new ResourceNotFoundException(type, resourceId, decision);
            case ELDER_ONLY:
            case CEREMONIAL_RESTRICTED:
            case ELDER_APPROVAL_REQUIRED:
                return new CulturalProtocolViolationException(decision);
            case ROLE_INSUFFICIENT:
            case NOT_CREATOR:
                return new InsufficientPermissionsException(decision);
            case OK:
                throw new IllegalArgumentException("An allowed decision has no boundary exception");
            default:
                throw new IllegalStateException("Unmapped reason code: " + decision.getReasonCode());
        }
    }
}
