package org.terrastories.policy.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only record of one policy decision.
 *
 * <p>Built for grants and denials alike. The policy engine only constructs it; persisting it
 * is the job of an {@code AuditSink}.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class AuditRecord {
    @NonNull Instant timestamp;
    long actorId;
    @NonNull Role actorRole;
    Long actorCommunityId;
    Long resourceId;
    @NonNull ResourceType resourceType;
    /** Owning community of the resource. */
    Long communityId;
    @NonNull Operation operation;
    @NonNull Decision decision;

    public boolean isDenial() {
        return decision.isDenied();
    }
}
