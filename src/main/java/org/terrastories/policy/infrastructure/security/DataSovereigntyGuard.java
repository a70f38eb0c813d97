package org.terrastories.policy.infrastructure.security;

import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.Role;

/**
 * Blocks the platform operator role from all community content.
 *
 * <p>Evaluated first, unconditionally. There is no flag, property or impersonation path that
 * skips it: the resource, the operation and every protocol flag are irrelevant once the actor
 * is a {@link Role#SUPER_ADMIN}.
 */
@Component
public class DataSovereigntyGuard {

    static final String BLOCK_DETAIL =
        "Super administrators cannot access community data (data sovereignty protection)";

    public Decision check(Actor actor) {
        if (actor.getRole() == Role.SUPER_ADMIN) {
            return Decision.deny(ReasonCode.SOVEREIGNTY_BLOCK, BLOCK_DETAIL);
        }
        return Decision.allow();
    }
}
