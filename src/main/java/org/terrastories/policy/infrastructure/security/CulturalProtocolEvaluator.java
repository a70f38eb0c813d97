package org.terrastories.policy.infrastructure.security;

import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.CulturalProtocol;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.domain.model.PermissionLevel;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Cultural protocol tier checks.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>elder-only tier, role not elder/admin: {@code ELDER_ONLY}</li>
 *   <li>ceremonial content, role not elder/admin: {@code CEREMONIAL_RESTRICTED}</li>
 *   <li>elder approval required, operation is write, role not elder:
 *       {@code ELDER_APPROVAL_REQUIRED}</li>
 * </ol>
 *
 * <p>For {@link Operation#CREATE} the protocol is the one proposed in the input, so an editor
 * cannot create elder-only or ceremonial content.
 *
 * <p>The custodian set is an explicit allow-list and must not be replaced by a rank
 * comparison: editors and viewers never qualify however the hierarchy is ordered.
 */
@Component
public class CulturalProtocolEvaluator {

    static final Set<Role> CULTURAL_CUSTODIANS =
        Collections.unmodifiableSet(EnumSet.of(Role.ELDER, Role.ADMIN));

    public Decision check(CulturalProtocol protocol, Role role, Operation operation) {
        if (protocol.getPermissionLevel() == PermissionLevel.ELDER_ONLY
                && !CULTURAL_CUSTODIANS.contains(role)) {
            return Decision.deny(
                ReasonCode.ELDER_ONLY,
                "Elder-only content requires elevated cultural permissions"
            );
        }

        if (protocol.isCeremonialContent() && !CULTURAL_CUSTODIANS.contains(role)) {
            return Decision.deny(
                ReasonCode.CEREMONIAL_RESTRICTED,
                "Ceremonial content requires elevated cultural permissions"
            );
        }

        if (protocol.isElderApprovalRequired()
                && operation == Operation.WRITE
                && role != Role.ELDER) {
            return Decision.deny(
                ReasonCode.ELDER_APPROVAL_REQUIRED,
                "Modifications to this content require elder approval"
            );
        }

        return Decision.allow();
    }

    public static boolean isCulturalCustodian(Role role) {
        return CULTURAL_CUSTODIANS.contains(role);
    }
}
