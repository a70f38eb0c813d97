package org.terrastories.policy.infrastructure.security;

import org.springframework.stereotype.Component;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which roles may perform which operation inside their own community.
 *
 * <ul>
 *   <li>create: admin, elder, editor</li>
 *   <li>write/delete: admin and elder on anything, editor only on what they created</li>
 *   <li>read: no role gate beyond sovereignty, scope and protocol</li>
 * </ul>
 */
@Component
public class RoleOperationEligibility {

    static final Set<Role> CREATORS =
        Collections.unmodifiableSet(EnumSet.of(Role.ADMIN, Role.ELDER, Role.EDITOR));

    static final Set<Role> MODIFIERS =
        Collections.unmodifiableSet(EnumSet.of(Role.ADMIN, Role.ELDER));

    public Decision check(CommunityResource resource, Actor actor, Operation operation) {
        Role role = actor.getRole();

        switch (operation) {
            case READ:
                return Decision.allow();

            case CREATE:
                if (CREATORS.contains(role)) {
                    return Decision.allow();
                }
                return Decision.deny(
                    ReasonCode.ROLE_INSUFFICIENT,
                    "Role " + role.getValue() + " cannot create " + resource.getType().getValue() + " content"
                );

            case WRITE:
            case DELETE:
                if (MODIFIERS.contains(role)) {
                    return Decision.allow();
                }
                if (role == Role.EDITOR) {
                    if (resource.isCreatedBy(actor.getId())) {
                        return Decision.allow();
                    }
                    return Decision.deny(
                        ReasonCode.NOT_CREATOR,
                        "Editors can only " + verb(operation) + " content they created"
                    );
                }
                return Decision.deny(
                    ReasonCode.ROLE_INSUFFICIENT,
                    "Insufficient permissions to " + verb(operation) + " this " + resource.getType().getValue()
                );

            default:
                throw new IllegalStateException("Unhandled operation: " + operation);
        }
    }

    private static String verb(Operation operation) {
        return operation == Operation.DELETE ? "delete" : "modify";
    }
}
