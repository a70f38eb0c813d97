package org.terrastories.policy.infrastructure.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.terrastories.policy.PolicyFixtures;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.CommunityResource;
import org.terrastories.policy.domain.model.CulturalProtocol;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.domain.model.Permission;
import org.terrastories.policy.domain.model.Role;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Role permission matrix")
class RolePermissionsTest {

    private final RolePermissions permissions = new RolePermissions();

    @Test
    @DisplayName("Super admin holds system administration and nothing else")
    void superAdmin() {
        assertEquals(Set.of(Permission.SYSTEM_ADMIN), permissions.permissionsOf(Role.SUPER_ADMIN));
        for (Permission permission : Permission.values()) {
            if (permission.isCommunityPermission()) {
                assertFalse(permissions.hasPermission(Role.SUPER_ADMIN, permission), permission.getValue());
            }
        }
    }

    @ParameterizedTest
    @EnumSource(value = Role.class, names = "SUPER_ADMIN", mode = EnumSource.Mode.EXCLUDE)
    void communityRolesNeverHoldSystemAdmin(Role role) {
        assertFalse(permissions.hasPermission(role, Permission.SYSTEM_ADMIN));
        assertTrue(permissions.hasPermission(role, Permission.STORIES_READ));
    }

    @Test
    void viewerReadsOnly() {
        assertEquals(
            EnumSet.of(Permission.STORIES_READ, Permission.PLACES_READ, Permission.SPEAKERS_READ),
            permissions.permissionsOf(Role.VIEWER));
    }

    @Test
    void elderValidatesCulturalContent() {
        assertTrue(permissions.hasPermission(Role.ELDER, Permission.CULTURAL_VALIDATE));
        assertTrue(permissions.hasPermission(Role.ELDER, Permission.CULTURAL_READ));
        assertFalse(permissions.hasPermission(Role.ELDER, Permission.STORIES_WRITE));
    }

    @Test
    @DisplayName("Matrix grants are independent of what the engine lets a role modify")
    void elderModifiesWithoutWriteGrant() {
        Actor elder = Actor.member(3L, Role.ELDER, PolicyFixtures.COMMUNITY_1);
        CommunityResource story = PolicyFixtures.story(5L, PolicyFixtures.COMMUNITY_1, 9L, CulturalProtocol.communityContent());

        assertFalse(permissions.hasPermission(Role.ELDER, Permission.STORIES_WRITE));
        assertTrue(PolicyFixtures.engine().evaluate(elder, story, Operation.WRITE).isAllowed());
        assertTrue(PolicyFixtures.engine().evaluate(elder, story, Operation.DELETE).isAllowed());
    }

    @Test
    void editorWritesContentButNotCultural() {
        assertTrue(permissions.hasPermission(Role.EDITOR, Permission.PLACES_WRITE));
        assertFalse(permissions.hasPermission(Role.EDITOR, Permission.CULTURAL_READ));
    }

    @Test
    void adminHoldsEveryCommunityPermission() {
        Set<Permission> admin = permissions.permissionsOf(Role.ADMIN);

        assertEquals(Permission.values().length - 1, admin.size());
        assertFalse(admin.contains(Permission.SYSTEM_ADMIN));
    }

    @Test
    void grantsAreUnmodifiable() {
        assertThrows(UnsupportedOperationException.class,
            () -> permissions.permissionsOf(Role.VIEWER).add(Permission.STORIES_WRITE));
    }
}
