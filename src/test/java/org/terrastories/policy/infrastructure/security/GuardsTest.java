package org.terrastories.policy.infrastructure.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.terrastories.policy.domain.model.Actor;
import org.terrastories.policy.domain.model.CulturalProtocol;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.Role;

import static org.junit.jupiter.api.Assertions.*;
import static org.terrastories.policy.PolicyFixtures.COMMUNITY_1;
import static org.terrastories.policy.PolicyFixtures.COMMUNITY_2;
import static org.terrastories.policy.PolicyFixtures.story;

@DisplayName("Sovereignty and community scope guards")
class GuardsTest {

    private final DataSovereigntyGuard sovereignty = new DataSovereigntyGuard();
    private final CommunityScopeGuard scope = new CommunityScopeGuard();

    @Test
    void superAdminIsBlocked() {
        Decision decision = sovereignty.check(Actor.superAdmin(1L));

        assertEquals(ReasonCode.SOVEREIGNTY_BLOCK, decision.getReasonCode());
        assertEquals(DataSovereigntyGuard.BLOCK_DETAIL, decision.getDetail());
    }

    @Test
    @DisplayName("A super admin row that carries a community is still blocked")
    void superAdminWithCommunityIsBlocked() {
        assertTrue(sovereignty.check(new Actor(1L, Role.SUPER_ADMIN, COMMUNITY_1)).isDenied());
    }

    @ParameterizedTest
    @EnumSource(value = Role.class, names = "SUPER_ADMIN", mode = EnumSource.Mode.EXCLUDE)
    void communityRolesPassSovereignty(Role role) {
        assertTrue(sovereignty.check(Actor.member(1L, role, COMMUNITY_1)).isAllowed());
    }

    @Test
    void sameCommunityPasses() {
        assertTrue(scope.check(
            Actor.member(1L, Role.VIEWER, COMMUNITY_1),
            story(5L, COMMUNITY_1, CulturalProtocol.publicContent())).isAllowed());
    }

    @Test
    void otherCommunityIsMismatch() {
        Decision decision = scope.check(
            Actor.member(1L, Role.ADMIN, COMMUNITY_2),
            story(5L, COMMUNITY_1, CulturalProtocol.publicContent()));

        assertEquals(ReasonCode.COMMUNITY_MISMATCH, decision.getReasonCode());
        assertEquals(CommunityScopeGuard.MISMATCH_DETAIL, decision.getDetail());
    }

    @Test
    @DisplayName("Missing community ids never match, not even each other")
    void nullCommunityNeverMatches() {
        Actor homeless = new Actor(1L, Role.ADMIN, null);

        assertTrue(scope.check(homeless, story(5L, null, CulturalProtocol.publicContent())).isDenied());
        assertTrue(scope.check(homeless, story(5L, COMMUNITY_1, CulturalProtocol.publicContent())).isDenied());
        assertTrue(scope.check(
            Actor.member(1L, Role.ADMIN, COMMUNITY_1),
            story(5L, null, CulturalProtocol.publicContent())).isDenied());
    }
}
