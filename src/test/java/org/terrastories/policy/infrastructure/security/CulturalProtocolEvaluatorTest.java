package org.terrastories.policy.infrastructure.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.terrastories.policy.domain.model.CulturalProtocol;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.Operation;
import org.terrastories.policy.domain.model.PermissionLevel;
import org.terrastories.policy.domain.model.ReasonCode;
import org.terrastories.policy.domain.model.Role;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cultural protocol evaluator")
class CulturalProtocolEvaluatorTest {

    private final CulturalProtocolEvaluator evaluator = new CulturalProtocolEvaluator();

    @ParameterizedTest
    @EnumSource(value = Role.class, names = {"VIEWER", "EDITOR"})
    @DisplayName("Elder-only content is closed to non-custodians for every operation")
    void elderOnlyBlocksNonCustodians(Role role) {
        for (Operation op : Operation.values()) {
            Decision decision = evaluator.check(CulturalProtocol.elderOnly(), role, op);
            assertEquals(ReasonCode.ELDER_ONLY, decision.getReasonCode(), op.name());
        }
    }

    @ParameterizedTest
    @EnumSource(value = Role.class, names = {"ELDER", "ADMIN"})
    @DisplayName("Custodians pass elder-only and ceremonial gates")
    void custodiansPass(Role role) {
        CulturalProtocol protocol = new CulturalProtocol(PermissionLevel.ELDER_ONLY, true, false);

        assertTrue(evaluator.check(protocol, role, Operation.READ).isAllowed());
    }

    @Test
    @DisplayName("Elder-only is reported before ceremonial")
    void elderOnlyWinsOverCeremonial() {
        CulturalProtocol protocol = new CulturalProtocol(PermissionLevel.ELDER_ONLY, true, true);

        assertEquals(ReasonCode.ELDER_ONLY, evaluator.check(protocol, Role.VIEWER, Operation.READ).getReasonCode());
    }

    @Test
    @DisplayName("Ceremonial content is closed to editors even at public tier")
    void ceremonialBlocksEditor() {
        CulturalProtocol protocol = CulturalProtocol.publicContent().withCeremonialContent(true);

        assertEquals(ReasonCode.CEREMONIAL_RESTRICTED,
            evaluator.check(protocol, Role.EDITOR, Operation.READ).getReasonCode());
    }

    @Test
    @DisplayName("Elder approval gates writes by anyone but an elder")
    void elderApprovalGatesWrite() {
        CulturalProtocol protocol = CulturalProtocol.communityContent().withElderApprovalRequired(true);

        assertEquals(ReasonCode.ELDER_APPROVAL_REQUIRED,
            evaluator.check(protocol, Role.EDITOR, Operation.WRITE).getReasonCode());
        assertEquals(ReasonCode.ELDER_APPROVAL_REQUIRED,
            evaluator.check(protocol, Role.ADMIN, Operation.WRITE).getReasonCode());
        assertTrue(evaluator.check(protocol, Role.ELDER, Operation.WRITE).isAllowed());
    }

    @ParameterizedTest
    @EnumSource(value = Operation.class, names = {"READ", "DELETE", "CREATE"})
    @DisplayName("Elder approval does not apply outside write")
    void elderApprovalOnlyOnWrite(Operation operation) {
        CulturalProtocol protocol = CulturalProtocol.communityContent().withElderApprovalRequired(true);

        assertTrue(evaluator.check(protocol, Role.EDITOR, operation).isAllowed());
    }

    @Test
    @DisplayName("Restricted tier alone is not a protocol denial")
    void restrictedTierPasses() {
        assertTrue(evaluator.check(CulturalProtocol.restrictedContent(), Role.VIEWER, Operation.READ).isAllowed());
    }

    @Test
    void custodianSetIsExact() {
        assertTrue(CulturalProtocolEvaluator.isCulturalCustodian(Role.ELDER));
        assertTrue(CulturalProtocolEvaluator.isCulturalCustodian(Role.ADMIN));
        assertFalse(CulturalProtocolEvaluator.isCulturalCustodian(Role.EDITOR));
        assertFalse(CulturalProtocolEvaluator.isCulturalCustodian(Role.VIEWER));
        assertFalse(CulturalProtocolEvaluator.isCulturalCustodian(Role.SUPER_ADMIN));
    }
}
