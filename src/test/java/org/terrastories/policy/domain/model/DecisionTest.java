package org.terrastories.policy.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    @Test
    void allowCarriesOk() {
        Decision decision = Decision.allow();

        assertTrue(decision.isAllowed());
        assertFalse(decision.isDenied());
        assertEquals(ReasonCode.OK, decision.getReasonCode());
    }

    @Test
    void denyCarriesReasonAndDetail() {
        Decision decision = Decision.deny(ReasonCode.NOT_CREATOR, "Editors can only modify content they created");

        assertTrue(decision.isDenied());
        assertEquals(ReasonCode.NOT_CREATOR, decision.getReasonCode());
        assertEquals("Editors can only modify content they created", decision.getDetail());
    }

    @Test
    void denyRejectsOk() {
        assertThrows(IllegalArgumentException.class, () -> Decision.deny(ReasonCode.OK, "nope"));
    }

    @Test
    void denyRequiresDetail() {
        assertThrows(NullPointerException.class, () -> Decision.deny(ReasonCode.ELDER_ONLY, null));
    }

    @Test
    void equalInputsGiveEqualDecisions() {
        assertEquals(Decision.allow(), Decision.allow());
        assertEquals(
            Decision.deny(ReasonCode.ELDER_ONLY, "x"),
            Decision.deny(ReasonCode.ELDER_ONLY, "x"));
    }
}
