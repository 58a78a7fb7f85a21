package com.catalogiq.engine.service;

import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.enums.MatchConfidence;
import com.catalogiq.common.exception.EngineException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AcceptancePolicyTest {

    private final AcceptancePolicy policy = AcceptancePolicy.of(0.85,
            Map.of(Aspect.TITLE, 0.95, Aspect.ATTRIBUTES, 0.85));

    @Test
    void testEvaluate_CombinedThresholdIsInclusive() {
        AcceptancePolicy.Decision atBound = policy.evaluate(Map.of(Aspect.TITLE, 0.5), 0.85);
        assertTrue(atBound.accepted());
        assertEquals(List.of(AcceptancePolicy.COMBINED), atBound.triggeredBy());
        assertEquals(MatchConfidence.POSSIBLE, atBound.confidence());

        AcceptancePolicy.Decision below = policy.evaluate(Map.of(Aspect.TITLE, 0.5), Math.nextDown(0.85));
        assertFalse(below.accepted());
        assertTrue(below.triggeredBy().isEmpty());
    }

    @Test
    void testEvaluate_SingleAspectOverrideFires() {
        AcceptancePolicy.Decision decision = policy.evaluate(
                Map.of(Aspect.TITLE, 0.97, Aspect.FULL, 0.6, Aspect.ATTRIBUTES, 0.6), 0.71);

        assertTrue(decision.accepted());
        assertEquals(List.of("title"), decision.triggeredBy());
        assertEquals(MatchConfidence.DEFINITE, decision.confidence());
    }

    @Test
    void testEvaluate_OverrideBoundIsInclusive() {
        assertTrue(policy.evaluate(Map.of(Aspect.ATTRIBUTES, 0.85), 0.1).accepted());
        assertFalse(policy.evaluate(Map.of(Aspect.ATTRIBUTES, Math.nextDown(0.85)), 0.1).accepted());
    }

    @Test
    void testEvaluate_AspectWithoutOverrideNeverFiresAlone() {
        assertFalse(policy.evaluate(Map.of(Aspect.FULL, 1.0), 0.5).accepted());
    }

    @Test
    void testEvaluate_MissingAspectScoreIgnored() {
        AcceptancePolicy.Decision decision = policy.evaluate(Map.of(), 0.9);
        assertTrue(decision.accepted());
        assertEquals(MatchConfidence.LIKELY, decision.confidence());
    }

    @Test
    void testEvaluate_CombinedAndOverrideBothReported() {
        AcceptancePolicy.Decision decision = policy.evaluate(Map.of(Aspect.TITLE, 0.96), 0.9);
        assertEquals(List.of("title", AcceptancePolicy.COMBINED), decision.triggeredBy());
    }

    @Test
    void testCombinedOnly_IgnoresAspects() {
        AcceptancePolicy combinedOnly = AcceptancePolicy.combinedOnly(0.85);
        assertFalse(combinedOnly.evaluate(Map.of(Aspect.TITLE, 1.0), 0.8).accepted());
        assertTrue(combinedOnly.getAspectOverrides().isEmpty());
    }

    @Test
    void testOf_RejectsThresholdOutOfRange() {
        assertThrows(EngineException.class, () -> AcceptancePolicy.of(1.5, Map.of()));
        assertThrows(EngineException.class, () -> AcceptancePolicy.of(-1.01, Map.of()));
        assertThrows(EngineException.class, () -> AcceptancePolicy.of(Double.NaN, Map.of()));
    }
}
