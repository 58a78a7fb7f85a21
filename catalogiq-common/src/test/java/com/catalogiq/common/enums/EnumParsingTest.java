package com.catalogiq.common.enums;

import com.catalogiq.common.exception.EngineException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class EnumParsingTest {

    @Test
    void testAspectFromName_CaseInsensitive() {
        assertEquals(Aspect.TITLE, Aspect.fromName("title"));
        assertEquals(Aspect.ATTRIBUTES, Aspect.fromName(" Attributes "));
        assertEquals("full", Aspect.FULL.toJson());
    }

    @Test
    void testAspectFromName_UnknownIsInvalidParameter() {
        EngineException ex = assertThrows(EngineException.class, () -> Aspect.fromName("color"));
        assertEquals("INVALID_PARAMETER", ex.getErrorCode());
        assertEquals("aspect", ex.getContext().get("parameter"));
    }

    @Test
    void testRecommendationMode_HyphenatedName() {
        assertEquals(RecommendationMode.CROSS_SELL, RecommendationMode.fromName("cross-sell"));
        assertEquals(RecommendationMode.SUBSTITUTES, RecommendationMode.fromName("SUBSTITUTES"));
        assertEquals("cross-sell", RecommendationMode.CROSS_SELL.toJson());
        assertThrows(EngineException.class, () -> RecommendationMode.fromName("bundles"));
    }

    @Test
    void testMatchConfidence_BandsAreInclusive() {
        assertEquals(MatchConfidence.DEFINITE, MatchConfidence.of(0.95));
        assertEquals(MatchConfidence.LIKELY, MatchConfidence.of(Math.nextDown(0.95)));
        assertEquals(MatchConfidence.LIKELY, MatchConfidence.of(0.90));
        assertEquals(MatchConfidence.POSSIBLE, MatchConfidence.of(0.85));
        assertEquals(MatchConfidence.SIMILAR, MatchConfidence.of(0.5));
        assertEquals(MatchConfidence.SIMILAR, MatchConfidence.of(-1.0));
    }

    @Test
    void testPriceComparison() {
        assertEquals(PriceComparison.BETTER_VALUE, PriceComparison.compare(new BigDecimal("89.99"), new BigDecimal("99.99")));
        assertEquals(PriceComparison.SAME_PRICE, PriceComparison.compare(new BigDecimal("100.0"), new BigDecimal("100")));
        assertEquals(PriceComparison.PREMIUM_OPTION, PriceComparison.compare(new BigDecimal("120"), new BigDecimal("100")));
    }
}
