package com.catalogiq.ai.service;

import com.catalogiq.ai.config.AiConfig;
import com.catalogiq.engine.spi.OracleException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeminiOracleTest {

    @Test
    void testParseBoolean_Variants() {
        assertTrue(GeminiOracle.parseBoolean("TRUE"));
        assertTrue(GeminiOracle.parseBoolean("true."));
        assertTrue(GeminiOracle.parseBoolean("Yes, these are the same product"));
        assertFalse(GeminiOracle.parseBoolean("FALSE"));
        assertFalse(GeminiOracle.parseBoolean("  false\n"));
        assertFalse(GeminiOracle.parseBoolean("No."));
    }

    @Test
    void testParseBoolean_FirstVerdictWins() {
        assertFalse(GeminiOracle.parseBoolean("FALSE - not TRUE duplicates"));
    }

    @Test
    void testParseBoolean_Unparseable() {
        assertThrows(OracleException.class, () -> GeminiOracle.parseBoolean("Maybe"));
        assertThrows(OracleException.class, () -> GeminiOracle.parseBoolean("untrue"));
        assertThrows(OracleException.class, () -> GeminiOracle.parseBoolean(null));
    }

    @Test
    void testParseScore_FirstNumber() {
        assertEquals(8.0, GeminiOracle.parseScore("8"));
        assertEquals(7.5, GeminiOracle.parseScore("Score: 7.5/10"));
        assertEquals(6.0, GeminiOracle.parseScore("6 out of 10"));
    }

    @Test
    void testParseScore_Unparseable() {
        assertThrows(OracleException.class, () -> GeminiOracle.parseScore("excellent"));
        assertThrows(OracleException.class, () -> GeminiOracle.parseScore(null));
    }

    @Test
    void testBlankProjectLeavesOracleUnavailable() {
        GeminiOracle oracle = new GeminiOracle(new AiConfig(), "", "us-central1", "gemini-2.0-flash");

        assertFalse(oracle.isAvailable());
        assertThrows(OracleException.class, () -> oracle.validateBool("Are these the same product?"));
        assertThrows(OracleException.class, () -> oracle.explain("Why?"));
    }
}
