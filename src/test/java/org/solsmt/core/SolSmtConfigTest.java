package org.solsmt.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SolSmtConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SolSmtConfig.MAX_DEPTH_PROPERTY);
        System.clearProperty(SolSmtConfig.STRICT_PARENTHESES_PROPERTY);
    }

    @Test
    void testDefaults() {
        SolSmtConfig config = SolSmtConfig.defaults();
        assertEquals(SolSmtConfig.DEFAULT_MAX_DEPTH, config.getMaxDepth());
        assertFalse(config.isStrictParentheses());
    }

    @Test
    void testSystemProperties() {
        System.setProperty(SolSmtConfig.MAX_DEPTH_PROPERTY, "42");
        System.setProperty(SolSmtConfig.STRICT_PARENTHESES_PROPERTY, "true");

        SolSmtConfig config = SolSmtConfig.fromSystemProperties();
        assertEquals(42, config.getMaxDepth());
        assertTrue(config.isStrictParentheses());
    }

    @Test
    void testInvalidDepthFallsBackToDefault() {
        System.setProperty(SolSmtConfig.MAX_DEPTH_PROPERTY, "deep");
        assertEquals(SolSmtConfig.DEFAULT_MAX_DEPTH, SolSmtConfig.fromSystemProperties().getMaxDepth());

        System.setProperty(SolSmtConfig.MAX_DEPTH_PROPERTY, "0");
        assertEquals(SolSmtConfig.DEFAULT_MAX_DEPTH, SolSmtConfig.fromSystemProperties().getMaxDepth());
    }

    @Test
    void testNonPositiveDepthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SolSmtConfig.of(0, false));
    }
}
