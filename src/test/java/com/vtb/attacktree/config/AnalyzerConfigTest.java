package com.vtb.attacktree.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerConfigTest {

    @Test
    void testBundledConfig() {
        AnalyzerConfig config = AnalyzerConfig.load();

        assertEquals(1_000, config.getEvaluation().getMaxDepth());
        assertEquals(3, config.getEvaluation().getTopContributors());
        assertEquals(10L * 1024 * 1024, config.getLoader().maxFileSizeBytes());
        assertEquals(1.0, config.getSensitivity().getDefaultMultiplier());
        assertSame(config, AnalyzerConfig.load(), "Конфигурация кешируется");
    }

    @Test
    void testPartialConfigFallsBackToDefaults() {
        AnalyzerConfig config = AnalyzerConfig.load("config/partial-config.yaml");

        assertEquals(5, config.getEvaluation().getTopContributors());
        assertEquals(1_000, config.getEvaluation().getMaxDepth());
        assertNotNull(config.getLoader());
        assertEquals(1.0, config.getSensitivity().getDefaultMultiplier());
    }

    @Test
    void testMissingResource() {
        assertThrows(IllegalStateException.class, () -> AnalyzerConfig.load("config/absent.yaml"));
    }
}
