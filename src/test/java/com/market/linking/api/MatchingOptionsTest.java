package com.market.linking.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchingOptions Tests")
class MatchingOptionsTest {

    @Test
    void defaultsMatchDocumentedValues() {
        MatchingOptions options = MatchingOptions.defaults();

        assertEquals(80.0, options.getScoreCutoff());
        assertEquals(24.0, options.getMaxTimeDiffHours());
        assertEquals(1, options.getParallelism());
        assertEquals(3_000, options.getProgressInterval());
    }

    @Test
    void builderOverridesDefaults() {
        MatchingOptions options = MatchingOptions.builder()
                .scoreCutoff(90)
                .maxTimeDiffHours(0)
                .parallelism(8)
                .progressInterval(10)
                .build();

        assertEquals(90.0, options.getScoreCutoff());
        assertEquals(0.0, options.getMaxTimeDiffHours());
        assertEquals(8, options.getParallelism());
        assertEquals(10, options.getProgressInterval());
        assertTrue(options.toString().contains("parallelism=8"));
    }

    @Test
    @DisplayName("Invalid values are rejected at build time")
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().scoreCutoff(100.5).build());
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().scoreCutoff(-0.1).build());
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().scoreCutoff(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().maxTimeDiffHours(-1).build());
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().parallelism(0).build());
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().progressInterval(0).build());
    }
}
