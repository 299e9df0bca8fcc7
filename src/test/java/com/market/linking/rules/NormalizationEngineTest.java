package com.market.linking.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NormalizationEngine Tests")
class NormalizationEngineTest {

    private final NormalizationEngine engine = DefaultNormalizationRules.createFoldingEngine();

    @ParameterizedTest
    @CsvSource({
            "'Will the Fed cut rates?', 'will the fed cut rates'",
            "'Bitcoin above $100k by 2024-12-31', 'bitcoin above 100k by 2024 12 31'",
            "'  Trump   vs.  Harris  ', 'trump vs harris'",
            "'S&P 500 > 5,000', 's p 500 5 000'"
    })
    void shouldFoldPunctuationCaseAndWhitespace(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    void shouldKeepNonAsciiLetters() {
        assertEquals("zürich élection 2024", engine.normalize("Zürich: Élection (2024)"));
    }

    @Test
    void equivalentWordingShouldFoldToSameText() {
        assertTrue(engine.areEquivalent("Will BTC hit $100k?", "will btc hit 100k"));
        assertFalse(engine.areEquivalent("Will BTC hit $100k?", "will eth hit 100k"));
    }

    @Test
    void nullOrBlankShouldFoldToEmpty() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize("   "));
        assertEquals("", engine.normalize("?!."));
    }

    @Test
    void rulesShouldApplyInPriorityOrder() {
        NormalizationRule second = NormalizationRule.builder()
                .name("second").pattern("b").replacement("c").priority(20).build();
        NormalizationRule first = NormalizationRule.builder()
                .name("first").pattern("a").replacement("b").priority(10).build();
        NormalizationEngine custom = new NormalizationEngine(List.of(second, first));

        assertEquals("c", custom.normalize("a"));
        assertEquals("first", custom.getRules().get(0).getName());
    }

    @Test
    void ruleBuilderShouldRequireName() {
        NullPointerException e = assertThrows(NullPointerException.class,
                () -> NormalizationRule.builder().pattern("x").replacement("y").build());
        assertTrue(e.getMessage().contains("name"));
    }
}
