package com.market.linking.gate;

import com.market.linking.core.model.CatalogSide;
import com.market.linking.core.model.Domain;
import com.market.linking.core.model.MarketRecord;
import com.market.linking.core.model.MatchCandidate;
import com.market.linking.core.model.RawMarket;
import com.market.linking.extraction.MarketNormalizer;
import com.market.linking.similarity.CandidateScorer;
import com.market.linking.similarity.TokenSetSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QualityGate Tests")
class QualityGateTest {

    private final MarketNormalizer normalizer = new MarketNormalizer();
    private final TokenSetSimilarity similarity = new TokenSetSimilarity();
    private final QualityGate gate = new QualityGate();

    private MarketRecord left(String title) {
        return left(title, null);
    }

    private MarketRecord left(String title, String description) {
        return normalizer.normalize(new RawMarket("L-1", title, description, null), CatalogSide.LEFT).orElseThrow();
    }

    private MarketRecord right(String title, String description) {
        return normalizer.normalize(new RawMarket("R-1", title, description, null), CatalogSide.RIGHT).orElseThrow();
    }

    private MatchCandidate scored(MarketRecord left, MarketRecord right) {
        return CandidateScorer.toCandidate(left, right,
                similarity.compute(left.getNormalizedText(), right.getNormalizedText()));
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Same rate-cut question worded differently is accepted")
        void acceptsRateCutPair() {
            MarketRecord left = left("Will the Fed cut rates by 25bps in 2024");
            MarketRecord right = right("Federal Reserve 25 basis point cut expected 2024",
                    "Will the Fed cut rates by 25bps in 2024");
            MatchCandidate candidate = scored(left, right);

            assertEquals(100.0, candidate.score(), 1e-9);
            assertEquals(Domain.MACRO, left.getDomain());
            assertEquals(Domain.MACRO, right.getDomain());
            assertEquals(0.5, candidate.entityOverlapRatio(), 1e-9);

            GateResult result = gate.evaluate(candidate, left, right);
            assertTrue(result.accepted(), result.reasoning());
            assertNull(result.failedRule());
        }

        @Test
        @DisplayName("Fed and Federal Reserve records sharing one entity are accepted")
        void acceptsRecordsSharingHalfTheirEntities() {
            MarketRecord left = MarketRecord.builder()
                    .sourceId("L-FED")
                    .catalog(CatalogSide.LEFT)
                    .title("Will the Fed cut rates by 25bps in 2024")
                    .rawText("Will the Fed cut rates by 25bps in 2024")
                    .normalizedText("will the fed cut rates by 25bps in 2024")
                    .entities(Set.of("fed"))
                    .numbers(Set.of("2024", "25bps"))
                    .domain(Domain.MACRO)
                    .build();
            MarketRecord right = MarketRecord.builder()
                    .sourceId("R-FED")
                    .catalog(CatalogSide.RIGHT)
                    .title("Federal Reserve 25 basis point cut expected 2024")
                    .rawText("Federal Reserve 25 basis point cut expected 2024")
                    .normalizedText("federal reserve 25bps cut expected 2024")
                    .entities(Set.of("federal reserve", "fed"))
                    .numbers(Set.of("2024", "25bps"))
                    .domain(Domain.MACRO)
                    .build();
            MatchCandidate candidate = CandidateScorer.toCandidate(left, right, 86.0);

            assertEquals(0.5, candidate.entityOverlapRatio(), 1e-9);
            assertEquals(Set.of("fed"), candidate.sharedEntities());
            assertEquals(1.0, candidate.numberOverlapRatio(), 1e-9);

            GateResult result = gate.evaluate(candidate, left, right);
            assertTrue(result.accepted(), result.reasoning());
        }

        @Test
        @DisplayName("Rate hike and rate cut are opposite questions")
        void rejectsHikeVersusCut() {
            MarketRecord left = left("Will the Fed hike rates in 2024");
            MarketRecord right = right("Will the Fed cut rates in 2024", null);
            MatchCandidate candidate = scored(left, right);

            assertTrue(candidate.score() >= 80.0);
            assertEquals(GateRule.SEMANTIC_POLARITY, gate.evaluate(candidate, left, right).failedRule());
        }

        @Test
        @DisplayName("Bitcoin above and below the same level are opposite questions")
        void rejectsAboveVersusBelow() {
            MarketRecord left = left("Will Bitcoin be above $100k by the end of 2024");
            MarketRecord right = right("Will Bitcoin be below $100k by the end of 2024", null);
            MatchCandidate candidate = scored(left, right);

            assertTrue(candidate.score() >= 80.0);
            assertFalse(gate.accept(candidate, left, right));
            assertEquals(GateRule.SEMANTIC_POLARITY, gate.evaluate(candidate, left, right).failedRule());
        }

        @Test
        @DisplayName("Political markets sharing only a country are not the same question")
        void rejectsPoliticsWithoutRequiredEntity() {
            MarketRecord left = left("Will a Republican senator from the USA resign");
            MarketRecord right = right("Will a Republican senator from America resign", null);
            MatchCandidate candidate = scored(left, right);

            assertEquals(Domain.POLITICS, left.getDomain());
            assertEquals(Set.of("usa"), candidate.sharedEntities());
            assertTrue(candidate.score() >= 80.0);
            assertEquals(GateRule.DOMAIN_REQUIRED_ENTITY, gate.evaluate(candidate, left, right).failedRule());
        }
    }

    @Nested
    @DisplayName("Rule order")
    class RuleOrder {

        @Test
        void lowScoreFailsFirst() {
            MarketRecord left = left("Will the Fed hike rates");
            MarketRecord right = right("Will the Fed cut rates", null);

            GateResult result = gate.evaluate(CandidateScorer.toCandidate(left, right, 79.0), left, right);

            assertEquals(GateRule.MIN_SCORE, result.failedRule());
            assertTrue(result.reasoning().contains("79.0"));
        }

        @Test
        void noSharedEntityIsRejected() {
            MarketRecord left = left("Will it rain in Paris tomorrow");
            MarketRecord right = right("Will it rain in Paris today", null);

            assertEquals(GateRule.SHARED_ENTITY,
                    gate.evaluate(CandidateScorer.toCandidate(left, right, 90.0), left, right).failedRule());
        }

        @Test
        void thinEntityOverlapIsRejected() {
            MarketRecord left = left("Will Trump meet Putin and Xi Jinping in China");
            MarketRecord right = right("Will Trump visit Russia, Ukraine, Israel and Iran", null);

            assertEquals(GateRule.ENTITY_OVERLAP,
                    gate.evaluate(CandidateScorer.toCandidate(left, right, 90.0), left, right).failedRule());
        }

        @Test
        void disjointBasisPointAmountsAreOpposite() {
            MarketRecord left = left("Will the Fed cut rates by 25bps in December");
            MarketRecord right = right("Will the Fed cut rates by 50 bps in December", null);

            GateResult result = gate.evaluate(CandidateScorer.toCandidate(left, right, 90.0), left, right);

            assertEquals(GateRule.SEMANTIC_POLARITY, result.failedRule());
            assertTrue(result.reasoning().contains("basis-point"));
        }

        @Test
        void distantPercentagesFailNumericCloseness() {
            MarketRecord left = left("Will inflation in the USA reach 10% this year");
            MarketRecord right = right("Will inflation in the USA reach 80% this year", null);

            assertEquals(GateRule.NUMERIC_CLOSENESS,
                    gate.evaluate(CandidateScorer.toCandidate(left, right, 85.0), left, right).failedRule());
            assertTrue(gate.accept(CandidateScorer.toCandidate(left, right, 96.0), left, right));
        }
    }

    @Nested
    @DisplayName("Numeric closeness")
    class NumericCloseness {

        @Test
        void missingNumbersOnEitherSideAgree() {
            assertTrue(gate.numbersAgree(Set.of(), Set.of("2024"), 80.0));
            assertTrue(gate.numbersAgree(Set.of("2024"), Set.of(), 80.0));
        }

        @Test
        void sharedTokenAgrees() {
            assertTrue(gate.numbersAgree(Set.of("2024", "$5m"), Set.of("2024", "$9m"), 80.0));
        }

        @Test
        void basisPointsWithinToleranceAgree() {
            assertTrue(gate.numbersAgree(Set.of("25bps"), Set.of("60bps"), 80.0));
            assertFalse(gate.numbersAgree(Set.of("25bps"), Set.of("100bps"), 80.0));
        }

        @Test
        void toleranceGrowsWithLeftValue() {
            // max(50, 400 * 0.2) = 80
            assertTrue(gate.numbersAgree(Set.of("400bps"), Set.of("475bps"), 80.0));
            assertFalse(gate.numbersAgree(Set.of("400bps"), Set.of("490bps"), 80.0));
        }

        @Test
        @DisplayName("Dollar amounts and plain numbers are not re-parsed")
        void unparsedShapesOnlyPassOnStrongText() {
            assertFalse(gate.numbersAgree(Set.of("$5m"), Set.of("$6m"), 94.9));
            assertFalse(gate.numbersAgree(Set.of("2024"), Set.of("2025"), 90.0));
            assertTrue(gate.numbersAgree(Set.of("2024"), Set.of("2025"), 95.0));
        }
    }

    @Test
    void exposesThresholds() {
        assertEquals(80.0, gate.getMinScore());
        assertEquals(0.3, gate.getMinEntityOverlap());
    }
}
