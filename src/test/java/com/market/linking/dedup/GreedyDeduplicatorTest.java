package com.market.linking.dedup;

import com.market.linking.core.model.Domain;
import com.market.linking.core.model.MatchCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GreedyDeduplicator Tests")
class GreedyDeduplicatorTest {

    private final GreedyDeduplicator deduplicator = new GreedyDeduplicator();

    private static MatchCandidate candidate(String leftId, String rightId, double score, double entityOverlap) {
        return new MatchCandidate(leftId, rightId, leftId, rightId, score, Domain.CRYPTO, null,
                entityOverlap, 0.0, null, null);
    }

    @Test
    @DisplayName("Highest composite score claims a contested right record")
    void contestedRightGoesToBestComposite() {
        List<MatchCandidate> accepted = deduplicator.deduplicate(List.of(
                candidate("L1", "R1", 90, 0.5),
                candidate("L2", "R1", 85, 1.0),
                candidate("L3", "R2", 80, 0.3)));

        // composites: L1 105, L2 115, L3 89
        assertEquals(List.of("L2", "L3"), accepted.stream().map(MatchCandidate::leftId).toList());
    }

    @Test
    void tiesKeepPooledOrder() {
        List<MatchCandidate> accepted = deduplicator.deduplicate(List.of(
                candidate("L1", "R1", 90, 0.5),
                candidate("L2", "R1", 90, 0.5)));

        assertEquals(1, accepted.size());
        assertEquals("L1", accepted.get(0).leftId());
    }

    @Test
    void repeatedLeftIdIsAcceptedOnce() {
        List<MatchCandidate> accepted = deduplicator.deduplicate(List.of(
                candidate("L1", "R1", 90, 0.5),
                candidate("L1", "R2", 95, 0.5)));

        assertEquals(List.of("R2"), accepted.stream().map(MatchCandidate::rightId).toList());
    }

    @Test
    @DisplayName("Output is injective on both sides for arbitrary pools")
    void outputIsInjective() {
        Random random = new Random(7);
        List<MatchCandidate> pooled = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            pooled.add(candidate("L" + random.nextInt(60), "R" + random.nextInt(60),
                    80 + random.nextInt(21), random.nextInt(11) / 10.0));
        }

        List<MatchCandidate> accepted = deduplicator.deduplicate(pooled);

        Set<String> lefts = new HashSet<>();
        Set<String> rights = new HashSet<>();
        for (MatchCandidate match : accepted) {
            assertTrue(lefts.add(match.leftId()), "left reused: " + match.leftId());
            assertTrue(rights.add(match.rightId()), "right reused: " + match.rightId());
        }
    }

    @Test
    void inputIsNotModifiedAndEmptyPoolYieldsNothing() {
        List<MatchCandidate> pooled = new ArrayList<>(List.of(
                candidate("L1", "R1", 80, 0.3),
                candidate("L2", "R2", 99, 0.9)));

        deduplicator.deduplicate(pooled);

        assertEquals("L1", pooled.get(0).leftId());
        assertTrue(deduplicator.deduplicate(List.of()).isEmpty());
    }
}
