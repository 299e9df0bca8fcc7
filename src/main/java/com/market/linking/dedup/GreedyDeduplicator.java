package com.market.linking.dedup;

import com.market.linking.core.model.MatchCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the pooled candidates into a one-to-one pairing.
 *
 * <p>Candidates are ranked by {@link MatchCandidate#compositeScore()} (descending,
 * stable, so ties keep their pooled order) and walked greedily: a candidate is
 * accepted only if neither its left id nor its right id has been consumed by an
 * earlier acceptance. The walk is sequential by nature and must see the complete
 * pooled list.</p>
 */
public class GreedyDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(GreedyDeduplicator.class);

    private static final Comparator<MatchCandidate> BY_COMPOSITE_DESCENDING =
            Comparator.comparingDouble(MatchCandidate::compositeScore).reversed();

    /**
     * @param pooled the complete pooled candidate list; not modified
     * @return accepted candidates in acceptance order
     */
    public List<MatchCandidate> deduplicate(List<MatchCandidate> pooled) {
        List<MatchCandidate> ranked = new ArrayList<>(pooled);
        ranked.sort(BY_COMPOSITE_DESCENDING);

        Set<String> usedLeft = new HashSet<>();
        Set<String> usedRight = new HashSet<>();
        List<MatchCandidate> accepted = new ArrayList<>();

        for (MatchCandidate candidate : ranked) {
            if (usedLeft.contains(candidate.leftId()) || usedRight.contains(candidate.rightId())) {
                log.debug("dedup.skipped left={} right={} composite={}",
                        candidate.leftId(), candidate.rightId(), candidate.compositeScore());
                continue;
            }
            usedLeft.add(candidate.leftId());
            usedRight.add(candidate.rightId());
            accepted.add(candidate);
        }

        log.info("dedup.completed pooled={} accepted={}", pooled.size(), accepted.size());
        return List.copyOf(accepted);
    }
}
