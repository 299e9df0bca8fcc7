package com.market.linking.gate;

import com.market.linking.core.model.MarketRecord;
import com.market.linking.core.model.MatchCandidate;
import com.market.linking.extraction.NumberExtractor;
import com.market.linking.similarity.JaccardSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Precision-first acceptance policy for scored candidates.
 *
 * <p>Rules are evaluated in the order of {@link GateRule}; the first failure
 * rejects the candidate:</p>
 * <ol>
 *   <li>text score at least {@value #DEFAULT_MIN_SCORE}</li>
 *   <li>the records share at least one entity</li>
 *   <li>entity overlap ratio at least {@value #DEFAULT_MIN_ENTITY_OVERLAP}</li>
 *   <li>no opposite wording or conflicting basis-point amounts</li>
 *   <li>the domain's required vocabulary is among the shared entities</li>
 *   <li>when both sides carry numbers that do not intersect, some basis-point or
 *       percentage value pair is close, or the text score is at least
 *       {@value #DEFAULT_STRONG_TEXT_SCORE}</li>
 * </ol>
 */
public class QualityGate {
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    public static final double DEFAULT_MIN_SCORE = 80.0;
    public static final double DEFAULT_MIN_ENTITY_OVERLAP = 0.3;
    public static final double DEFAULT_STRONG_TEXT_SCORE = 95.0;
    static final double MIN_NUMERIC_TOLERANCE = 50.0;
    static final double RELATIVE_NUMERIC_TOLERANCE = 0.2;

    private final double minScore;
    private final double minEntityOverlap;
    private final double strongTextScore;
    private final SemanticPolarityCheck polarityCheck;
    private final DomainEntityRequirements domainRequirements;

    public QualityGate() {
        this(DEFAULT_MIN_SCORE, DEFAULT_MIN_ENTITY_OVERLAP, DEFAULT_STRONG_TEXT_SCORE,
                new SemanticPolarityCheck(), DomainEntityRequirements.defaults());
    }

    public QualityGate(double minScore,
                       double minEntityOverlap,
                       double strongTextScore,
                       SemanticPolarityCheck polarityCheck,
                       DomainEntityRequirements domainRequirements) {
        this.minScore = minScore;
        this.minEntityOverlap = minEntityOverlap;
        this.strongTextScore = strongTextScore;
        this.polarityCheck = polarityCheck;
        this.domainRequirements = domainRequirements;
    }

    public boolean accept(MatchCandidate candidate, MarketRecord left, MarketRecord right) {
        return evaluate(candidate, left, right).accepted();
    }

    /**
     * Runs the candidate through every rule and reports the first failure.
     */
    public GateResult evaluate(MatchCandidate candidate, MarketRecord left, MarketRecord right) {
        GateResult result = runRules(candidate, left, right);
        if (!result.accepted()) {
            log.debug("gate.rejected left={} right={} rule={} reason={}",
                    candidate.leftId(), candidate.rightId(), result.failedRule(), result.reasoning());
        }
        return result;
    }

    private GateResult runRules(MatchCandidate candidate, MarketRecord left, MarketRecord right) {
        double score = candidate.score();
        if (score < minScore) {
            return GateResult.reject(GateRule.MIN_SCORE,
                    String.format(Locale.ROOT, "score %.1f below %.1f", score, minScore));
        }

        Set<String> sharedEntities = JaccardSimilarity.intersection(left.getEntities(), right.getEntities());
        if (sharedEntities.isEmpty()) {
            return GateResult.reject(GateRule.SHARED_ENTITY, "no shared entity");
        }

        double entityOverlap = JaccardSimilarity.ratio(left.getEntities(), right.getEntities());
        if (entityOverlap < minEntityOverlap) {
            return GateResult.reject(GateRule.ENTITY_OVERLAP,
                    String.format(Locale.ROOT, "entity overlap %.3f below %.3f", entityOverlap, minEntityOverlap));
        }

        Optional<String> conflict = polarityCheck.findConflict(left.getRawText(), right.getRawText());
        if (conflict.isPresent()) {
            return GateResult.reject(GateRule.SEMANTIC_POLARITY, conflict.get());
        }

        if (!domainRequirements.isSatisfied(left.getDomain(), sharedEntities)) {
            return GateResult.reject(GateRule.DOMAIN_REQUIRED_ENTITY,
                    "shared entities " + sharedEntities + " miss the " + left.getDomain().label() + " vocabulary");
        }

        if (!numbersAgree(left.getNumbers(), right.getNumbers(), score)) {
            return GateResult.reject(GateRule.NUMERIC_CLOSENESS,
                    "numbers " + left.getNumbers() + " vs " + right.getNumbers() + " are not close");
        }

        return GateResult.accept();
    }

    /**
     * Numbers agree when either side has none, the token sets intersect, some
     * basis-point/percentage pair is within {@code max(50, left * 0.2)}, or the
     * text score alone is strong enough. Dollar amounts and plain literals are
     * not re-parsed for the proximity check.
     */
    boolean numbersAgree(Set<String> leftNumbers, Set<String> rightNumbers, double score) {
        if (leftNumbers.isEmpty() || rightNumbers.isEmpty()) {
            return true;
        }
        if (!JaccardSimilarity.intersection(leftNumbers, rightNumbers).isEmpty()) {
            return true;
        }

        List<Double> leftValues = scalars(leftNumbers);
        List<Double> rightValues = scalars(rightNumbers);
        for (double leftValue : leftValues) {
            double tolerance = Math.max(MIN_NUMERIC_TOLERANCE, leftValue * RELATIVE_NUMERIC_TOLERANCE);
            for (double rightValue : rightValues) {
                if (Math.abs(leftValue - rightValue) <= tolerance) {
                    return true;
                }
            }
        }
        return score >= strongTextScore;
    }

    private static List<Double> scalars(Set<String> tokens) {
        List<Double> values = new ArrayList<>();
        for (String token : tokens) {
            Double value = NumberExtractor.parseScalar(token);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    public double getMinScore() {
        return minScore;
    }

    public double getMinEntityOverlap() {
        return minEntityOverlap;
    }
}
