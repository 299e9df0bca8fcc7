package com.market.linking.bulk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.market.linking.core.model.MatchCandidate;
import com.market.linking.core.model.MatchSet;
import com.market.linking.core.model.MatchingCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes a {@link MatchSet} as a pretty-printed JSON document.
 *
 * <p>Output format:</p>
 * <pre>
 * {
 *   "generated_at" : "2024-11-05T12:00:00Z",
 *   "total_matches" : 1,
 *   "matching_criteria" : { "min_text_similarity" : 80.0, ... },
 *   "matches" : [ {
 *     "left_id" : "FED-24DEC", "right_id" : "0xabc", ...
 *     "time_diff_hours" : 3.5, "entity_overlap" : 0.5, "shared_numbers" : [ "2024", "25bps" ]
 *   } ]
 * }
 * </pre>
 *
 * <p>{@code time_diff_hours} is rounded to one decimal and written as null when
 * unknown; overlap ratios are rounded to three decimals.</p>
 */
public class JsonMatchSetExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonMatchSetExporter.class);

    private final ObjectMapper objectMapper;

    public JsonMatchSetExporter() {
        this(new ObjectMapper());
    }

    public JsonMatchSetExporter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required")
                .copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    /**
     * Writes the document to {@code path}, creating parent directories as needed.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public ExportResult export(MatchSet matchSet, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                export(matchSet, writer);
            }
        } catch (IOException e) {
            log.error("export.failed path={} error={}", path, e.getMessage());
            throw new UncheckedIOException("Failed to write match set to " + path, e);
        }
        ExportResult result = new ExportResult(matchSet.size(), path.toString());
        log.info("export.completed result={}", result);
        return result;
    }

    /**
     * Writes the document to {@code writer}. The writer is flushed, not closed.
     */
    public void export(MatchSet matchSet, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toDocument(matchSet));
        writer.flush();
    }

    /**
     * Serializes the document to a string.
     */
    public String toJson(MatchSet matchSet) {
        try {
            return objectMapper.writeValueAsString(toDocument(matchSet));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize match set", e);
        }
    }

    static MatchSetDocument toDocument(MatchSet matchSet) {
        List<MatchEntry> entries = new ArrayList<>(matchSet.size());
        for (MatchCandidate match : matchSet.matches()) {
            entries.add(new MatchEntry(
                    match.leftId(),
                    match.rightId(),
                    match.leftTitle(),
                    match.rightTitle(),
                    match.score(),
                    match.domain().label(),
                    match.timeDiffHours() != null ? round(match.timeDiffHours(), 1) : null,
                    round(match.entityOverlapRatio(), 3),
                    round(match.numberOverlapRatio(), 3),
                    List.copyOf(match.sharedEntities()),
                    List.copyOf(match.sharedNumbers())));
        }
        MatchingCriteria criteria = matchSet.criteria();
        return new MatchSetDocument(
                matchSet.generatedAt().toString(),
                matchSet.size(),
                new CriteriaEntry(
                        criteria.minTextSimilarity(),
                        criteria.minEntityOverlapRatio(),
                        criteria.strictEntityMatching(),
                        criteria.semanticOppositeFiltering(),
                        criteria.domainExactMatch(),
                        criteria.maxTimeDiffHours()),
                entries);
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    @JsonPropertyOrder({"generated_at", "total_matches", "matching_criteria", "matches"})
    record MatchSetDocument(
            @JsonProperty("generated_at") String generatedAt,
            @JsonProperty("total_matches") int totalMatches,
            @JsonProperty("matching_criteria") CriteriaEntry matchingCriteria,
            @JsonProperty("matches") List<MatchEntry> matches
    ) {}

    @JsonPropertyOrder({"min_text_similarity", "min_entity_overlap_ratio", "strict_entity_matching",
            "semantic_opposite_filtering", "domain_exact_match", "max_time_diff_hours"})
    record CriteriaEntry(
            @JsonProperty("min_text_similarity") double minTextSimilarity,
            @JsonProperty("min_entity_overlap_ratio") double minEntityOverlapRatio,
            @JsonProperty("strict_entity_matching") boolean strictEntityMatching,
            @JsonProperty("semantic_opposite_filtering") boolean semanticOppositeFiltering,
            @JsonProperty("domain_exact_match") boolean domainExactMatch,
            @JsonProperty("max_time_diff_hours") double maxTimeDiffHours
    ) {}

    @JsonPropertyOrder({"left_id", "right_id", "left_title", "right_title", "score", "domain",
            "time_diff_hours", "entity_overlap", "number_overlap", "shared_entities", "shared_numbers"})
    record MatchEntry(
            @JsonProperty("left_id") String leftId,
            @JsonProperty("right_id") String rightId,
            @JsonProperty("left_title") String leftTitle,
            @JsonProperty("right_title") String rightTitle,
            @JsonProperty("score") double score,
            @JsonProperty("domain") String domain,
            @JsonInclude(JsonInclude.Include.ALWAYS)
            @JsonProperty("time_diff_hours") Double timeDiffHours,
            @JsonProperty("entity_overlap") double entityOverlap,
            @JsonProperty("number_overlap") double numberOverlap,
            @JsonProperty("shared_entities") List<String> sharedEntities,
            @JsonProperty("shared_numbers") List<String> sharedNumbers
    ) {}
}
