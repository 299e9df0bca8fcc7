package com.market.linking.config;

import com.market.linking.api.MatchingOptions;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads matching settings from MicroProfile Config.
 *
 * <p>Every value can be overridden by a system property, an environment variable
 * or {@code META-INF/microprofile-config.properties}:</p>
 * <pre>
 * market-linking.matching.score-cutoff=80
 * market-linking.matching.max-time-diff-hours=24
 * market-linking.matching.parallelism=1
 * market-linking.matching.progress-interval=3000
 * market-linking.input.left-path=data/kalshi_markets.json
 * market-linking.input.right-path=data/polymarket_markets.json
 * market-linking.output.path=data/market_matches.json
 * </pre>
 */
public class MatchingConfig {

    private static final Logger log = LoggerFactory.getLogger(MatchingConfig.class);

    // ── Matching ──────────────────────────────────────────────

    public static final String SCORE_CUTOFF = "market-linking.matching.score-cutoff";
    public static final String MAX_TIME_DIFF_HOURS = "market-linking.matching.max-time-diff-hours";
    public static final String PARALLELISM = "market-linking.matching.parallelism";
    public static final String PROGRESS_INTERVAL = "market-linking.matching.progress-interval";

    // ── Files ─────────────────────────────────────────────────

    public static final String LEFT_PATH = "market-linking.input.left-path";
    public static final String RIGHT_PATH = "market-linking.input.right-path";
    public static final String OUTPUT_PATH = "market-linking.output.path";

    static final String DEFAULT_LEFT_PATH = "data/kalshi_markets.json";
    static final String DEFAULT_RIGHT_PATH = "data/polymarket_markets.json";
    static final String DEFAULT_OUTPUT_PATH = "data/market_matches.json";

    private final Config config;

    public MatchingConfig() {
        this(ConfigProvider.getConfig());
    }

    public MatchingConfig(Config config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    /**
     * Builds validated options; unset keys fall back to the {@link MatchingOptions} defaults.
     *
     * @throws IllegalArgumentException if a configured value is out of range or not a number
     */
    public MatchingOptions toOptions() {
        MatchingOptions defaults = MatchingOptions.defaults();
        MatchingOptions options = MatchingOptions.builder()
                .scoreCutoff(config.getOptionalValue(SCORE_CUTOFF, Double.class)
                        .orElse(defaults.getScoreCutoff()))
                .maxTimeDiffHours(config.getOptionalValue(MAX_TIME_DIFF_HOURS, Double.class)
                        .orElse(defaults.getMaxTimeDiffHours()))
                .parallelism(config.getOptionalValue(PARALLELISM, Integer.class)
                        .orElse(defaults.getParallelism()))
                .progressInterval(config.getOptionalValue(PROGRESS_INTERVAL, Integer.class)
                        .orElse(defaults.getProgressInterval()))
                .build();
        log.debug("config.loaded options={}", options);
        return options;
    }

    public Path leftPath() {
        return path(LEFT_PATH, DEFAULT_LEFT_PATH);
    }

    public Path rightPath() {
        return path(RIGHT_PATH, DEFAULT_RIGHT_PATH);
    }

    public Path outputPath() {
        return path(OUTPUT_PATH, DEFAULT_OUTPUT_PATH);
    }

    private Path path(String key, String defaultValue) {
        return Path.of(config.getOptionalValue(key, String.class).orElse(defaultValue));
    }
}
