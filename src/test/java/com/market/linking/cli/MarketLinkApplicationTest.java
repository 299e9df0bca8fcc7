package com.market.linking.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.linking.config.MatchingConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MarketLinkApplication Tests")
class MarketLinkApplicationTest {

    private static final String KALSHI = """
            [
              {"ticker": "KX-FED", "title": "Will the Fed cut rates by 25bps in 2024",
               "close_time": "2024-12-18T19:00:00Z"},
              {"ticker": "KX-BTC", "title": "Will Bitcoin be above $100k by the end of 2024"}
            ]
            """;

    private static final String POLYMARKET = """
            {"id": "0xfed", "question": "Federal Reserve 25 basis point cut expected 2024", "description": "Will the Fed cut rates by 25bps in 2024", "endDate": "2024-12-18T20:00:00Z"}
            {"id": "0xbtc", "question": "Will Bitcoin be below $100k by the end of 2024"}
            """;

    @TempDir
    Path dir;

    private SimpleMeterRegistry registry;
    private MarketLinkApplication application;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        application = new MarketLinkApplication(new MatchingConfig(new SmallRyeConfigBuilder().build()), registry);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Should link both catalogs and write the match set")
    void linksAndWritesOutput() throws IOException {
        Path left = write("kalshi.json", KALSHI);
        Path right = write("polymarket.jsonl", POLYMARKET);
        Path output = dir.resolve("out").resolve("matches.json");

        int exitCode = application.run(new String[]{left.toString(), right.toString(), output.toString()});

        assertEquals(MarketLinkApplication.EXIT_OK, exitCode);
        JsonNode document = new ObjectMapper().readTree(output.toFile());
        assertEquals(1, document.get("total_matches").asInt());
        assertEquals("KX-FED", document.get("matches").get(0).get("left_id").asText());
        assertEquals("0xfed", document.get("matches").get(0).get("right_id").asText());
        assertNotNull(registry.find("market.linking.run.duration").timer());
        assertEquals(1.0, registry.find("market.linking.gate.rejected")
                .tag("rule", "SEMANTIC_POLARITY").counter().count());
    }

    @Test
    void noMatchesStillWritesEmptySet() throws IOException {
        Path left = write("kalshi.json", "[]");
        Path right = write("polymarket.json", "[]");
        Path output = dir.resolve("matches.json");

        int exitCode = application.run(new String[]{left.toString(), right.toString(), output.toString()});

        assertEquals(MarketLinkApplication.EXIT_OK, exitCode);
        assertEquals(0, new ObjectMapper().readTree(output.toFile()).get("total_matches").asInt());
    }

    @Test
    @DisplayName("A missing input file fails with an IO exit code")
    void missingInputFails() throws IOException {
        Path right = write("polymarket.json", "[]");

        int exitCode = application.run(new String[]{
                dir.resolve("absent.json").toString(), right.toString(), dir.resolve("matches.json").toString()});

        assertEquals(MarketLinkApplication.EXIT_IO_FAILURE, exitCode);
        assertFalse(Files.exists(dir.resolve("matches.json")));
    }

    @Test
    void unwritableOutputFails() throws IOException {
        Path left = write("kalshi.json", "[]");
        Path right = write("polymarket.json", "[]");
        Path blocker = write("blocker", "not a directory");

        int exitCode = application.run(new String[]{
                left.toString(), right.toString(), blocker.resolve("matches.json").toString()});

        assertEquals(MarketLinkApplication.EXIT_IO_FAILURE, exitCode);
    }

    @Test
    void wrongArgumentCountIsUsageError() {
        assertEquals(MarketLinkApplication.EXIT_USAGE, application.run(new String[]{"only-one.json"}));
        assertEquals(MarketLinkApplication.EXIT_USAGE, application.run(new String[]{"a", "b", "c", "d"}));
    }

    @Test
    void invalidConfigurationIsUsageError() {
        MarketLinkApplication misconfigured = new MarketLinkApplication(new MatchingConfig(
                new SmallRyeConfigBuilder().withDefaultValue(MatchingConfig.PARALLELISM, "0").build()), registry);

        assertEquals(MarketLinkApplication.EXIT_USAGE, misconfigured.run(new String[0]));
    }
}
