package com.market.linking.cli;

import com.market.linking.api.MarketMatcher;
import com.market.linking.api.MatchingOptions;
import com.market.linking.api.MatchingRun;
import com.market.linking.bulk.CatalogFormat;
import com.market.linking.bulk.ExportResult;
import com.market.linking.bulk.ImportResult;
import com.market.linking.bulk.JsonCatalogImporter;
import com.market.linking.bulk.JsonMatchSetExporter;
import com.market.linking.config.MatchingConfig;
import com.market.linking.metrics.MicrometerMetricsService;
import com.market.linking.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Batch runner: imports both catalogs, links them and writes the match set.
 *
 * <pre>
 * java -cp market-linking.jar com.market.linking.cli.MarketLinkApplication \
 *     [left.json right.json [output.json]]
 * </pre>
 *
 * <p>Positional arguments override the paths from {@link MatchingConfig}.</p>
 */
public class MarketLinkApplication {

    private static final Logger log = LoggerFactory.getLogger(MarketLinkApplication.class);
    private static final String INSTRUMENTATION_NAME = "com.market.linking";

    static final int EXIT_OK = 0;
    static final int EXIT_IO_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final MatchingConfig config;
    private final MeterRegistry meterRegistry;

    public MarketLinkApplication(MatchingConfig config, MeterRegistry meterRegistry) {
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    public static void main(String[] args) {
        int exitCode = new MarketLinkApplication(new MatchingConfig(), new SimpleMeterRegistry()).run(args);
        System.exit(exitCode);
    }

    /**
     * Runs one batch and returns the process exit code.
     */
    public int run(String[] args) {
        if (args.length == 1 || args.length > 3) {
            log.error("cli.usage expected=[left right [output]] got={}", args.length);
            return EXIT_USAGE;
        }
        Path leftPath = args.length >= 2 ? Path.of(args[0]) : config.leftPath();
        Path rightPath = args.length >= 2 ? Path.of(args[1]) : config.rightPath();
        Path outputPath = args.length == 3 ? Path.of(args[2]) : config.outputPath();

        MatchingOptions options;
        try {
            options = config.toOptions();
        } catch (IllegalArgumentException e) {
            log.error("cli.config.invalid error={}", e.getMessage());
            return EXIT_USAGE;
        }

        ImportResult left = new JsonCatalogImporter(CatalogFormat.kalshi()).importMarkets(leftPath, null);
        ImportResult right = new JsonCatalogImporter(CatalogFormat.polymarket()).importMarkets(rightPath, null);
        if (isUnreadable(left) || isUnreadable(right)) {
            log.error("cli.input.unreadable left={} right={}", leftPath, rightPath);
            return EXIT_IO_FAILURE;
        }

        MarketMatcher matcher = MarketMatcher.builder()
                .options(options)
                .metricsService(new MicrometerMetricsService(meterRegistry))
                .tracingService(new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME)))
                .build();
        MatchingRun run = matcher.run(left.markets(), right.markets());

        try {
            ExportResult exported = new JsonMatchSetExporter().export(run.matchSet(), outputPath);
            log.info("cli.completed runId={} matches={} errors={} output={}",
                    run.runId(), exported.totalMatches(), run.errors().size(), outputPath);
        } catch (UncheckedIOException e) {
            log.error("cli.output.failed path={} error={}", outputPath, e.getMessage());
            return EXIT_IO_FAILURE;
        }

        logMetrics();
        return EXIT_OK;
    }

    private static boolean isUnreadable(ImportResult result) {
        return result.markets().isEmpty()
                && result.errors().stream().anyMatch(error -> error.position() == 0);
    }

    private void logMetrics() {
        for (Meter meter : meterRegistry.getMeters()) {
            log.debug("cli.metric name={} tags={} values={}",
                    meter.getId().getName(), meter.getId().getTags(), meter.measure());
        }
    }
}
