package com.market.linking.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.linking.core.model.RawMarket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads a catalog export into {@link RawMarket}s.
 *
 * <p>Accepts either a JSON array of market objects:</p>
 * <pre>
 * [
 *   {"ticker": "FED-24DEC", "title": "Will the Fed cut rates?", "close_time": "2024-12-18T19:00:00Z"},
 *   {"ticker": "BTC-100K", "title": "Bitcoin above $100k?"}
 * ]
 * </pre>
 *
 * <p>or JSON Lines, one market object per line.</p>
 *
 * <p>Field names are resolved through a {@link CatalogFormat}. A record without
 * an identifier is reported as an {@link ImportResult.ImportError} and skipped;
 * missing text fields are passed on as null.</p>
 */
public class JsonCatalogImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogImporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    private final ObjectMapper objectMapper;
    private final CatalogFormat format;

    public JsonCatalogImporter(CatalogFormat format) {
        this(format, new ObjectMapper());
    }

    public JsonCatalogImporter(CatalogFormat format, ObjectMapper objectMapper) {
        this.format = Objects.requireNonNull(format, "format is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    /**
     * Imports the catalog file at {@code path}. An unreadable file yields an
     * empty result carrying a single error.
     */
    public ImportResult importMarkets(Path path, ProgressCallback callback) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importMarkets(reader, callback);
        } catch (IOException e) {
            log.error("import.failed format={} path={} error={}", format.name(), path, e.getMessage());
            return new ImportResult(0, List.of(),
                    List.of(new ImportResult.ImportError(0, "IO error: " + e.getMessage())));
        }
    }

    public ImportResult importMarkets(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<RawMarket> markets = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        try {
            String content = readAll(reader);
            String trimmed = content.strip();
            if (trimmed.startsWith("[")) {
                JsonNode root = objectMapper.readTree(trimmed);
                long index = 0;
                for (JsonNode node : root) {
                    index++;
                    totalRecords++;
                    accept(node, index, markets, errors);
                    reportProgress(cb, totalRecords);
                }
            } else {
                long lineNumber = 0;
                for (String line : content.split("\\R")) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    totalRecords++;
                    try {
                        accept(objectMapper.readTree(line), lineNumber, markets, errors);
                    } catch (JsonProcessingException e) {
                        errors.add(new ImportResult.ImportError(lineNumber, "Malformed JSON: " + e.getOriginalMessage()));
                        log.warn("import.error format={} line={} error={}", format.name(), lineNumber, e.getOriginalMessage());
                    }
                    reportProgress(cb, totalRecords);
                }
            }
        } catch (IOException e) {
            log.error("import.failed format={} error={}", format.name(), e.getMessage());
            markets.clear();
            errors.add(new ImportResult.ImportError(0, "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, markets, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format={} result={}", format.name(), result);
        return result;
    }

    private void accept(JsonNode node, long position, List<RawMarket> markets,
                        List<ImportResult.ImportError> errors) {
        if (node == null || !node.isObject()) {
            errors.add(new ImportResult.ImportError(position, "Not a JSON object"));
            log.warn("import.error format={} position={} error=not-an-object", format.name(), position);
            return;
        }
        String id = firstText(node, format.idFields());
        if (id == null || id.isBlank()) {
            errors.add(new ImportResult.ImportError(position, "Missing id field " + format.idFields()));
            log.warn("import.error format={} position={} error=missing-id", format.name(), position);
            return;
        }
        markets.add(new RawMarket(
                id,
                firstText(node, format.titleFields()),
                firstText(node, format.descriptionFields()),
                firstText(node, format.endDateFields())));
    }

    private static String firstText(JsonNode node, List<String> fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String readAll(Reader reader) throws IOException {
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            return br.lines().collect(Collectors.joining("\n"));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static void reportProgress(ProgressCallback cb, long processed) {
        if (processed % PROGRESS_INTERVAL == 0) {
            cb.onProgress(processed, -1, "Read " + processed + " records");
        }
    }
}
