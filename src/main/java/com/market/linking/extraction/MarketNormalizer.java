package com.market.linking.extraction;

import com.market.linking.core.model.CatalogSide;
import com.market.linking.core.model.MarketRecord;
import com.market.linking.core.model.RawMarket;
import com.market.linking.rules.DefaultNormalizationRules;
import com.market.linking.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link RawMarket} into a {@link MarketRecord}: combines title and
 * description, folds the comparison text, parses the end time, and runs
 * entity extraction, number extraction and domain classification.
 *
 * <p>Records with a blank title are dropped (an empty result), not rejected.</p>
 */
public class MarketNormalizer {
    private static final Logger log = LoggerFactory.getLogger(MarketNormalizer.class);
    private static final String TEXT_SEPARATOR = ". ";

    private final NormalizationEngine foldingEngine;
    private final EntityExtractor entityExtractor;
    private final NumberExtractor numberExtractor;
    private final DomainClassifier domainClassifier;

    public MarketNormalizer() {
        this(DefaultNormalizationRules.createFoldingEngine(), new EntityExtractor(),
                new NumberExtractor(), new DomainClassifier());
    }

    public MarketNormalizer(NormalizationEngine foldingEngine,
                            EntityExtractor entityExtractor,
                            NumberExtractor numberExtractor,
                            DomainClassifier domainClassifier) {
        this.foldingEngine = Objects.requireNonNull(foldingEngine, "foldingEngine is required");
        this.entityExtractor = Objects.requireNonNull(entityExtractor, "entityExtractor is required");
        this.numberExtractor = Objects.requireNonNull(numberExtractor, "numberExtractor is required");
        this.domainClassifier = Objects.requireNonNull(domainClassifier, "domainClassifier is required");
    }

    /**
     * Normalizes one raw market.
     *
     * @param raw     the raw market
     * @param catalog the catalog the market came from
     * @return the record, or empty when the title is missing or blank
     */
    public Optional<MarketRecord> normalize(RawMarket raw, CatalogSide catalog) {
        Objects.requireNonNull(raw, "raw is required");
        Objects.requireNonNull(catalog, "catalog is required");

        String title = raw.title() != null ? raw.title().trim() : "";
        if (title.isEmpty()) {
            log.debug("record.dropped catalog={} sourceId={} reason=blank-title", catalog, raw.sourceId());
            return Optional.empty();
        }
        String description = raw.description() != null ? raw.description().trim() : "";
        String rawText = (title + TEXT_SEPARATOR + description).trim();

        return Optional.of(MarketRecord.builder()
                .sourceId(raw.sourceId())
                .catalog(catalog)
                .title(title)
                .rawText(rawText)
                .normalizedText(foldingEngine.normalize(rawText))
                .endTime(EndTimeParser.parse(raw.endDate()).orElse(null))
                .entities(entityExtractor.extract(rawText))
                .numbers(numberExtractor.extract(rawText))
                .domain(domainClassifier.classify(rawText))
                .build());
    }
}
