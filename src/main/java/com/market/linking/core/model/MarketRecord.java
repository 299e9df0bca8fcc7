package com.market.linking.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical, immutable representation of one market question from one catalog.
 * Built once per matching run by the normalizer and never mutated afterwards.
 */
public final class MarketRecord {
    private final String sourceId;
    private final CatalogSide catalog;
    private final String title;
    private final String rawText;
    private final String normalizedText;
    private final Instant endTime;
    private final Set<String> entities;
    private final Set<String> numbers;
    private final Domain domain;

    private MarketRecord(Builder builder) {
        this.sourceId = builder.sourceId;
        this.catalog = builder.catalog;
        this.title = builder.title;
        this.rawText = builder.rawText;
        this.normalizedText = builder.normalizedText;
        this.endTime = builder.endTime;
        this.entities = Collections.unmodifiableSet(new LinkedHashSet<>(builder.entities));
        this.numbers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.numbers));
        this.domain = builder.domain;
    }

    public String getSourceId() {
        return sourceId;
    }

    public CatalogSide getCatalog() {
        return catalog;
    }

    public String getTitle() {
        return title;
    }

    public String getRawText() {
        return rawText;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public Optional<Instant> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    public Set<String> getEntities() {
        return entities;
    }

    public Set<String> getNumbers() {
        return numbers;
    }

    public Domain getDomain() {
        return domain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MarketRecord that = (MarketRecord) o;
        return catalog == that.catalog && Objects.equals(sourceId, that.sourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(catalog, sourceId);
    }

    @Override
    public String toString() {
        return "MarketRecord{" +
                "sourceId='" + sourceId + '\'' +
                ", catalog=" + catalog +
                ", title='" + title + '\'' +
                ", domain=" + domain +
                ", endTime=" + endTime +
                ", entities=" + entities +
                ", numbers=" + numbers +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceId;
        private CatalogSide catalog;
        private String title;
        private String rawText;
        private String normalizedText;
        private Instant endTime;
        private Set<String> entities;
        private Set<String> numbers;
        private Domain domain;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder catalog(CatalogSide catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder normalizedText(String normalizedText) {
            this.normalizedText = normalizedText;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder entities(Set<String> entities) {
            this.entities = entities;
            return this;
        }

        public Builder numbers(Set<String> numbers) {
            this.numbers = numbers;
            return this;
        }

        public Builder domain(Domain domain) {
            this.domain = domain;
            return this;
        }

        public MarketRecord build() {
            Objects.requireNonNull(sourceId, "sourceId is required");
            Objects.requireNonNull(catalog, "catalog is required");
            Objects.requireNonNull(title, "title is required");
            Objects.requireNonNull(rawText, "rawText is required");
            Objects.requireNonNull(normalizedText, "normalizedText is required");
            Objects.requireNonNull(entities, "entities is required");
            Objects.requireNonNull(numbers, "numbers is required");
            Objects.requireNonNull(domain, "domain is required");
            return new MarketRecord(this);
        }
    }
}
