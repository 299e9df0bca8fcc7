package com.market.linking.core.model;

import java.util.Objects;

/**
 * A market as delivered by a catalog source, before normalization.
 * Only the identifier is mandatory; every text field may be absent.
 *
 * @param sourceId    identifier, unique within its catalog
 * @param title       the question text, may be null or blank
 * @param description free-form description, may be null
 * @param endDate     end date as delivered by the source, may be null or unparsable
 */
public record RawMarket(
        String sourceId,
        String title,
        String description,
        String endDate
) {
    public RawMarket {
        Objects.requireNonNull(sourceId, "sourceId is required");
    }

    public static RawMarket of(String sourceId, String title) {
        return new RawMarket(sourceId, title, null, null);
    }
}
