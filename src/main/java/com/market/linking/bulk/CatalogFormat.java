package com.market.linking.bulk;

import java.util.List;
import java.util.Objects;

/**
 * Field names a catalog uses for each concern of a market, in lookup order.
 * The first field present with a non-null value wins.
 *
 * @param name              short name used in logs
 * @param idFields          identifier fields
 * @param titleFields       question text fields
 * @param descriptionFields description or rules fields
 * @param endDateFields     end or close date fields
 */
public record CatalogFormat(
        String name,
        List<String> idFields,
        List<String> titleFields,
        List<String> descriptionFields,
        List<String> endDateFields
) {
    public CatalogFormat {
        Objects.requireNonNull(name, "name is required");
        idFields = List.copyOf(Objects.requireNonNull(idFields, "idFields is required"));
        titleFields = List.copyOf(Objects.requireNonNull(titleFields, "titleFields is required"));
        descriptionFields = descriptionFields != null ? List.copyOf(descriptionFields) : List.of();
        endDateFields = endDateFields != null ? List.copyOf(endDateFields) : List.of();
        if (idFields.isEmpty()) {
            throw new IllegalArgumentException("At least one id field is required");
        }
    }

    /**
     * Kalshi-shaped export, the default left catalog.
     */
    public static CatalogFormat kalshi() {
        return new CatalogFormat("kalshi",
                List.of("conditionId", "ticker", "id"),
                List.of("title"),
                List.of("description", "rules_primary"),
                List.of("endDate", "close_time"));
    }

    /**
     * Polymarket-shaped export, the default right catalog.
     */
    public static CatalogFormat polymarket() {
        return new CatalogFormat("polymarket",
                List.of("id", "conditionId"),
                List.of("question", "title"),
                List.of("description"),
                List.of("endDate"));
    }
}
