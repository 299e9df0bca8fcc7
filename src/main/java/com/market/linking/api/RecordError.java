package com.market.linking.api;

import com.market.linking.core.model.CatalogSide;

/**
 * A record whose processing failed during a run. The record was skipped and
 * the rest of the corpus continued.
 *
 * @param catalog  the catalog the record came from
 * @param sourceId the record's identifier
 * @param stage    the pipeline stage that failed ("normalize" or "score")
 * @param message  the failure message
 */
public record RecordError(CatalogSide catalog, String sourceId, String stage, String message) {

    public static final String STAGE_NORMALIZE = "normalize";
    public static final String STAGE_SCORE = "score";
}
