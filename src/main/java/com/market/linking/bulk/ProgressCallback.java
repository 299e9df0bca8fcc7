package com.market.linking.bulk;

/**
 * Receives progress reports from long-running imports and matching runs.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records processed so far
     * @param total     total records, or -1 when unknown
     * @param message   short progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
