package com.market.linking.bulk;

/**
 * Result of writing a match set.
 *
 * @param totalMatches number of matches written
 * @param target       where the document was written, for logging
 */
public record ExportResult(long totalMatches, String target) {

    @Override
    public String toString() {
        return "ExportResult{matches=" + totalMatches + ", target=" + target + '}';
    }
}
