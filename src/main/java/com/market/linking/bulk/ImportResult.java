package com.market.linking.bulk;

import com.market.linking.core.model.RawMarket;

import java.util.List;

/**
 * Result of a catalog import.
 *
 * @param totalRecords number of JSON records seen in the input
 * @param markets      markets read successfully, in input order
 * @param errors       records that could not be read; the import continued past them
 */
public record ImportResult(
        long totalRecords,
        List<RawMarket> markets,
        List<ImportError> errors
) {
    public ImportResult {
        markets = markets != null ? List.copyOf(markets) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that could not be imported.
     *
     * @param position 1-based line (JSON Lines) or element index (JSON array); 0 for the whole input
     * @param message  what went wrong
     */
    public record ImportError(long position, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + markets.size() +
                ", errors=" + errors.size() + '}';
    }
}
