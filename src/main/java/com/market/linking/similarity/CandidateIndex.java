package com.market.linking.similarity;

import com.market.linking.core.model.Domain;
import com.market.linking.core.model.MarketRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking index over the right-hand corpus.
 *
 * <p>Records are bucketed by domain once per run, so a left record is only ever
 * compared with right records of the same domain. Within a bucket, candidates are
 * further narrowed by end time: when the left record's end time is known, only
 * right records with an unknown end time or one within the time window survive.</p>
 *
 * <p>The index is immutable after construction and safe to share across threads.
 * Bucket order is the order in which records were supplied.</p>
 */
public class CandidateIndex {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final Map<Domain, List<MarketRecord>> buckets;
    private final int size;

    public CandidateIndex(List<MarketRecord> records) {
        Map<Domain, List<MarketRecord>> grouped = new EnumMap<>(Domain.class);
        for (MarketRecord record : records) {
            grouped.computeIfAbsent(record.getDomain(), d -> new ArrayList<>()).add(record);
        }
        Map<Domain, List<MarketRecord>> frozen = new EnumMap<>(Domain.class);
        grouped.forEach((domain, bucket) -> frozen.put(domain, List.copyOf(bucket)));
        this.buckets = Collections.unmodifiableMap(frozen);
        this.size = records.size();
    }

    /**
     * All right records sharing the given domain, in supply order.
     */
    public List<MarketRecord> bucket(Domain domain) {
        return buckets.getOrDefault(domain, List.of());
    }

    /**
     * Candidates for a left record: its domain bucket, pruned by the time window.
     *
     * @param left             the left record
     * @param maxTimeDiffHours inclusive window around the left record's end time
     * @return candidates in bucket order (never null)
     */
    public List<MarketRecord> candidatesFor(MarketRecord left, double maxTimeDiffHours) {
        List<MarketRecord> bucket = bucket(left.getDomain());
        Optional<Instant> leftEnd = left.getEndTime();
        if (bucket.isEmpty() || leftEnd.isEmpty()) {
            return bucket;
        }

        List<MarketRecord> withinWindow = new ArrayList<>(bucket.size());
        for (MarketRecord right : bucket) {
            Optional<Instant> rightEnd = right.getEndTime();
            if (rightEnd.isEmpty() || hoursBetween(leftEnd.get(), rightEnd.get()) <= maxTimeDiffHours) {
                withinWindow.add(right);
            }
        }
        return withinWindow;
    }

    public Map<Domain, Integer> bucketSizes() {
        Map<Domain, Integer> sizes = new EnumMap<>(Domain.class);
        buckets.forEach((domain, bucket) -> sizes.put(domain, bucket.size()));
        return sizes;
    }

    public int size() {
        return size;
    }

    /**
     * Absolute difference between two instants, in fractional hours.
     */
    public static double hoursBetween(Instant a, Instant b) {
        Duration diff = Duration.between(a, b).abs();
        return (diff.getSeconds() + diff.getNano() / 1_000_000_000.0) / SECONDS_PER_HOUR;
    }
}
