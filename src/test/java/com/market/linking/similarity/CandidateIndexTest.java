package com.market.linking.similarity;

import com.market.linking.core.model.CatalogSide;
import com.market.linking.core.model.Domain;
import com.market.linking.core.model.MarketRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CandidateIndex Tests")
class CandidateIndexTest {

    private static final Instant END = Instant.parse("2024-12-18T19:00:00Z");

    private static MarketRecord record(String id, CatalogSide catalog, Domain domain, Instant endTime) {
        return MarketRecord.builder()
                .sourceId(id)
                .catalog(catalog)
                .title(id)
                .rawText(id)
                .normalizedText(id)
                .endTime(endTime)
                .entities(Set.of())
                .numbers(Set.of())
                .domain(domain)
                .build();
    }

    @Nested
    @DisplayName("Domain buckets")
    class Buckets {

        @Test
        void recordsAreBucketedByDomainInSupplyOrder() {
            CandidateIndex index = new CandidateIndex(List.of(
                    record("r1", CatalogSide.RIGHT, Domain.CRYPTO, null),
                    record("r2", CatalogSide.RIGHT, Domain.MACRO, null),
                    record("r3", CatalogSide.RIGHT, Domain.CRYPTO, null)));

            assertEquals(List.of("r1", "r3"), ids(index.bucket(Domain.CRYPTO)));
            assertEquals(List.of("r2"), ids(index.bucket(Domain.MACRO)));
            assertTrue(index.bucket(Domain.SPORTS).isEmpty());
            assertEquals(3, index.size());
            assertEquals(2, index.bucketSizes().get(Domain.CRYPTO));
        }

        @Test
        void leftRecordOnlySeesItsOwnDomain() {
            CandidateIndex index = new CandidateIndex(List.of(
                    record("r1", CatalogSide.RIGHT, Domain.CRYPTO, null),
                    record("r2", CatalogSide.RIGHT, Domain.POLITICS, null)));

            MarketRecord left = record("l1", CatalogSide.LEFT, Domain.POLITICS, null);

            assertEquals(List.of("r2"), ids(index.candidatesFor(left, 24)));
        }
    }

    @Nested
    @DisplayName("Temporal pruning")
    class TimeWindow {

        @Test
        void windowIsInclusive() {
            CandidateIndex index = new CandidateIndex(List.of(
                    record("exact", CatalogSide.RIGHT, Domain.MACRO, END.plus(Duration.ofHours(24))),
                    record("late", CatalogSide.RIGHT, Domain.MACRO, END.plus(Duration.ofHours(24)).plusSeconds(1)),
                    record("early", CatalogSide.RIGHT, Domain.MACRO, END.minus(Duration.ofHours(3)))));

            MarketRecord left = record("l1", CatalogSide.LEFT, Domain.MACRO, END);

            assertEquals(List.of("exact", "early"), ids(index.candidatesFor(left, 24)));
        }

        @Test
        void rightRecordsWithUnknownEndTimeAreKept() {
            CandidateIndex index = new CandidateIndex(List.of(
                    record("unknown", CatalogSide.RIGHT, Domain.MACRO, null),
                    record("far", CatalogSide.RIGHT, Domain.MACRO, END.plus(Duration.ofDays(30)))));

            MarketRecord left = record("l1", CatalogSide.LEFT, Domain.MACRO, END);

            assertEquals(List.of("unknown"), ids(index.candidatesFor(left, 24)));
        }

        @Test
        void leftRecordWithUnknownEndTimeSeesWholeBucket() {
            CandidateIndex index = new CandidateIndex(List.of(
                    record("far", CatalogSide.RIGHT, Domain.MACRO, END.plus(Duration.ofDays(30))),
                    record("near", CatalogSide.RIGHT, Domain.MACRO, END)));

            MarketRecord left = record("l1", CatalogSide.LEFT, Domain.MACRO, null);

            assertEquals(List.of("far", "near"), ids(index.candidatesFor(left, 24)));
        }

        @Test
        void hoursBetweenIsAbsoluteAndFractional() {
            assertEquals(1.5, CandidateIndex.hoursBetween(END, END.minus(Duration.ofMinutes(90))), 1e-9);
            assertEquals(0.0, CandidateIndex.hoursBetween(END, END), 1e-9);
        }
    }

    private static List<String> ids(List<MarketRecord> records) {
        return records.stream().map(MarketRecord::getSourceId).toList();
    }
}
