package com.market.linking.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MarketRecord Tests")
class MarketRecordTest {

    private static MarketRecord.Builder complete() {
        return MarketRecord.builder()
                .sourceId("KX-1")
                .catalog(CatalogSide.LEFT)
                .title("Will the Fed cut?")
                .rawText("Will the Fed cut?.")
                .normalizedText("will the fed cut")
                .entities(Set.of("fed"))
                .numbers(Set.of())
                .domain(Domain.MACRO);
    }

    @Test
    void endTimeIsOptional() {
        MarketRecord record = complete().build();

        assertTrue(record.getEndTime().isEmpty());
    }

    @Test
    @DisplayName("Missing required fields fail naming the field")
    void missingRequiredFieldIsNamed() {
        NullPointerException e = assertThrows(NullPointerException.class,
                () -> complete().normalizedText(null).build());
        assertTrue(e.getMessage().contains("normalizedText"));

        assertThrows(NullPointerException.class, () -> complete().domain(null).build());
        assertThrows(NullPointerException.class, () -> complete().entities(null).build());
    }

    @Test
    void extractedSetsAreDefensiveCopies() {
        Set<String> entities = new HashSet<>(Set.of("fed"));
        MarketRecord record = complete().entities(entities).build();

        entities.add("inflation");

        assertEquals(Set.of("fed"), record.getEntities());
        assertThrows(UnsupportedOperationException.class, () -> record.getEntities().add("x"));
    }

    @Test
    void identityIsCatalogAndSourceId() {
        MarketRecord a = complete().build();
        MarketRecord b = complete().title("Different title").build();
        MarketRecord c = complete().catalog(CatalogSide.RIGHT).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void domainLabelIsLowerCase() {
        assertEquals("politics", Domain.POLITICS.label());
        assertEquals("entertainment", Domain.ENTERTAINMENT.label());
    }
}
