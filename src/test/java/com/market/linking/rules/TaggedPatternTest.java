package com.market.linking.rules;

import com.market.linking.core.model.Domain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaggedPatternTest {

    @Test
    void matchesShouldFindPatternAnywhereInText() {
        TaggedPattern<String> fed = TaggedPattern.of("fed", "\\bfed\\b(?!\\s*(cup|ex))");

        assertTrue(fed.matches("will the fed cut rates"));
        assertFalse(fed.matches("who wins the fed cup"));
        assertFalse(fed.matches("federal budget"));
    }

    @Test
    void shouldRequireTagAndPattern() {
        assertThrows(NullPointerException.class, () -> new TaggedPattern<>(null, null));
    }

    @Test
    void domainRulesShouldStartWithPolitics() {
        List<TaggedPattern<Domain>> rules = DomainRules.defaults();

        assertEquals(Domain.POLITICS, rules.get(0).tag());
        assertEquals(7, rules.size());
        assertTrue(rules.stream().noneMatch(rule -> rule.tag() == Domain.OTHER));
    }

    @Test
    void entityTableShouldCoverEveryCategory() {
        List<TaggedPattern<String>> all = EntityPatterns.all();

        assertEquals(EntityPatterns.people().size() + EntityPatterns.cryptoAssets().size()
                        + EntityPatterns.organizations().size() + EntityPatterns.places().size()
                        + EntityPatterns.eventConcepts().size(),
                all.size());
        assertEquals("trump", all.get(0).tag());
    }
}
