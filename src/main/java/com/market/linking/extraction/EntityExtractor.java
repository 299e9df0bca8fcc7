package com.market.linking.extraction;

import com.market.linking.rules.EntityPatterns;
import com.market.linking.rules.TaggedPattern;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Tags a text with every curated entity whose pattern occurs in it.
 * Extraction is non-exclusive: all matching patterns contribute a tag.
 */
public class EntityExtractor {

    private final List<TaggedPattern<String>> patterns;

    public EntityExtractor() {
        this(EntityPatterns.all());
    }

    public EntityExtractor(List<TaggedPattern<String>> patterns) {
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns is required"));
    }

    /**
     * Extracts the entity tags found in the given text.
     *
     * @param text raw text, any case; null yields an empty set
     * @return tags in table order (never null)
     */
    public Set<String> extract(String text) {
        Set<String> entities = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return entities;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (TaggedPattern<String> pattern : patterns) {
            if (pattern.matches(lower)) {
                entities.add(pattern.tag());
            }
        }
        return entities;
    }
}
