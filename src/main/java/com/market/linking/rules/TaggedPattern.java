package com.market.linking.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A compiled pattern paired with the tag it stands for.
 * Tables of these drive entity extraction and domain classification.
 *
 * @param tag     the tag emitted when the pattern matches
 * @param pattern the compiled pattern, applied to lower-cased text
 * @param <T>     tag type
 */
public record TaggedPattern<T>(T tag, Pattern pattern) {

    public TaggedPattern {
        Objects.requireNonNull(tag, "tag is required");
        Objects.requireNonNull(pattern, "pattern is required");
    }

    public static <T> TaggedPattern<T> of(T tag, String regex) {
        return new TaggedPattern<>(tag, Pattern.compile(regex));
    }

    /**
     * Returns true if the pattern occurs anywhere in the given text.
     */
    public boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }
}
