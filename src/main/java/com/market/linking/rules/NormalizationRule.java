package com.market.linking.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite step applied while folding market text into its comparison form.
 * Rules carry a priority; the engine applies lower numbers first.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
        this.replacement = builder.replacement;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Applies this rule to the given input string.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
