package com.market.linking.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts meaningful numeric tokens from market text.
 *
 * <p>Five independent token classes are unioned into one set of strings:</p>
 * <ul>
 *   <li>years ({@code 2024})</li>
 *   <li>percentages, kept with their sign ({@code 2.5%})</li>
 *   <li>dollar amounts with optional k/m/b suffix ({@code $5m})</li>
 *   <li>basis points ({@code 25bps}), also spelled out as "basis points"</li>
 *   <li>any other numeric literal with a value of at least 10, verbatim ({@code 1,000})</li>
 * </ul>
 *
 * <p>Consumers that need numeric values must re-parse the token shape.</p>
 */
public class NumberExtractor {
    private static final Logger log = LoggerFactory.getLogger(NumberExtractor.class);

    static final String BPS_SUFFIX = "bps";
    static final String PERCENT_SUFFIX = "%";

    private static final Pattern YEAR = Pattern.compile("\\b(202[0-9])\\b");
    private static final Pattern PERCENTAGE = Pattern.compile("\\b(\\d+(?:\\.\\d+)?)\\s*%");
    private static final Pattern DOLLARS = Pattern.compile("\\$(\\d+(?:,\\d+)*(?:\\.\\d+)?)\\s*([kmb]?)");
    private static final Pattern BASIS_POINTS = Pattern.compile("\\b(\\d+)\\s*(?:bps?|basis\\s+points?)\\b");
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("\\b(\\d+(?:,\\d+)*(?:\\.\\d+)?)\\b");
    private static final double MIN_LITERAL_VALUE = 10.0;

    /**
     * Extracts numeric tokens from the given text.
     *
     * @param text raw text; null yields an empty set
     * @return the token set (never null)
     */
    public Set<String> extract(String text) {
        Set<String> numbers = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return numbers;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        Matcher years = YEAR.matcher(text);
        while (years.find()) {
            numbers.add(years.group(1));
        }

        Matcher percentages = PERCENTAGE.matcher(text);
        while (percentages.find()) {
            numbers.add(percentages.group(1) + PERCENT_SUFFIX);
        }

        Matcher dollars = DOLLARS.matcher(lower);
        while (dollars.find()) {
            numbers.add("$" + dollars.group(1) + dollars.group(2));
        }

        numbers.addAll(basisPoints(lower));

        Matcher literals = NUMERIC_LITERAL.matcher(text);
        while (literals.find()) {
            String literal = literals.group(1);
            try {
                if (Double.parseDouble(literal.replace(",", "")) >= MIN_LITERAL_VALUE) {
                    numbers.add(literal);
                }
            } catch (NumberFormatException e) {
                log.trace("Skipping unparsable numeric literal '{}'", literal);
            }
        }

        return numbers;
    }

    /**
     * Extracts the basis-point amounts stated in a text, as {@code <n>bps} tokens.
     */
    public Set<String> basisPoints(String text) {
        Set<String> amounts = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return amounts;
        }
        Matcher matcher = BASIS_POINTS.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            amounts.add(matcher.group(1) + BPS_SUFFIX);
        }
        return amounts;
    }

    /**
     * Re-parses a basis-point or percentage token into its numeric value.
     * Dollar amounts and plain literals are not comparable scalars and yield null,
     * as do tokens whose digits cannot be parsed.
     */
    public static Double parseScalar(String token) {
        if (token == null) {
            return null;
        }
        String digits;
        if (token.endsWith(BPS_SUFFIX)) {
            digits = token.substring(0, token.length() - BPS_SUFFIX.length());
        } else if (token.endsWith(PERCENT_SUFFIX)) {
            digits = token.substring(0, token.length() - PERCENT_SUFFIX.length());
        } else {
            return null;
        }
        try {
            return Double.parseDouble(digits.trim());
        } catch (NumberFormatException e) {
            log.trace("Token '{}' has no parsable scalar", token);
            return null;
        }
    }
}
