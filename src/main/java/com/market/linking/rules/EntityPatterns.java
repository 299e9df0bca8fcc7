package com.market.linking.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Curated entity vocabulary: notable people, crypto assets, organizations,
 * places and event concepts. Every pattern is word-boundary anchored and
 * applied to lower-cased text; some carry negative lookaheads so that a short
 * token does not fire inside an unrelated phrase (e.g. "fed cup", "apple music").
 */
public final class EntityPatterns {

    private EntityPatterns() {
        // Utility class
    }

    public static List<TaggedPattern<String>> people() {
        return List.of(
                TaggedPattern.of("trump", "\\b(donald\\s+)?trump\\b"),
                TaggedPattern.of("biden", "\\b(joe\\s+)?biden\\b"),
                TaggedPattern.of("harris", "\\b(kamala\\s+)?harris\\b"),
                TaggedPattern.of("musk", "\\b(elon\\s+)?musk\\b"),
                TaggedPattern.of("putin", "\\b(vladimir\\s+)?putin\\b"),
                TaggedPattern.of("xi jinping", "\\bxi\\s+jinping\\b"),
                TaggedPattern.of("taylor swift", "\\btaylor\\s+swift\\b"),
                TaggedPattern.of("netanyahu", "\\bnetanyahu\\b")
        );
    }

    public static List<TaggedPattern<String>> cryptoAssets() {
        return List.of(
                TaggedPattern.of("bitcoin", "\\bbitcoin\\b"),
                TaggedPattern.of("btc", "\\bbtc\\b"),
                TaggedPattern.of("ethereum", "\\bethereum\\b"),
                TaggedPattern.of("eth", "\\beth\\b(?!\\s*(flipped|flip))"),
                TaggedPattern.of("solana", "\\bsolana\\b"),
                // standalone ticker only, "sol" followed by another word is usually Spanish or a name
                TaggedPattern.of("sol", "\\bsol\\b(?!\\s*\\w)"),
                TaggedPattern.of("dogecoin", "\\bdogecoin\\b"),
                TaggedPattern.of("doge", "\\bdoge\\b")
        );
    }

    public static List<TaggedPattern<String>> organizations() {
        return List.of(
                TaggedPattern.of("federal reserve", "\\bfederal\\s+reserve\\b"),
                TaggedPattern.of("fed", "\\bfed\\b(?!\\s*(cup|ex))"),
                TaggedPattern.of("openai", "\\bopenai\\b"),
                TaggedPattern.of("tesla", "\\btesla\\b"),
                TaggedPattern.of("apple", "\\bapple\\b(?!\\s*(music|tv))"),
                TaggedPattern.of("microsoft", "\\bmicrosoft\\b"),
                TaggedPattern.of("google", "\\bgoogle\\b"),
                TaggedPattern.of("meta", "\\bmeta\\b(?!\\s*\\w)"),
                TaggedPattern.of("netflix", "\\bnetflix\\b")
        );
    }

    public static List<TaggedPattern<String>> places() {
        return List.of(
                TaggedPattern.of("usa", "\\b(usa|united\\s+states|america)\\b"),
                TaggedPattern.of("china", "\\bchina\\b"),
                TaggedPattern.of("russia", "\\brussia\\b"),
                TaggedPattern.of("ukraine", "\\bukraine\\b"),
                TaggedPattern.of("israel", "\\bisrael\\b"),
                TaggedPattern.of("iran", "\\biran\\b"),
                TaggedPattern.of("germany", "\\bgermany\\b"),
                TaggedPattern.of("france", "\\bfrance\\b"),
                TaggedPattern.of("netherlands", "\\bnetherlands\\b"),
                TaggedPattern.of("norway", "\\bnorway\\b")
        );
    }

    public static List<TaggedPattern<String>> eventConcepts() {
        return List.of(
                TaggedPattern.of("election", "\\belection\\b"),
                TaggedPattern.of("recession", "\\brecession\\b"),
                TaggedPattern.of("inflation", "\\binflation\\b"),
                TaggedPattern.of("unemployment", "\\bunemployment\\b"),
                TaggedPattern.of("interest rate", "\\binterest\\s+rate\\b")
        );
    }

    /**
     * The full table in evaluation order: people, crypto, organizations, places, events.
     */
    public static List<TaggedPattern<String>> all() {
        List<TaggedPattern<String>> table = new ArrayList<>();
        table.addAll(people());
        table.addAll(cryptoAssets());
        table.addAll(organizations());
        table.addAll(places());
        table.addAll(eventConcepts());
        return List.copyOf(table);
    }
}
