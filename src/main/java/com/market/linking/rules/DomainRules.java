package com.market.linking.rules;

import com.market.linking.core.model.Domain;

import java.util.List;

/**
 * Priority-ordered keyword rules for domain classification.
 * The order is part of the contract: a text mentioning both an election and
 * bitcoin is political because the politics rule is evaluated first.
 */
public final class DomainRules {

    private DomainRules() {
        // Utility class
    }

    public static List<TaggedPattern<Domain>> defaults() {
        return List.of(
                TaggedPattern.of(Domain.POLITICS,
                        "\\b(election|president|presidential|trump|biden|harris|mayor|governor|senate|congress"
                                + "|vote|political|party|democrat|republican|prime minister)\\b"),
                TaggedPattern.of(Domain.MACRO,
                        "\\b(federal reserve|fomc|fed|interest rate|inflation|unemployment|gdp|recession"
                                + "|monetary policy|basis points|bps)\\b"),
                TaggedPattern.of(Domain.CRYPTO,
                        "\\b(bitcoin|btc|ethereum|eth|crypto|blockchain|solana|sol|dogecoin|doge|defi|nft)\\b"),
                TaggedPattern.of(Domain.FINANCE,
                        "\\b(s&p|spx|nasdaq|dow|stock market|index|tesla|apple|microsoft|amazon|earnings"
                                + "|revenue|market cap)\\b"),
                TaggedPattern.of(Domain.TECH,
                        "\\b(openai|gpt|ai|artificial intelligence|iphone|android|app|software|tech|google"
                                + "|apple|microsoft)\\b"),
                TaggedPattern.of(Domain.SPORTS,
                        "\\b(nfl|nba|mlb|nhl|soccer|football|basketball|baseball|hockey|championship"
                                + "|super bowl|world cup|olympics)\\b"),
                TaggedPattern.of(Domain.ENTERTAINMENT,
                        "\\b(taylor swift|album|billboard|rotten tomatoes|movie|oscar|grammy|netflix"
                                + "|box office|streaming)\\b")
        );
    }
}
