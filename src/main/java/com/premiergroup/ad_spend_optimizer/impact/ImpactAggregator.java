package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.enums.MarketTag;

import java.util.List;

/**
 * The one reducer from impact records to summary numbers. Pure and deterministic.
 */
public final class ImpactAggregator {

    private ImpactAggregator() {
    }

    public static ImpactSummary aggregate(List<ImpactRecord> records, ImpactFilter filter, WindowSizing sizing,
                                          ImpactConfig config) {
        int mature = (int) records.stream().filter(ImpactRecord::mature).count();
        List<ImpactRecord> working = records.stream().filter(filter::accepts).toList();

        int[] counts = new int[MarketTag.values().length];
        double[] values = new double[MarketTag.values().length];
        double totalSpend = 0.0;
        double decisionImpact = 0.0;
        double spendAvoided = 0.0;
        int wins = 0;
        for (ImpactRecord record : working) {
            int tag = record.marketTag().ordinal();
            counts[tag]++;
            values[tag] += record.decisionImpact();
            decisionImpact += record.decisionImpact();
            spendAvoided += record.spendAvoided();
            if (record.marketTag().isAttributed()) {
                totalSpend += record.after().spend();
            }
            if (record.decisionImpact() > 0) {
                wins++;
            }
        }

        double offensive = values[MarketTag.OFFENSIVE_WIN.ordinal()];
        double defensive = values[MarketTag.DEFENSIVE_WIN.ordinal()];
        double gap = values[MarketTag.GAP.ordinal()];
        double attributed = offensive + defensive + gap;
        int total = working.size();
        int attributedCount = total - counts[MarketTag.MARKET_DRAG.ordinal()];

        return new ImpactSummary(
                total,
                mature,
                records.size() - mature,
                counts[MarketTag.OFFENSIVE_WIN.ordinal()],
                counts[MarketTag.DEFENSIVE_WIN.ordinal()],
                counts[MarketTag.GAP.ordinal()],
                counts[MarketTag.MARKET_DRAG.ordinal()],
                offensive,
                defensive,
                gap,
                values[MarketTag.MARKET_DRAG.ordinal()],
                attributed,
                decisionImpact,
                totalSpend,
                totalSpend > 0 ? attributed / totalSpend : 0.0,
                spendAvoided,
                wins,
                total > 0 ? (double) wins / total : 0.0,
                attributedCount > 0 ? attributed / attributedCount : 0.0,
                ConfidenceScorer.score(working, config),
                ConfidenceScorer.scoreSpendAvoided(working, config),
                sizing == null ? 0 : sizing.beforeDays(),
                sizing == null ? 0 : sizing.afterDays(),
                sizing != null && sizing.fallback());
    }
}
