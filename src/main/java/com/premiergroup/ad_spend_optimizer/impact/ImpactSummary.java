package com.premiergroup.ad_spend_optimizer.impact;

/**
 * Aggregated decision impact. Produced only by {@link ImpactAggregator}.
 *
 * @param attributedImpact   Σ impact over Offensive Win, Defensive Win and Gap
 * @param decisionImpact     Σ impact over every filtered record, Market Drag included
 * @param totalSpend         Σ after-window spend over non-drag records
 * @param decisionImpactRoas attributed impact per unit of non-drag spend
 */
public record ImpactSummary(
        int totalActions,
        int matureActions,
        int pendingActions,
        int offensiveWins,
        int defensiveWins,
        int gaps,
        int marketDrag,
        double offensiveValue,
        double defensiveValue,
        double gapValue,
        double marketDragValue,
        double attributedImpact,
        double decisionImpact,
        double totalSpend,
        double decisionImpactRoas,
        double spendAvoided,
        int wins,
        double winRate,
        double impactPerAction,
        ConfidenceResult confidence,
        ConfidenceResult spendAvoidedConfidence,
        int beforeDays,
        int afterDays,
        boolean windowFallback
) {}
