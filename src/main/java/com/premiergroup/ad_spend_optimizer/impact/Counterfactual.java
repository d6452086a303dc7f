package com.premiergroup.ad_spend_optimizer.impact;

/**
 * @param guardrailed true when the before window had too few clicks and impact was forced to zero
 */
public record Counterfactual(
        double expectedAfterClicks,
        double expectedAfterSales,
        double expectedTrendPct,
        double actualChangePct,
        double decisionValuePct,
        double decisionImpact,
        double confidenceWeight,
        boolean guardrailed
) {}
