package com.premiergroup.ad_spend_optimizer.impact;

/**
 * Carries before-window cost per click and sales per click onto the spend observed after a decision.
 */
public final class CounterfactualCalculator {

    private CounterfactualCalculator() {
    }

    /**
     * @param before       before-window metrics used for the efficiency ratios, possibly rescaled
     * @param beforeClicks unscaled before-window clicks, which decide the low-sample guardrail
     */
    public static Counterfactual compute(WindowMetrics before, WindowMetrics after, long beforeClicks,
                                         ImpactConfig config) {
        double beforeCpc = before.clicks() > 0 ? before.spend() / before.clicks() : 0.0;
        double salesPerClick = before.clicks() > 0 ? before.sales() / before.clicks() : 0.0;

        double expectedClicks = beforeCpc > 0 ? after.spend() / beforeCpc : 0.0;
        double expectedSales = expectedClicks * salesPerClick;

        double expectedTrendPct = pctChange(expectedSales, before.sales());
        double actualChangePct = pctChange(after.sales(), before.sales());

        double weight = Math.min(1.0, (double) beforeClicks / config.getFullConfidenceClicks());
        boolean guardrailed = beforeClicks < config.getMinBeforeClicks();
        double decisionValuePct = guardrailed ? 0.0 : actualChangePct - expectedTrendPct;
        double decisionImpact = guardrailed ? 0.0 : after.sales() - expectedSales;

        return new Counterfactual(expectedClicks, expectedSales, expectedTrendPct, actualChangePct,
                decisionValuePct, decisionImpact, weight, guardrailed);
    }

    static double pctChange(double value, double base) {
        return base > 0 ? (value - base) / base * 100.0 : 0.0;
    }
}
