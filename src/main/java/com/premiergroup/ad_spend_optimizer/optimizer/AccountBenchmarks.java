package com.premiergroup.ad_spend_optimizer.optimizer;

/**
 * Account-wide reference values shared by every selector in a run.
 *
 * @param universalRoas     winsorized median ROAS, or target ROAS when too few substantial rows exist
 * @param fromTargetRoas    true when the universal baseline fell back to the configured target
 * @param rawCvr            orders / clicks before clamping
 * @param cvr               clamped conversion rate
 * @param softThreshold     clicks without a sale that make a bleeder
 * @param hardStopThreshold clicks without a sale that make an urgent bleeder
 * @param harvestMinOrders  orders a search term needs before it can be harvested
 * @param dataDays          calendar days spanned by the snapshot
 */
public record AccountBenchmarks(
        double universalRoas,
        boolean fromTargetRoas,
        int substantialRows,
        double rawCvr,
        double cvr,
        double expectedClicks,
        double softThreshold,
        double hardStopThreshold,
        int harvestMinOrders,
        long dataDays
) {

    public boolean cvrClamped() {
        return rawCvr != cvr;
    }
}
