package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;

import java.util.Collection;

/**
 * Chooses between a local (bucket) ROAS and the universal baseline.
 */
public final class BaselineResolver {

    private BaselineResolver() {
    }

    /**
     * Bucket ROAS over priced rows when the sample is large enough and not an outlier, else the universal baseline.
     */
    public static double bucketBaseline(Collection<PerformanceRecord> rows, double universalRoas, OptimizerConfig config) {
        double spend = 0.0;
        double sales = 0.0;
        int priced = 0;
        for (PerformanceRecord row : rows) {
            if (row.spendValue() > 0) {
                spend += row.spendValue();
                sales += row.salesValue();
                priced++;
            }
        }
        return choose(spend, sales, priced, universalRoas, config);
    }

    public static double choose(double spend, double sales, int pricedRows, double universalRoas, OptimizerConfig config) {
        if (pricedRows < config.getBucketMinRows() || spend < config.getBucketMinSpend()) {
            return universalRoas;
        }
        double local = sales / spend;
        if (local > universalRoas * config.getBucketOutlierMult()) {
            return universalRoas;
        }
        return local;
    }

    /**
     * Floors a bid baseline so a collapsed bucket cannot drive runaway down-bidding.
     */
    public static double floored(double baseline, OptimizerConfig config) {
        return Math.max(baseline, config.getTargetRoas() * config.getTargetFloorMult());
    }
}
