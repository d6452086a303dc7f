package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Builders shared by the optimizer tests.
 */
public final class Fixtures {

    public static final LocalDate WEEK = LocalDate.of(2026, 3, 2);

    private Fixtures() {
    }

    public static OptimizerConfig config() {
        return OptimizerConfig.builder()
                .targetRoas(2.5)
                .upThrottle(0.5)
                .downThrottle(0.5)
                .maxBidChangePct(0.25)
                .harvestClickMin(10)
                .harvestRoasMult(0.85)
                .negativeSoftThreshold(1.5)
                .negativeHardThreshold(3.0)
                .minClicksPerBucket(OptimizerConfig.defaultMinClicks())
                .build();
    }

    public static AccountBenchmarks benchmarks(double universalRoas, int harvestMinOrders, long dataDays) {
        return new AccountBenchmarks(universalRoas, false, 10, 0.05, 0.05, 20.0, 30.0, 60.0,
                harvestMinOrders, dataDays);
    }

    public static RunContext.RunContextBuilder context(OptimizerConfig config, AccountBenchmarks benchmarks) {
        return RunContext.builder()
                .accountId("acme")
                .config(config)
                .benchmarks(benchmarks)
                .decisionDate(WEEK);
    }

    public static PerformanceRecord row(String campaign, String adGroup, String target, String searchTerm,
                                        String matchType, double spend, double sales, int clicks, int impressions,
                                        int orders) {
        return row(WEEK, campaign, adGroup, target, searchTerm, matchType, spend, sales, clicks, impressions, orders);
    }

    public static PerformanceRecord row(LocalDate weekStart, String campaign, String adGroup, String target,
                                        String searchTerm, String matchType, double spend, double sales, int clicks,
                                        int impressions, int orders) {
        return PerformanceRecord.builder()
                .accountId("acme")
                .weekStart(weekStart)
                .campaignName(campaign)
                .adGroupName(adGroup)
                .targetText(target)
                .searchTerm(searchTerm)
                .matchType(matchType)
                .spend(BigDecimal.valueOf(spend))
                .sales(BigDecimal.valueOf(sales))
                .clicks(clicks)
                .impressions(impressions)
                .orders(orders)
                .build();
    }
}
