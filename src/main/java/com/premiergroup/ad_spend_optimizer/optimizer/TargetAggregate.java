package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import lombok.Getter;

/**
 * Running metric totals for one (campaign, ad group, key) group.
 */
@Getter
public class TargetAggregate {

    private final String campaignName;
    private final String adGroupName;
    private final String key;
    private final String matchType;
    private double spend;
    private double sales;
    private long clicks;
    private long impressions;
    private long orders;
    private int pricedRows;

    public TargetAggregate(String campaignName, String adGroupName, String key, String matchType) {
        this.campaignName = campaignName;
        this.adGroupName = adGroupName;
        this.key = key;
        this.matchType = matchType;
    }

    public static TargetAggregate of(PerformanceRecord record, String key) {
        return new TargetAggregate(record.getCampaignName(), record.getAdGroupName(), key, record.getMatchType());
    }

    public TargetAggregate add(PerformanceRecord record) {
        spend += record.spendValue();
        sales += record.salesValue();
        clicks += record.clickCount();
        impressions += record.impressionCount();
        orders += record.orderCount();
        if (record.spendValue() > 0) {
            pricedRows++;
        }
        return this;
    }

    public TargetAggregate merge(TargetAggregate other) {
        spend += other.spend;
        sales += other.sales;
        clicks += other.clicks;
        impressions += other.impressions;
        orders += other.orders;
        pricedRows += other.pricedRows;
        return this;
    }

    public double roas() {
        return Statistics.ratio(sales, spend);
    }

    public double cpc() {
        return Statistics.ratio(spend, clicks);
    }
}
