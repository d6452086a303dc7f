package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;

import java.util.Collection;

/**
 * Summed metrics of the rows falling into one comparison window.
 */
public record WindowMetrics(
        double spend,
        double sales,
        long clicks,
        long impressions,
        long orders,
        int rows
) {

    public static final WindowMetrics EMPTY = new WindowMetrics(0, 0, 0, 0, 0, 0);

    public static WindowMetrics of(Collection<PerformanceRecord> records) {
        double spend = 0;
        double sales = 0;
        long clicks = 0;
        long impressions = 0;
        long orders = 0;
        for (PerformanceRecord r : records) {
            spend += r.spendValue();
            sales += r.salesValue();
            clicks += r.clickCount();
            impressions += r.impressionCount();
            orders += r.orderCount();
        }
        return new WindowMetrics(spend, sales, clicks, impressions, orders, records.size());
    }

    public boolean hasData() {
        return rows > 0;
    }

    public double cpc() {
        return clicks > 0 ? spend / clicks : 0.0;
    }

    public double roas() {
        return spend > 0 ? sales / spend : 0.0;
    }

    /**
     * Scales volume metrics so a longer window can be compared with a shorter one.
     */
    public WindowMetrics scaled(double factor) {
        return new WindowMetrics(spend * factor, sales * factor, Math.round(clicks * factor),
                Math.round(impressions * factor), Math.round(orders * factor), rows);
    }
}
