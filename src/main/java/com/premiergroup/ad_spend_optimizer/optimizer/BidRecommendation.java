package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.enums.BidBasis;
import com.premiergroup.ad_spend_optimizer.enums.PerformanceTier;
import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;

public record BidRecommendation(
        TargetingBucket bucket,
        String campaignName,
        String adGroupName,
        String targetText,
        String matchType,
        long clicks,
        long impressions,
        long orders,
        double spend,
        double sales,
        double roas,
        double bucketBaseline,
        PerformanceTier tier,
        double baseBid,
        double newBid,
        BidBasis basis,
        String reason
) {

    /**
     * Holds and unchanged bids are reported but never logged as decisions.
     */
    public boolean isActionable() {
        return !basis.isHold() && Math.abs(newBid - baseBid) > 1e-9;
    }

    public BidRecommendation withReason(String newReason) {
        return new BidRecommendation(bucket, campaignName, adGroupName, targetText, matchType, clicks, impressions,
                orders, spend, sales, roas, bucketBaseline, tier, baseBid, newBid, basis, newReason);
    }
}
