package com.premiergroup.ad_spend_optimizer.optimizer;

/**
 * A discovery search term promoted into its own exact-match campaign.
 */
public record HarvestCandidate(
        String term,
        long clicks,
        long orders,
        double spend,
        double sales,
        double roas,
        double requiredRoas,
        String winnerCampaign,
        String winnerAdGroup,
        String winnerMatchType,
        double baseBid,
        double launchBid,
        String newCampaignName
) {

    public static final String NEW_CAMPAIGN_PREFIX = "Harvest_Exact_";
    public static final String AFTER_MATCH_TYPE = "exact";
}
