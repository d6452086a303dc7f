package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.enums.NegativeSource;

public record NegativeCandidate(
        String campaignName,
        String adGroupName,
        String term,
        NegativeSource source,
        String reason,
        long clicks,
        double spend,
        boolean asin
) {

    public NegativeKey key() {
        return NegativeKey.of(campaignName, adGroupName, term);
    }

    public String negativeMatchType() {
        return asin ? "negative product targeting" : "negative exact";
    }
}
