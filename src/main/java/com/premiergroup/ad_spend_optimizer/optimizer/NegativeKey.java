package com.premiergroup.ad_spend_optimizer.optimizer;

/**
 * Identity under which negative candidates are deduplicated.
 */
public record NegativeKey(
        String campaign,
        String adGroup,
        String term
) {

    public static NegativeKey of(String campaign, String adGroup, String term) {
        return new NegativeKey(TargetingText.normalize(campaign), TargetingText.normalize(adGroup),
                TargetingText.normalize(term));
    }
}
