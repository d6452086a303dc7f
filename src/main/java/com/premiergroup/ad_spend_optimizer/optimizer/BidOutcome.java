package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.enums.BidBasis;

/**
 * @param gap        roas / target - 1, zero for visibility boosts
 * @param adjustment throttled fractional change before safety clamps
 * @param clampNote  "[Capped +25%]" style suffix, empty when unclamped
 */
public record BidOutcome(
        double newBid,
        BidBasis basis,
        double gap,
        double adjustment,
        String clampNote
) {}
