package com.premiergroup.ad_spend_optimizer.dto;

import java.math.BigDecimal;

/**
 * Current bid settings for a target as known to the platform. Either value may be null.
 */
public record BidReference(
        String campaignName,
        String adGroupName,
        String targetText,
        BigDecimal bid,
        BigDecimal adGroupDefaultBid
) {}
