package com.premiergroup.ad_spend_optimizer.optimizer;

import java.util.List;

public record DeduplicationResult(
        List<BidRecommendation> recommendations,
        List<NegativeCandidate> consolidationNegatives
) {}
