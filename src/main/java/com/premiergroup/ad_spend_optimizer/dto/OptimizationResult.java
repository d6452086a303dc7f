package com.premiergroup.ad_spend_optimizer.dto;

import com.premiergroup.ad_spend_optimizer.optimizer.AccountBenchmarks;
import com.premiergroup.ad_spend_optimizer.optimizer.BidRecommendation;
import com.premiergroup.ad_spend_optimizer.optimizer.HarvestCandidate;
import com.premiergroup.ad_spend_optimizer.optimizer.NegativeCandidate;

import java.util.List;

public record OptimizationResult(
        String accountId,
        String batchId,
        DateRange analysisWindow,
        AccountBenchmarks benchmarks,
        List<BidRecommendation> bids,
        List<HarvestCandidate> harvests,
        List<NegativeCandidate> negatives,
        int decisionsSubmitted,
        int decisionsAppended
) {

    public int decisionsDropped() {
        return decisionsSubmitted - decisionsAppended;
    }

    public static OptimizationResult empty(String accountId) {
        return new OptimizationResult(accountId, null, null, null, List.of(), List.of(), List.of(), 0, 0);
    }
}
