package com.premiergroup.ad_spend_optimizer.dto;

import com.premiergroup.ad_spend_optimizer.enums.OptimizationProfile;
import jakarta.validation.Valid;

import java.time.LocalDate;
import java.util.List;

/**
 * Inputs of one optimizer run. Every field is optional.
 *
 * @param startDate      first week start of the analysis window, defaults to lookback from the latest raw date
 * @param decisionDate   date the emitted decisions take effect, defaults to today (UTC)
 * @param dryRun         compute without appending to the decision log
 */
public record OptimizationRequest(
        LocalDate startDate,
        LocalDate endDate,
        OptimizationProfile profile,
        @Valid List<BidReference> bids,
        List<String> exactKeywords,
        List<String> competitorAsins,
        LocalDate decisionDate,
        boolean dryRun
) {

    public static OptimizationRequest defaults() {
        return new OptimizationRequest(null, null, null, List.of(), List.of(), List.of(), null, false);
    }
}
