package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything one optimizer run needs besides the performance rows. Built once, never mutated.
 */
@Value
@Builder
public class RunContext {

    String accountId;
    OptimizerConfig config;
    AccountBenchmarks benchmarks;
    DateRange analysisWindow;
    LocalDate decisionDate;
    @Builder.Default
    BidBook bidBook = BidBook.empty();
    @Builder.Default
    List<String> externalExactKeywords = List.of();
    @Builder.Default
    List<String> competitorAsins = List.of();
}
