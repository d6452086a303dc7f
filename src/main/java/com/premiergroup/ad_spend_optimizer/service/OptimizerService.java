package com.premiergroup.ad_spend_optimizer.service;

import com.premiergroup.ad_spend_optimizer.config.OptimizerProperties;
import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.dto.OptimizationRequest;
import com.premiergroup.ad_spend_optimizer.dto.OptimizationResult;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceFilter;
import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.optimizer.*;
import com.premiergroup.ad_spend_optimizer.store.DecisionLog;
import com.premiergroup.ad_spend_optimizer.store.PerformanceStore;
import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Collectors;

@Service
@Log4j2
@AllArgsConstructor
public class OptimizerService {

    private PerformanceStore performanceStore;
    private DecisionLog decisionLog;
    private OptimizerProperties optimizerProperties;

    /**
     * Runs benchmarks, harvest, negatives and bids over the account snapshot and appends the
     * resulting decisions as one batch. Any failure rolls back the whole batch.
     */
    @Transactional
    public OptimizationResult run(String accountId, OptimizationRequest request) {
        OptimizationRequest req = request == null ? OptimizationRequest.defaults() : request;
        OptimizerConfig config = resolveConfig(req);

        Optional<DateRange> window = resolveWindow(accountId, req, config);
        if (window.isEmpty()) {
            log.info("Account {} has no performance data, nothing to optimize", accountId);
            return OptimizationResult.empty(accountId);
        }

        List<PerformanceRecord> records = performanceStore.queryPerformance(accountId, window.get(), PerformanceFilter.none());
        AccountBenchmarks benchmarks = BenchmarkCalculator.calculate(records, config);
        LocalDate decisionDate = req.decisionDate() != null ? req.decisionDate() : LocalDate.now(ZoneOffset.UTC);

        RunContext context = RunContext.builder()
                .accountId(accountId)
                .config(config)
                .benchmarks(benchmarks)
                .analysisWindow(window.get())
                .decisionDate(decisionDate)
                .bidBook(new BidBook(req.bids()))
                .externalExactKeywords(nullToEmpty(req.exactKeywords()))
                .competitorAsins(nullToEmpty(req.competitorAsins()))
                .build();

        List<HarvestCandidate> harvests = HarvestSelector.select(records, context);
        List<NegativeCandidate> negatives = NegativeSelector.select(records, context, harvests);

        Set<String> harvestedTerms = harvests.stream().map(HarvestCandidate::term).collect(Collectors.toSet());
        Set<NegativeKey> negativeKeys = negatives.stream().map(NegativeCandidate::key).collect(Collectors.toSet());
        List<BidRecommendation> bids = BidOptimizer.optimize(records, context, harvestedTerms, negativeKeys);

        DeduplicationResult deduplicated = DecisionDeduplicator.deduplicate(bids);
        List<NegativeCandidate> allNegatives = NegativeSelector.merge(negatives, deduplicated.consolidationNegatives());

        List<Decision> decisions = DecisionFactory.fromRun(decisionDate, deduplicated.recommendations(),
                allNegatives, harvests);
        String batchId = UUID.randomUUID().toString();
        int appended = req.dryRun() ? 0 : decisionLog.appendDecisions(accountId, batchId, decisions);

        log.info("Run {} for account {} over {}..{}: {} records, {} bids, {} harvests, {} negatives, {} decisions ({} appended{})",
                batchId, accountId, window.get().start(), window.get().end(), records.size(),
                deduplicated.recommendations().size(), harvests.size(), allNegatives.size(), decisions.size(),
                appended, req.dryRun() ? ", dry run" : "");

        return new OptimizationResult(accountId, batchId, window.get(), benchmarks, deduplicated.recommendations(),
                harvests, allNegatives, decisions.size(), appended);
    }

    OptimizerConfig resolveConfig(OptimizationRequest request) {
        OptimizerConfig config = optimizerProperties.toConfig();
        return request.profile() == null ? config : request.profile().applyTo(config).validate();
    }

    private Optional<DateRange> resolveWindow(String accountId, OptimizationRequest request, OptimizerConfig config) {
        if (request.startDate() != null && request.endDate() != null) {
            return Optional.of(new DateRange(request.startDate(), request.endDate()));
        }
        return performanceStore.latestRawDate(accountId).map(latest -> {
            LocalDate end = request.endDate() != null ? request.endDate() : latest;
            return request.startDate() != null
                    ? new DateRange(request.startDate(), end)
                    : DateRange.endingAt(end, config.getLookbackDays());
        });
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
