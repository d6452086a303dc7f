package com.premiergroup.ad_spend_optimizer.service;

import com.premiergroup.ad_spend_optimizer.config.ImpactProperties;
import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.dto.PerformanceFilter;
import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.enums.*;
import com.premiergroup.ad_spend_optimizer.impact.*;
import com.premiergroup.ad_spend_optimizer.optimizer.TargetingText;
import com.premiergroup.ad_spend_optimizer.store.DecisionLog;
import com.premiergroup.ad_spend_optimizer.store.PerformanceStore;
import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Measures logged decisions against the performance that followed them. Nothing is persisted:
 * every call recomputes from the decision log and the performance store.
 */
@Service
@Log4j2
@AllArgsConstructor
public class ImpactService {

    private PerformanceStore performanceStore;
    private DecisionLog decisionLog;
    private ImpactProperties impactProperties;

    @Transactional(readOnly = true)
    public List<ImpactRecord> getActionImpact(String accountId, Integer beforeDays, Integer afterDays) {
        ImpactConfig config = impactProperties.toConfig();
        return measure(accountId, sizing(accountId, beforeDays, afterDays, config), config);
    }

    @Transactional(readOnly = true)
    public ImpactSummary getImpactSummary(String accountId, ImpactFilter filter, ImpactHorizon horizon) {
        ImpactConfig config = impactProperties.toConfig();
        WindowSizing cadence = sizing(accountId, null, null, config);
        WindowSizing sizing = horizon == null
                ? cadence
                : new WindowSizing(cadence.beforeDays(), horizon.getDays(), cadence.medianGapDays(), cadence.fallback());

        List<ImpactRecord> records = measure(accountId, sizing, config);
        ImpactSummary summary = ImpactAggregator.aggregate(records,
                filter == null ? ImpactFilter.defaults() : filter, sizing, config);
        log.info("Impact summary for account {}: {} of {} decisions measured, attributed {} ({} confidence)",
                accountId, summary.totalActions(), records.size(),
                String.format("%.2f", summary.attributedImpact()), summary.confidence().level());
        return summary;
    }

    WindowSizing sizing(String accountId, Integer beforeDays, Integer afterDays, ImpactConfig config) {
        if ((beforeDays != null && beforeDays <= 0) || (afterDays != null && afterDays <= 0)) {
            throw new IllegalArgumentException("Window lengths must be positive");
        }
        if (beforeDays != null && afterDays != null) {
            return WindowSizing.explicit(beforeDays, afterDays);
        }
        WindowSizing estimated = CadenceEstimator.estimate(performanceStore.bucketStarts(accountId), config);
        return new WindowSizing(
                beforeDays != null ? beforeDays : estimated.beforeDays(),
                afterDays != null ? afterDays : estimated.afterDays(),
                estimated.medianGapDays(),
                estimated.fallback());
    }

    List<ImpactRecord> measure(String accountId, WindowSizing sizing, ImpactConfig config) {
        List<Decision> decisions = decisionLog.queryDecisions(accountId, null, Set.of());
        if (decisions.isEmpty()) {
            return List.of();
        }
        LocalDate latestRaw = performanceStore.latestRawDate(accountId).orElse(null);

        LocalDate firstDecision = decisions.stream().map(Decision::getDecisionDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate lastDecision = decisions.stream().map(Decision::getDecisionDate).max(Comparator.naturalOrder()).orElseThrow();
        LocalDate end = lastDecision.plusDays(sizing.afterDays());
        if (latestRaw != null && latestRaw.isAfter(end)) {
            end = latestRaw;
        }
        List<PerformanceRecord> rows = performanceStore.queryPerformance(accountId,
                new DateRange(firstDecision.minusDays(sizing.beforeDays()), end), PerformanceFilter.none());

        Map<String, List<PerformanceRecord>> byCampaign = rows.stream()
                .collect(Collectors.groupingBy(r -> TargetingText.normalize(r.getCampaignName())));
        NavigableMap<LocalDate, Double> accountSpend = new TreeMap<>();
        rows.forEach(r -> accountSpend.merge(r.getWeekStart(), r.spendValue(), Double::sum));

        List<ImpactRecord> out = new ArrayList<>(decisions.size());
        for (Decision decision : decisions) {
            out.add(measureDecision(decision, byCampaign, accountSpend, latestRaw, sizing, config));
        }
        log.debug("Measured {} decisions for account {} ({}d before / {}d after{})", out.size(), accountId,
                sizing.beforeDays(), sizing.afterDays(), sizing.fallback() ? ", fallback window" : "");
        return out;
    }

    ImpactRecord measureDecision(Decision decision, Map<String, List<PerformanceRecord>> byCampaign,
                                 NavigableMap<LocalDate, Double> accountSpend, LocalDate latestRaw,
                                 WindowSizing sizing, ImpactConfig config) {
        LocalDate date = decision.getDecisionDate();
        DateRange beforeRange = new DateRange(date.minusDays(sizing.beforeDays()), date.minusDays(1));
        DateRange afterRange = new DateRange(date, date.plusDays(sizing.afterDays() - 1L));
        String term = TargetingText.stripTargetingPrefix(decision.getTargetText());

        WindowMetrics before;
        WindowMetrics after;
        WindowMetrics sourceAfter;
        switch (decision.getDecisionType()) {
            case HARVEST -> {
                String source = StringUtils.defaultIfBlank(decision.getWinnerSourceCampaign(), decision.getCampaignName());
                String destination = StringUtils.defaultIfBlank(decision.getNewCampaignName(), decision.getCampaignName());
                before = window(byCampaign, source, null, term, beforeRange, MatchMode.QUERY);
                after = window(byCampaign, destination, null, term, afterRange, MatchMode.TARGET_OR_QUERY);
                sourceAfter = window(byCampaign, source, null, term, afterRange, MatchMode.QUERY);
            }
            case NEGATIVE -> {
                before = window(byCampaign, decision.getCampaignName(), decision.getAdGroupName(), term, beforeRange, MatchMode.QUERY);
                after = window(byCampaign, decision.getCampaignName(), decision.getAdGroupName(), term, afterRange, MatchMode.QUERY);
                sourceAfter = after;
            }
            default -> {
                String target = TargetingText.normalize(decision.getTargetText());
                before = window(byCampaign, decision.getCampaignName(), decision.getAdGroupName(), target, beforeRange, MatchMode.TARGET);
                after = window(byCampaign, decision.getCampaignName(), decision.getAdGroupName(), target, afterRange, MatchMode.TARGET);
                sourceAfter = after;
            }
        }

        long covered = latestRaw == null ? 0 : Math.min(sizing.afterDays(), Math.max(0, DAYS.between(date, latestRaw) + 1));
        WindowMetrics comparableBefore = covered > 0 && covered < sizing.afterDays()
                ? before.scaled((double) covered / sizing.afterDays())
                : before;

        Counterfactual counterfactual = CounterfactualCalculator.compute(comparableBefore, after, before.clicks(), config);
        MarketTag tag = MarketTagClassifier.classify(counterfactual.expectedTrendPct(), counterfactual.decisionValuePct());
        boolean mature = MaturityGate.isMature(date, sizing.afterDays(), config.getMaturityBufferDays(), latestRaw);

        double beforeAccountSpend = sum(accountSpend, beforeRange);
        double accountSpendChange = beforeAccountSpend > 0 ? sum(accountSpend, afterRange) / beforeAccountSpend - 1.0 : 0.0;
        ValidationStatus status = ValidationClassifier.classify(decision, before, after, sourceAfter,
                accountSpendChange, config);

        double spendAvoided = savesSpend(decision) ? Math.max(0.0, comparableBefore.spend() - after.spend()) : 0.0;
        ConfidenceLevel confidence;
        if (counterfactual.guardrailed() || sizing.fallback()) {
            confidence = ConfidenceLevel.LOW;
        } else if (counterfactual.confidenceWeight() >= 1.0) {
            confidence = ConfidenceLevel.HIGH;
        } else {
            confidence = ConfidenceLevel.MEDIUM;
        }

        return new ImpactRecord(decision.getDecisionId(), decision.getDecisionType(), decision.getTargetText(),
                decision.getCampaignName(), date, before, after, counterfactual.expectedAfterClicks(),
                counterfactual.expectedAfterSales(), counterfactual.expectedTrendPct(),
                counterfactual.actualChangePct(), counterfactual.decisionValuePct(), counterfactual.decisionImpact(),
                tag, mature, status, counterfactual.confidenceWeight(), confidence, counterfactual.guardrailed(),
                spendAvoided, sizing.afterDays(), sizing.fallback());
    }

    private enum MatchMode { TARGET, QUERY, TARGET_OR_QUERY }

    private static WindowMetrics window(Map<String, List<PerformanceRecord>> byCampaign, String campaign,
                                        String adGroup, String term, DateRange range, MatchMode mode) {
        List<PerformanceRecord> matched = byCampaign.getOrDefault(TargetingText.normalize(campaign), List.of()).stream()
                .filter(r -> range.contains(r.getWeekStart()))
                .filter(r -> StringUtils.isBlank(adGroup) || StringUtils.equalsIgnoreCase(StringUtils.trim(r.getAdGroupName()), adGroup.trim()))
                .filter(r -> matches(r, term, mode))
                .toList();
        if (mode == MatchMode.TARGET) {
            // prefer targeting-level rows when search-term rows for the same target were also ingested
            List<PerformanceRecord> targetLevel = matched.stream().filter(r -> StringUtils.isBlank(r.getSearchTerm())).toList();
            if (!targetLevel.isEmpty()) {
                matched = targetLevel;
            }
        }
        return WindowMetrics.of(matched);
    }

    private static boolean matches(PerformanceRecord row, String term, MatchMode mode) {
        boolean targetMatch = TargetingText.normalize(row.getTargetText()).equals(term)
                || TargetingText.stripTargetingPrefix(row.getTargetText()).equals(term);
        boolean queryMatch = TargetingText.stripTargetingPrefix(
                TargetingText.queryOf(row.getSearchTerm(), row.getTargetText())).equals(term);
        return switch (mode) {
            case TARGET -> targetMatch;
            case QUERY -> queryMatch;
            case TARGET_OR_QUERY -> targetMatch || queryMatch;
        };
    }

    private static boolean savesSpend(Decision decision) {
        if (decision.getDecisionType() == DecisionType.NEGATIVE) {
            return true;
        }
        return decision.getDecisionType() == DecisionType.BID_CHANGE
                && NumberUtils.toDouble(decision.getNewValue(), 0.0) < NumberUtils.toDouble(decision.getOldValue(), 0.0);
    }

    private static double sum(NavigableMap<LocalDate, Double> byWeek, DateRange range) {
        return byWeek.subMap(range.start(), true, range.end(), true).values().stream()
                .mapToDouble(Double::doubleValue).sum();
    }
}
