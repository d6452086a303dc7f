package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.enums.NegativeSource;
import lombok.extern.log4j.Log4j2;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Collects exclusions from isolation, bleeder and competitor sources.
 */
@Log4j2
public final class NegativeSelector {

    private static final Comparator<NegativeKey> KEY_ORDER = Comparator.comparing(NegativeKey::campaign)
            .thenComparing(NegativeKey::adGroup)
            .thenComparing(NegativeKey::term);

    private NegativeSelector() {
    }

    public static List<NegativeCandidate> select(List<PerformanceRecord> records, RunContext context,
                                                 List<HarvestCandidate> harvests) {
        List<PerformanceRecord> queries = ReportingLevel.queryView(records);
        List<NegativeCandidate> isolation = isolationNegatives(queries, context.getConfig(), harvests);
        List<NegativeCandidate> bleeders = bleederNegatives(queries, context.getBenchmarks());
        List<NegativeCandidate> competitors = competitorNegatives(queries, context.getCompetitorAsins());
        List<NegativeCandidate> merged = merge(isolation, bleeders, competitors);
        log.info("Negatives: {} isolation, {} bleeders, {} competitor, {} after dedup",
                isolation.size(), bleeders.size(), competitors.size(), merged.size());
        return merged;
    }

    /**
     * Every occurrence of a harvested term outside its winning campaign.
     */
    static List<NegativeCandidate> isolationNegatives(List<PerformanceRecord> records, OptimizerConfig config,
                                                      List<HarvestCandidate> harvests) {
        if (harvests.isEmpty()) {
            return List.of();
        }
        Map<String, HarvestCandidate> byTerm = harvests.stream()
                .collect(Collectors.toMap(HarvestCandidate::term, h -> h, (a, b) -> a));

        Map<NegativeKey, TargetAggregate> groups = new TreeMap<>(KEY_ORDER);
        for (PerformanceRecord row : records) {
            if (!HarvestSelector.isDiscoveryRow(row, config)) {
                continue;
            }
            String term = HarvestSelector.termOf(row);
            HarvestCandidate harvest = byTerm.get(term);
            if (harvest == null || row.getCampaignName().equalsIgnoreCase(harvest.winnerCampaign())) {
                continue;
            }
            groups.computeIfAbsent(NegativeKey.of(row.getCampaignName(), row.getAdGroupName(), term),
                    k -> TargetAggregate.of(row, term)).add(row);
        }

        List<NegativeCandidate> out = new ArrayList<>();
        for (TargetAggregate group : groups.values()) {
            HarvestCandidate harvest = byTerm.get(group.getKey());
            out.add(new NegativeCandidate(group.getCampaignName(), group.getAdGroupName(), group.getKey(),
                    NegativeSource.ISOLATION, "Isolation: harvested to " + harvest.newCampaignName(),
                    group.getClicks(), group.getSpend(), TargetingText.isAsin(group.getKey())));
        }
        return out;
    }

    /**
     * Non-exact search terms with clicks at or above the soft threshold and no sales.
     */
    static List<NegativeCandidate> bleederNegatives(List<PerformanceRecord> records, AccountBenchmarks benchmarks) {
        Map<NegativeKey, TargetAggregate> groups = new TreeMap<>(KEY_ORDER);
        for (PerformanceRecord row : records) {
            if (TargetingText.isExactMatch(row.getMatchType())) {
                continue;
            }
            String term = TargetingText.queryOf(row.getSearchTerm(), row.getTargetText());
            if (TargetingText.isTargetingExpression(term)) {
                continue;
            }
            groups.computeIfAbsent(NegativeKey.of(row.getCampaignName(), row.getAdGroupName(), term),
                    k -> TargetAggregate.of(row, term)).add(row);
        }

        List<NegativeCandidate> out = new ArrayList<>();
        for (TargetAggregate group : groups.values()) {
            if (group.getSales() > 0 || group.getClicks() < benchmarks.softThreshold()) {
                continue;
            }
            boolean hardStop = group.getClicks() >= benchmarks.hardStopThreshold();
            NegativeSource source = hardStop ? NegativeSource.BLEEDER_HARD_STOP : NegativeSource.BLEEDER;
            String reason = String.format(Locale.ROOT, "%s: %d clicks, %.2f spend, 0 sales", source.getLabel(),
                    group.getClicks(), group.getSpend());
            out.add(new NegativeCandidate(group.getCampaignName(), group.getAdGroupName(), group.getKey(), source,
                    reason, group.getClicks(), group.getSpend(), TargetingText.isAsin(group.getKey())));
        }
        return out;
    }

    /**
     * Externally supplied competitor ASINs, excluded wherever they served.
     */
    static List<NegativeCandidate> competitorNegatives(List<PerformanceRecord> records, List<String> competitorAsins) {
        if (competitorAsins == null || competitorAsins.isEmpty()) {
            return List.of();
        }
        Set<String> asins = competitorAsins.stream().map(TargetingText::stripTargetingPrefix).collect(Collectors.toSet());
        Map<NegativeKey, TargetAggregate> groups = new TreeMap<>(KEY_ORDER);
        for (PerformanceRecord row : records) {
            String term = HarvestSelector.termOf(row);
            if (asins.contains(term)) {
                groups.computeIfAbsent(NegativeKey.of(row.getCampaignName(), row.getAdGroupName(), term),
                        k -> TargetAggregate.of(row, term)).add(row);
            }
        }
        return groups.values().stream()
                .map(g -> new NegativeCandidate(g.getCampaignName(), g.getAdGroupName(), g.getKey(),
                        NegativeSource.COMPETITOR_ASIN, "Competitor ASIN", g.getClicks(), g.getSpend(),
                        TargetingText.isAsin(g.getKey())))
                .toList();
    }

    /**
     * First occurrence of each (campaign, ad group, term) wins, in argument order.
     */
    @SafeVarargs
    public static List<NegativeCandidate> merge(List<NegativeCandidate>... sources) {
        Map<NegativeKey, NegativeCandidate> merged = new LinkedHashMap<>();
        for (List<NegativeCandidate> source : sources) {
            for (NegativeCandidate candidate : source) {
                merged.putIfAbsent(candidate.key(), candidate);
            }
        }
        return new ArrayList<>(merged.values());
    }
}
