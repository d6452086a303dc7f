package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * Finds discovery search terms that have earned a dedicated exact-match target.
 */
@Log4j2
public final class HarvestSelector {

    static final double ROAS_RANK_WEIGHT = 5.0;

    private HarvestSelector() {
    }

    public static List<HarvestCandidate> select(List<PerformanceRecord> records, RunContext context) {
        OptimizerConfig config = context.getConfig();
        AccountBenchmarks benchmarks = context.getBenchmarks();

        List<PerformanceRecord> discovery = ReportingLevel.queryView(records).stream()
                .filter(r -> isDiscoveryRow(r, config))
                .filter(r -> isHarvestableTerm(termOf(r)))
                .toList();
        if (discovery.isEmpty()) {
            log.info("Harvest: no discovery rows");
            return List.of();
        }

        double bucketBaseline = BaselineResolver.bucketBaseline(discovery, benchmarks.universalRoas(), config);

        // term -> (campaign|ad group) -> totals
        Map<String, Map<String, TargetAggregate>> byTerm = new TreeMap<>();
        for (PerformanceRecord row : discovery) {
            String term = termOf(row);
            String source = TargetingText.normalize(row.getCampaignName()) + "|" + TargetingText.normalize(row.getAdGroupName());
            byTerm.computeIfAbsent(term, t -> new TreeMap<>())
                    .computeIfAbsent(source, s -> TargetAggregate.of(row, term))
                    .add(row);
        }

        ExactKeywordMatcher matcher = exactKeywordMatcher(records, context);
        int passClicks = 0;
        int passOrders = 0;
        int passRoas = 0;
        int duplicates = 0;
        List<HarvestCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, Map<String, TargetAggregate>> entry : byTerm.entrySet()) {
            String term = entry.getKey();
            Collection<TargetAggregate> sources = entry.getValue().values();
            TargetAggregate total = new TargetAggregate("", "", term, "");
            sources.forEach(total::merge);

            if (total.getClicks() < config.getHarvestClickMin()) {
                continue;
            }
            passClicks++;
            if (total.getOrders() < benchmarks.harvestMinOrders()) {
                continue;
            }
            passOrders++;
            double roas = total.roas();
            double required = requiredRoas(bucketBaseline, benchmarks.universalRoas(), config);
            if (roas < required) {
                continue;
            }
            passRoas++;
            Optional<String> existing = matcher.findMatch(term);
            if (existing.isPresent()) {
                duplicates++;
                log.debug("Harvest: '{}' already runs as exact keyword '{}'", term, existing.get());
                continue;
            }

            TargetAggregate winner = sources.stream()
                    .max(Comparator.comparingDouble(HarvestSelector::rankScore))
                    .orElseThrow();
            double baseBid = BidBook.resolveBaseBid(context.getBidBook().candidates(
                    winner.getCampaignName(), winner.getAdGroupName(), term, total.cpc())).orElse(config.getBidFloor());
            candidates.add(new HarvestCandidate(term, total.getClicks(), total.getOrders(), total.getSpend(),
                    total.getSales(), roas, required, winner.getCampaignName(), winner.getAdGroupName(),
                    winner.getMatchType(), baseBid, baseBid * config.getHarvestLaunchMult(),
                    HarvestCandidate.NEW_CAMPAIGN_PREFIX + winner.getCampaignName()));
        }

        candidates.sort(Comparator.comparingDouble(HarvestCandidate::sales).reversed()
                .thenComparing(HarvestCandidate::term));
        log.info("Harvest: {} terms, {} pass clicks, {} pass orders (min {}), {} pass ROAS (bucket {}), {} already exact, {} selected",
                byTerm.size(), passClicks, passOrders, benchmarks.harvestMinOrders(), passRoas,
                String.format("%.2f", bucketBaseline), duplicates, candidates.size());
        return candidates;
    }

    /**
     * The lower of the bucket bar and the universal bar, so a term at or above the universal
     * baseline is not held back by its bucket.
     */
    public static double requiredRoas(double bucketBaseline, double universalRoas, OptimizerConfig config) {
        double mult = config.getHarvestRoasMult();
        double universalBar = Math.max(universalRoas, universalRoas * mult);
        return Math.min(bucketBaseline * mult, universalBar);
    }

    static double rankScore(TargetAggregate source) {
        return source.getSales() + ROAS_RANK_WEIGHT * source.roas();
    }

    public static boolean isDiscoveryRow(PerformanceRecord row, OptimizerConfig config) {
        return !TargetingText.isExactMatch(row.getMatchType())
                && !TargetingText.isProductMatch(row.getMatchType())
                && !TargetingText.isProductTargeting(TargetingText.normalize(row.getTargetText()))
                && !isHarvestDestination(row.getCampaignName(), config);
    }

    public static boolean isHarvestDestination(String campaignName, OptimizerConfig config) {
        return campaignName != null && config.getHarvestDestinationPattern().matcher(campaignName).find();
    }

    static String termOf(PerformanceRecord row) {
        String raw = StringUtils.isBlank(row.getSearchTerm()) ? row.getTargetText() : row.getSearchTerm();
        return TargetingText.stripTargetingPrefix(raw);
    }

    static boolean isHarvestableTerm(String term) {
        return !term.isEmpty() && !TargetingText.isTargetingExpression(term);
    }

    private static ExactKeywordMatcher exactKeywordMatcher(List<PerformanceRecord> records, RunContext context) {
        List<String> exact = new ArrayList<>(context.getExternalExactKeywords());
        records.stream()
                .filter(r -> TargetingText.isExactMatch(r.getMatchType()))
                .map(PerformanceRecord::getTargetText)
                .forEach(exact::add);
        return new ExactKeywordMatcher(exact, context.getConfig().getDedupeSimilarity());
    }
}
