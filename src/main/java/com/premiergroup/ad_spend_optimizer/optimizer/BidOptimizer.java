package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.enums.BidBasis;
import com.premiergroup.ad_spend_optimizer.enums.PerformanceTier;
import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * Produces one bid recommendation per (campaign, ad group, target) within each targeting bucket.
 */
@Log4j2
public final class BidOptimizer {

    static final double AD_GROUP_THROTTLE_SCALE = 0.5;
    private static final Set<String> VISIBILITY_MATCH_TYPES = Set.of("exact", "phrase", "broad");

    private BidOptimizer() {
    }

    /**
     * @param harvestedTerms terms promoted in this run; their search-term rows no longer count toward the source target
     * @param negativeKeys   (campaign, ad group, term) groups negated in this run
     */
    public static List<BidRecommendation> optimize(List<PerformanceRecord> records, RunContext context,
                                                   Set<String> harvestedTerms, Set<NegativeKey> negativeKeys) {
        Map<TargetingBucket, List<PerformanceRecord>> buckets = new EnumMap<>(TargetingBucket.class);
        for (PerformanceRecord record : ReportingLevel.targetView(records)) {
            if (isExcluded(record, harvestedTerms, negativeKeys)) {
                continue;
            }
            BucketClassifier.classify(record)
                    .ifPresent(bucket -> buckets.computeIfAbsent(bucket, b -> new ArrayList<>()).add(record));
        }

        List<BidRecommendation> recommendations = new ArrayList<>();
        buckets.forEach((bucket, rows) -> recommendations.addAll(optimizeBucket(bucket, rows, context)));
        return recommendations;
    }

    static List<BidRecommendation> optimizeBucket(TargetingBucket bucket, List<PerformanceRecord> rows,
                                                  RunContext context) {
        OptimizerConfig config = context.getConfig();
        double universal = context.getBenchmarks().universalRoas();
        double baseline = BaselineResolver.floored(BaselineResolver.bucketBaseline(rows, universal, config), config);

        // sorted keys keep output order stable across runs
        Map<String, TargetAggregate> targets = new TreeMap<>();
        Map<String, TargetAggregate> adGroups = new HashMap<>();
        for (PerformanceRecord row : rows) {
            String target = TargetingText.normalize(row.getTargetText());
            String adGroupKey = TargetingText.normalize(row.getCampaignName()) + "|" + TargetingText.normalize(row.getAdGroupName());
            targets.computeIfAbsent(adGroupKey + "|" + target, k -> TargetAggregate.of(row, target)).add(row);
            adGroups.computeIfAbsent(adGroupKey, k -> TargetAggregate.of(row, "")).add(row);
        }

        List<BidRecommendation> out = new ArrayList<>(targets.size());
        int holds = 0;
        for (TargetAggregate target : targets.values()) {
            TargetAggregate adGroup = adGroups.get(TargetingText.normalize(target.getCampaignName()) + "|"
                    + TargetingText.normalize(target.getAdGroupName()));
            BidRecommendation rec = recommend(bucket, target, adGroup, baseline, context);
            if (rec.basis().isHold()) {
                holds++;
            }
            out.add(rec);
        }
        log.info("Bucket {}: {} targets, baseline ROAS {}, {} held", bucket, out.size(),
                String.format("%.2f", baseline), holds);
        return out;
    }

    static BidRecommendation recommend(TargetingBucket bucket, TargetAggregate target, TargetAggregate adGroup,
                                       double baseline, RunContext context) {
        OptimizerConfig config = context.getConfig();
        OptionalDouble resolved = BidBook.resolveBaseBid(context.getBidBook().candidates(
                target.getCampaignName(), target.getAdGroupName(), target.getKey(), target.cpc()));

        if (resolved.isEmpty()) {
            return build(bucket, target, baseline, PerformanceTier.UNCLASSIFIED, 0.0,
                    new BidOutcome(0.0, BidBasis.HOLD_NO_BID_DATA, 0.0, 0.0, ""), "Hold: no bid/CPC data");
        }
        double baseBid = resolved.getAsDouble();

        if (isVisibilityStarved(target, context)) {
            BidOutcome outcome = BidCalculator.visibilityBoost(baseBid, config);
            String reason = String.format(Locale.ROOT, "Visibility boost: insufficient auction visibility (%d impressions in %d days)",
                    target.getImpressions(), context.getBenchmarks().dataDays());
            return build(bucket, target, baseline, PerformanceTier.UNCLASSIFIED, baseBid, outcome,
                    withNote(reason, outcome));
        }

        int minClicks = config.minClicks(bucket);
        double roas = target.roas();
        if (target.getClicks() >= minClicks && roas > 0) {
            BidOutcome outcome = BidCalculator.formulaBid(baseBid, roas, config, 1.0);
            return build(bucket, target, baseline, PerformanceTier.of(roas, baseline), baseBid, outcome,
                    withNote(formulaReason(outcome, roas, config), outcome));
        }

        if (adGroup != null && adGroup.getClicks() >= minClicks && adGroup.roas() > 0) {
            double adGroupRoas = adGroup.roas();
            BidOutcome outcome = BidCalculator.formulaBid(baseBid, adGroupRoas, config, AD_GROUP_THROTTLE_SCALE);
            return build(bucket, target, baseline, PerformanceTier.of(adGroupRoas, baseline), baseBid, outcome,
                    withNote("Ad group fallback: " + formulaReason(outcome, adGroupRoas, config), outcome));
        }

        return build(bucket, target, baseline, PerformanceTier.UNCLASSIFIED, baseBid,
                new BidOutcome(baseBid, BidBasis.HOLD_INSUFFICIENT_DATA, 0.0, 0.0, ""),
                "Hold: insufficient data (" + target.getClicks() + " clicks)");
    }

    static boolean isVisibilityStarved(TargetAggregate target, RunContext context) {
        OptimizerConfig config = context.getConfig();
        String match = TargetingText.normalize(target.getMatchType());
        boolean eligible = VISIBILITY_MATCH_TYPES.contains(match) || target.getKey().equals("close-match");
        return eligible
                && context.getBenchmarks().dataDays() >= config.getVisibilityMinDataDays()
                && target.getImpressions() < config.getVisibilityMaxImpressions();
    }

    private static String formulaReason(BidOutcome outcome, double roas, OptimizerConfig config) {
        return switch (outcome.basis()) {
            case PROMOTE -> String.format(Locale.ROOT, "Promote: ROAS %.2f vs target %.2f", roas, config.getTargetRoas());
            case BID_DOWN -> String.format(Locale.ROOT, "Bid Down: ROAS %.2f vs target %.2f", roas, config.getTargetRoas());
            default -> "Stable: ROAS matches target";
        };
    }

    private static String withNote(String reason, BidOutcome outcome) {
        return outcome.clampNote().isEmpty() ? reason : reason + " " + outcome.clampNote();
    }

    private static BidRecommendation build(TargetingBucket bucket, TargetAggregate target, double baseline,
                                           PerformanceTier tier, double baseBid, BidOutcome outcome, String reason) {
        return new BidRecommendation(bucket, target.getCampaignName(), target.getAdGroupName(), target.getKey(),
                target.getMatchType(), target.getClicks(), target.getImpressions(), target.getOrders(),
                target.getSpend(), target.getSales(), target.roas(), baseline, tier, baseBid, outcome.newBid(),
                outcome.basis(), reason);
    }

    private static boolean isExcluded(PerformanceRecord record, Set<String> harvestedTerms, Set<NegativeKey> negativeKeys) {
        String query = TargetingText.queryOf(record.getSearchTerm(), record.getTargetText());
        if (negativeKeys.contains(NegativeKey.of(record.getCampaignName(), record.getAdGroupName(), query))) {
            return true;
        }
        return !TargetingText.isExactMatch(record.getMatchType())
                && StringUtils.isNotBlank(record.getSearchTerm())
                && harvestedTerms.contains(TargetingText.stripTargetingPrefix(record.getSearchTerm()));
    }
}
