package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.enums.NegativeSource;
import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;
import lombok.extern.log4j.Log4j2;

import java.util.*;

/**
 * Keeps one bid recommendation per keyword-identity target when it runs in several campaigns.
 * Auto and category targets share their text across every campaign by construction and are left alone.
 */
@Log4j2
public final class DecisionDeduplicator {

    static final String WINNER_SUFFIX = " [Best ROAS among duplicates]";
    private static final Set<TargetingBucket> DEDUPLICATED_BUCKETS =
            EnumSet.of(TargetingBucket.EXACT, TargetingBucket.PRODUCT_TARGETING, TargetingBucket.BROAD_PHRASE);

    private static final Comparator<BidRecommendation> WINNER_ORDER =
            Comparator.comparingDouble(BidRecommendation::roas)
                    .thenComparingDouble(BidRecommendation::sales)
                    .reversed()
                    .thenComparing(BidRecommendation::campaignName)
                    .thenComparing(BidRecommendation::adGroupName);

    private DecisionDeduplicator() {
    }

    public static DeduplicationResult deduplicate(List<BidRecommendation> recommendations) {
        Map<String, List<BidRecommendation>> byTarget = new LinkedHashMap<>();
        for (BidRecommendation rec : recommendations) {
            if (DEDUPLICATED_BUCKETS.contains(rec.bucket())) {
                byTarget.computeIfAbsent(rec.bucket() + "|" + TargetingText.normalize(rec.targetText()),
                        k -> new ArrayList<>()).add(rec);
            }
        }

        Map<BidRecommendation, String> winners = new IdentityHashMap<>();
        Set<BidRecommendation> losers = Collections.newSetFromMap(new IdentityHashMap<>());
        List<NegativeCandidate> consolidation = new ArrayList<>();
        for (List<BidRecommendation> group : byTarget.values()) {
            long campaigns = group.stream().map(r -> TargetingText.normalize(r.campaignName())).distinct().count();
            if (campaigns < 2) {
                continue;
            }
            List<BidRecommendation> ranked = new ArrayList<>(group);
            ranked.sort(WINNER_ORDER);
            BidRecommendation winner = ranked.get(0);
            winners.put(winner, winner.reason() + WINNER_SUFFIX);
            for (BidRecommendation loser : ranked.subList(1, ranked.size())) {
                losers.add(loser);
                String reason = String.format(Locale.ROOT, "Consolidation: Same keyword exists in %s with higher ROAS (%.2f vs %.2f)",
                        winner.campaignName(), winner.roas(), loser.roas());
                consolidation.add(new NegativeCandidate(loser.campaignName(), loser.adGroupName(), loser.targetText(),
                        NegativeSource.CONSOLIDATION, reason, loser.clicks(), loser.spend(),
                        TargetingText.isAsin(loser.targetText())));
            }
        }

        List<BidRecommendation> kept = new ArrayList<>(recommendations.size() - losers.size());
        for (BidRecommendation rec : recommendations) {
            if (losers.contains(rec)) {
                continue;
            }
            String winnerReason = winners.get(rec);
            kept.add(winnerReason == null ? rec : rec.withReason(winnerReason));
        }
        if (!consolidation.isEmpty()) {
            log.info("Dedup: {} duplicated targets, {} consolidation negatives", winners.size(), consolidation.size());
        }
        return new DeduplicationResult(kept, consolidation);
    }
}
