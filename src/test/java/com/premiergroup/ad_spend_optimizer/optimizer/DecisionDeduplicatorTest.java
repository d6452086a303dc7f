package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.enums.BidBasis;
import com.premiergroup.ad_spend_optimizer.enums.NegativeSource;
import com.premiergroup.ad_spend_optimizer.enums.PerformanceTier;
import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionDeduplicatorTest {

    private static BidRecommendation rec(TargetingBucket bucket, String campaign, String target, double spend, double sales) {
        return new BidRecommendation(bucket, campaign, "AG", target, "exact", 20, 1000, 2, spend, sales,
                sales / spend, 2.5, PerformanceTier.ABOVE_BASELINE, 1.0, 1.1, BidBasis.PROMOTE, "Promote: test");
    }

    @Test
    @DisplayName("best ROAS wins and the others become consolidation negatives")
    void keepsBestRoas() {
        BidRecommendation weak = rec(TargetingBucket.EXACT, "Brand", "shoes", 10, 20);
        BidRecommendation strong = rec(TargetingBucket.EXACT, "Generic", "shoes", 10, 40);
        BidRecommendation unrelated = rec(TargetingBucket.EXACT, "Brand", "boots", 10, 30);

        DeduplicationResult result = DecisionDeduplicator.deduplicate(List.of(weak, strong, unrelated));

        assertThat(result.recommendations()).hasSize(2);
        assertThat(result.recommendations()).extracting(BidRecommendation::campaignName)
                .containsExactly("Generic", "Brand");
        assertThat(result.recommendations().get(0).reason()).endsWith("[Best ROAS among duplicates]");
        assertThat(result.recommendations().get(1)).isSameAs(unrelated);

        assertThat(result.consolidationNegatives()).hasSize(1);
        NegativeCandidate negative = result.consolidationNegatives().get(0);
        assertThat(negative.campaignName()).isEqualTo("Brand");
        assertThat(negative.source()).isEqualTo(NegativeSource.CONSOLIDATION);
        assertThat(negative.reason())
                .isEqualTo("Consolidation: Same keyword exists in Generic with higher ROAS (4.00 vs 2.00)");
    }

    @Test
    @DisplayName("ties on ROAS fall to sales")
    void tieBreakOnSales() {
        BidRecommendation small = rec(TargetingBucket.PRODUCT_TARGETING, "A", "b0abcdefgh", 10, 30);
        BidRecommendation large = rec(TargetingBucket.PRODUCT_TARGETING, "B", "b0abcdefgh", 20, 60);

        DeduplicationResult result = DecisionDeduplicator.deduplicate(List.of(small, large));

        assertThat(result.recommendations()).extracting(BidRecommendation::campaignName).containsExactly("B");
        assertThat(result.consolidationNegatives().get(0).asin()).isTrue();
    }

    @Test
    @DisplayName("auto targets and single-campaign targets are untouched")
    void leavesOthersAlone() {
        List<BidRecommendation> input = List.of(
                rec(TargetingBucket.AUTO, "Auto A", "close-match", 10, 20),
                rec(TargetingBucket.AUTO, "Auto B", "close-match", 10, 40),
                rec(TargetingBucket.EXACT, "Brand", "shoes", 10, 20));

        DeduplicationResult result = DecisionDeduplicator.deduplicate(input);

        assertThat(result.recommendations()).isEqualTo(input);
        assertThat(result.consolidationNegatives()).isEmpty();
    }
}
