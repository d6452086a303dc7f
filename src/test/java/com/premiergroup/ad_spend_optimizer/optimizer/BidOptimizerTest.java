package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.dto.BidReference;
import com.premiergroup.ad_spend_optimizer.entity.PerformanceRecord;
import com.premiergroup.ad_spend_optimizer.enums.BidBasis;
import com.premiergroup.ad_spend_optimizer.enums.PerformanceTier;
import com.premiergroup.ad_spend_optimizer.enums.TargetingBucket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static com.premiergroup.ad_spend_optimizer.optimizer.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BidOptimizerTest {

    private static RunContext context(long dataDays, BidReference... bids) {
        return Fixtures.context(config(), benchmarks(2.5, 3, dataDays))
                .bidBook(new BidBook(List.of(bids)))
                .build();
    }

    private static BidRecommendation only(List<BidRecommendation> recs, String target) {
        return recs.stream().filter(r -> r.targetText().equals(target)).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        @DisplayName("explicit bid is the base and strong ROAS promotes")
        void promotesFromExplicitBid() {
            List<PerformanceRecord> rows = List.of(row("Brand", "AG", "Running Shoes", "", "exact", 10, 30, 20, 1000, 2));
            RunContext ctx = context(7, new BidReference("Brand", "AG", "running shoes", new BigDecimal("1.00"), null));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, ctx, Set.of(), Set.of()), "running shoes");

            assertThat(rec.bucket()).isEqualTo(TargetingBucket.EXACT);
            assertThat(rec.baseBid()).isEqualTo(1.0);
            assertThat(rec.newBid()).isCloseTo(1.1, within(1e-9));
            assertThat(rec.basis()).isEqualTo(BidBasis.PROMOTE);
            assertThat(rec.tier()).isEqualTo(PerformanceTier.ABOVE_BASELINE);
            assertThat(rec.reason()).startsWith("Promote:");
            assertThat(rec.isActionable()).isTrue();
        }

        @Test
        @DisplayName("a keyword reported at targeting level and by search term is bid on its targeting row only")
        void targetRowNotDoubleCounted() {
            List<PerformanceRecord> rows = List.of(
                    row("Broad", "AG", "shoes", "", "broad", 6, 18, 6, 1000, 1),
                    row("Broad", "AG", "shoes", "shoes", "broad", 6, 18, 6, 1000, 1));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, context(7), Set.of(), Set.of()), "shoes");

            assertThat(rec.clicks()).isEqualTo(6);
            assertThat(rec.spend()).isEqualTo(6.0);
            assertThat(rec.basis()).isEqualTo(BidBasis.HOLD_INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("observed CPC is the last base-bid fallback")
        void cpcFallback() {
            List<PerformanceRecord> rows = List.of(row("Brand", "AG", "shoes", "", "exact", 20, 20, 10, 1000, 1));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, context(7), Set.of(), Set.of()), "shoes");

            assertThat(rec.baseBid()).isEqualTo(2.0);
            assertThat(rec.basis()).isEqualTo(BidBasis.BID_DOWN);
            assertThat(rec.newBid()).isLessThan(2.0);
        }

        @Test
        @DisplayName("no bid and no clicks holds with an explicit reason")
        void holdNoBidData() {
            List<PerformanceRecord> rows = List.of(row("Brand", "AG", "shoes", "", "exact", 0, 0, 0, 1000, 0));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, context(7), Set.of(), Set.of()), "shoes");

            assertThat(rec.basis()).isEqualTo(BidBasis.HOLD_NO_BID_DATA);
            assertThat(rec.reason()).isEqualTo("Hold: no bid/CPC data");
            assertThat(rec.isActionable()).isFalse();
        }

        @Test
        @DisplayName("too few clicks at target and ad group holds the bid")
        void holdInsufficientData() {
            List<PerformanceRecord> rows = List.of(row("Brand", "AG", "shoes", "", "exact", 3, 9, 3, 1000, 1));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, context(7), Set.of(), Set.of()), "shoes");

            assertThat(rec.basis()).isEqualTo(BidBasis.HOLD_INSUFFICIENT_DATA);
            assertThat(rec.reason()).isEqualTo("Hold: insufficient data (3 clicks)");
            assertThat(rec.newBid()).isEqualTo(rec.baseBid());
        }

        @Test
        @DisplayName("sparse target borrows ad-group ROAS at half throttle")
        void adGroupFallback() {
            List<PerformanceRecord> rows = List.of(
                    row("Brand", "AG", "sparse", "", "exact", 2, 10, 2, 1000, 1),
                    row("Brand", "AG", "dense", "", "exact", 10, 40, 10, 1000, 3));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, context(7), Set.of(), Set.of()), "sparse");

            // ad group ROAS 50 / 12; gap 2/3; adjustment 2/3 * 0.5 * 0.5
            assertThat(rec.baseBid()).isEqualTo(1.0);
            assertThat(rec.newBid()).isCloseTo(1.0 + (50.0 / 12 / 2.5 - 1) * 0.25, within(1e-9));
            assertThat(rec.reason()).startsWith("Ad group fallback: Promote");
        }

        @Test
        @DisplayName("low impressions over two weeks of data triggers the visibility boost")
        void visibilityBoost() {
            List<PerformanceRecord> rows = List.of(row("Brand", "AG", "shoes", "", "exact", 10, 5, 10, 50, 1));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, context(21), Set.of(), Set.of()), "shoes");

            assertThat(rec.basis()).isEqualTo(BidBasis.VISIBILITY_BOOST);
            assertThat(rec.reason()).contains("insufficient auction visibility");
            assertThat(rec.newBid()).isCloseTo(1.25, within(1e-9));
        }

        @Test
        @DisplayName("visibility boost waits for enough days of data")
        void noVisibilityBoostOnShortHistory() {
            List<PerformanceRecord> rows = List.of(row("Brand", "AG", "shoes", "", "exact", 10, 5, 10, 50, 1));

            BidRecommendation rec = only(BidOptimizer.optimize(rows, context(7), Set.of(), Set.of()), "shoes");

            assertThat(rec.basis()).isEqualTo(BidBasis.BID_DOWN);
        }
    }

    @Nested
    @DisplayName("bucketing")
    class Bucketing {

        @Test
        @DisplayName("each target lands in exactly one bucket")
        void mutuallyExclusive() {
            List<PerformanceRecord> rows = List.of(
                    row("Auto", "AG", "close-match", "red shoes", "-", 10, 30, 10, 1000, 1),
                    row("Auto", "AG", "close-match", "blue shoes", "-", 10, 30, 10, 1000, 1),
                    row("PT", "AG", "asin=\"B0ABCDEFGH\"", "", "targeting expression", 10, 30, 10, 1000, 1),
                    row("Cat", "AG", "category=\"Shoes\"", "", "targeting expression", 10, 30, 10, 1000, 1),
                    row("Broad", "AG", "shoes", "red shoes", "broad", 10, 30, 10, 1000, 1),
                    row("Exact", "AG", "shoes", "", "exact", 10, 30, 10, 1000, 1));

            List<BidRecommendation> recs = BidOptimizer.optimize(rows, context(7), Set.of(), Set.of());

            assertThat(recs).hasSize(5);
            assertThat(recs).extracting(BidRecommendation::bucket).containsExactlyInAnyOrder(
                    TargetingBucket.AUTO, TargetingBucket.PRODUCT_TARGETING, TargetingBucket.CATEGORY,
                    TargetingBucket.BROAD_PHRASE, TargetingBucket.EXACT);
            assertThat(only(recs, "close-match").clicks()).isEqualTo(20);
        }

        @Test
        @DisplayName("harvested and negated search terms are excluded")
        void exclusions() {
            List<PerformanceRecord> rows = List.of(
                    row("Broad", "AG", "shoes", "red shoes", "broad", 10, 30, 10, 1000, 1),
                    row("Broad", "AG", "shoes", "blue shoes", "broad", 10, 0, 10, 1000, 0),
                    row("Broad", "AG", "shoes", "green shoes", "broad", 10, 30, 10, 1000, 1));

            List<BidRecommendation> recs = BidOptimizer.optimize(rows, context(7), Set.of("red shoes"),
                    Set.of(NegativeKey.of("broad", "ag", "blue shoes")));

            assertThat(only(recs, "shoes").clicks()).isEqualTo(10);
        }

        @Test
        @DisplayName("unchanged snapshot gives identical recommendations")
        void idempotent() {
            List<PerformanceRecord> rows = List.of(
                    row("B", "AG", "zeta", "", "exact", 10, 30, 10, 1000, 1),
                    row("A", "AG", "alpha", "", "exact", 10, 10, 10, 1000, 1),
                    row("A", "AG2", "beta", "", "phrase", 7, 30, 12, 1000, 2));

            List<BidRecommendation> first = BidOptimizer.optimize(rows, context(7), Set.of(), Set.of());
            List<BidRecommendation> second = BidOptimizer.optimize(rows, context(7), Set.of(), Set.of());

            assertThat(second).isEqualTo(first);
        }
    }
}
